package io.kartlink.uplink;

import java.net.URI;
import java.time.Duration;

/**
 * Opens message connections to the remote collector.
 */
public interface UplinkTransport {
    UplinkConnection connect(URI remote, Duration timeout) throws UplinkConnectionException;
}
