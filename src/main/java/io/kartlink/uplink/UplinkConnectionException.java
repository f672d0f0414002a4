package io.kartlink.uplink;

import java.io.IOException;

/**
 * The uplink connection could not be opened or was lost.
 */
public class UplinkConnectionException extends IOException {
    public UplinkConnectionException(String message) {
        super(message);
    }

    public UplinkConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
