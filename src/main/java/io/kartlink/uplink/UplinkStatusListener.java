package io.kartlink.uplink;

/**
 * Receives uplink status snapshots on state changes and on every status interval.
 */
@FunctionalInterface
public interface UplinkStatusListener {
    void onStatus(UplinkStatus status);
}
