package io.kartlink.model;

/**
 * Connection state of the uplink. The ordinal is the wire value of the
 * {@code UPLINK_STATUS} bus report.
 */
public enum UplinkState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Last connect attempt failed; cleared by the next attempt. */
    ERROR
}
