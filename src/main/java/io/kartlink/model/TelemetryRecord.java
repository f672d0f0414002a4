package io.kartlink.model;

/**
 * One persisted bus event. {@code id} and {@code createdAtMs} are assigned by
 * the store; {@code uploaded} flips to true once a collector acknowledged it.
 */
public record TelemetryRecord(
        long id,
        long recordedAtMs,
        long receivedAtMs,
        long createdAtMs,
        int messageType,
        int componentType,
        int componentId,
        int commandId,
        int valueType,
        long value,
        boolean uploaded
) {
}
