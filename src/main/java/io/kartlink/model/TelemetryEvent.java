package io.kartlink.model;

public record TelemetryEvent(
        long recordedAtMs,
        long receivedAtMs,
        int messageType,
        int componentType,
        int componentId,
        int commandId,
        int valueType,
        long value
) {
    public static TelemetryEvent receivedNow(long nowMs, int messageType, int componentType, int componentId,
                                             int commandId, int valueType, long value) {
        return new TelemetryEvent(nowMs, nowMs, messageType, componentType, componentId, commandId, valueType, value);
    }
}
