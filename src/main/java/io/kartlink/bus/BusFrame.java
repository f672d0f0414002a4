package io.kartlink.bus;

/**
 * One inbound frame as decoded by the bus adapter.
 *
 * @param sourceNodeId     node that emitted the frame
 * @param timestampDeltaMs how long ago, relative to reception, the sender recorded the value
 */
public record BusFrame(
        int sourceNodeId,
        int messageType,
        int componentType,
        int componentId,
        int commandId,
        int valueType,
        long value,
        long timestampDeltaMs
) {
}
