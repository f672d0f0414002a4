package io.kartlink.bus;

import java.util.OptionalInt;

/**
 * Outbound message addressed by symbolic names. The adapter resolves the
 * names through its protocol catalog before framing.
 *
 * @param delayMs sender-side delay in milliseconds carried in the frame's
 *                timestamp field, 0..255
 */
public record BusCommand(
        String messageType,
        String componentType,
        String componentName,
        String commandName,
        String valueType,
        long value,
        Integer destinationNode,
        int delayMs
) {
    public static final int MAX_DELAY_MS = 0xFF;

    public BusCommand {
        if (delayMs < 0 || delayMs > MAX_DELAY_MS) {
            throw new IllegalArgumentException("delayMs must be within 0.." + MAX_DELAY_MS + ": " + delayMs);
        }
    }

    public static BusCommand broadcast(String messageType, String componentType, String componentName,
                                       String commandName, String valueType, long value) {
        return new BusCommand(messageType, componentType, componentName, commandName, valueType, value, null, 0);
    }

    public BusCommand to(int node) {
        return new BusCommand(messageType, componentType, componentName, commandName, valueType, value, node, delayMs);
    }

    public BusCommand withDelay(int newDelayMs) {
        return new BusCommand(messageType, componentType, componentName, commandName, valueType, value,
                destinationNode, newDelayMs);
    }

    public OptionalInt destination() {
        return destinationNode == null ? OptionalInt.empty() : OptionalInt.of(destinationNode);
    }
}
