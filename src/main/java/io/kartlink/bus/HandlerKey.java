package io.kartlink.bus;

import io.kartlink.protocol.ProtocolIds;

/**
 * Subscription filter for inbound frames. {@link ProtocolIds#WILDCARD} in any
 * field matches every value.
 */
public record HandlerKey(int messageType, int componentType, int componentId, int commandId) {

    public static HandlerKey of(int messageType, int componentType, int componentId, int commandId) {
        return new HandlerKey(messageType, componentType, componentId, commandId);
    }

    public static HandlerKey allOf(int messageType) {
        return new HandlerKey(messageType, ProtocolIds.WILDCARD, ProtocolIds.WILDCARD, ProtocolIds.WILDCARD);
    }

    public boolean matches(BusFrame frame) {
        return field(messageType, frame.messageType())
                && field(componentType, frame.componentType())
                && field(componentId, frame.componentId())
                && field(commandId, frame.commandId());
    }

    private static boolean field(int expected, int actual) {
        return expected == ProtocolIds.WILDCARD || expected == actual;
    }
}
