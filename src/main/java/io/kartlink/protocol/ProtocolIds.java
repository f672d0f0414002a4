package io.kartlink.protocol;

/**
 * Numeric ids of the bus protocol entries the collector itself speaks.
 */
public final class ProtocolIds {
    public static final int WILDCARD = 0xFF;
    public static final int GROUP_ALL = 0xFF;
    public static final int UINT24_MASK = 0xFFFFFF;

    public static final int MESSAGE_COMMAND = 0;
    public static final int MESSAGE_STATUS = 1;
    public static final int MESSAGE_ACK = 2;
    public static final int MESSAGE_ERROR = 3;

    public static final int COMPONENT_TYPE_SYSTEM_MONITOR = 5;

    public static final int SYSTEM_MONITOR_UPLINK_MANAGER = 3;
    public static final int SYSTEM_MONITOR_TIME_MASTER = 4;

    public static final int COMMAND_UPLINK_STATUS = 0;
    public static final int COMMAND_UPLINK_QUEUE_SIZE = 1;
    public static final int COMMAND_UPLINK_AVG_LATENCY_MS = 2;
    public static final int COMMAND_PING = 4;
    public static final int COMMAND_PONG = 5;
    public static final int COMMAND_ROUNDTRIPTIME_MS = 6;
    public static final int COMMAND_SET_TIME = 7;

    public static final int VALUE_UINT8 = 2;
    public static final int VALUE_UINT16 = 4;
    public static final int VALUE_UINT24 = 6;

    private ProtocolIds() {
    }
}
