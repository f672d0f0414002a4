package io.kartlink.uplink;

import io.kartlink.bus.BusAdapter;
import io.kartlink.bus.BusCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes uplink status on the bus as SYSTEM_MONITOR / UPLINK_MANAGER
 * STATUS frames.
 */
public final class BusUplinkStatusReporter implements UplinkStatusListener {
    private static final Logger log = LoggerFactory.getLogger(BusUplinkStatusReporter.class);
    private static final int UINT16_MAX = 0xFFFF;

    private final BusAdapter bus;

    public BusUplinkStatusReporter(BusAdapter bus) {
        this.bus = bus;
    }

    @Override
    public void onStatus(UplinkStatus status) {
        send("UPLINK_STATUS", "UINT8", status.state().ordinal());
        send("UPLINK_QUEUE_SIZE", "UINT16", clamp(status.pendingAcks()));
        send("UPLINK_AVG_LATENCY_MS", "UINT16", clamp(Math.round(status.averageLatencyMs())));
    }

    private void send(String command, String valueType, long value) {
        BusCommand frame = BusCommand.broadcast("STATUS", "SYSTEM_MONITOR", "UPLINK_MANAGER", command, valueType, value);
        if (!bus.sendCommand(frame)) {
            log.warn("Failed to report {} on the bus", command);
        }
    }

    private static long clamp(long value) {
        return Math.max(0L, Math.min(UINT16_MAX, value));
    }
}
