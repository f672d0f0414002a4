package io.kartlink.bus;

import io.kartlink.model.TelemetryEvent;
import io.kartlink.protocol.ProtocolCatalog;
import io.kartlink.storage.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists every STATUS frame seen on the bus. PONG replies belong to the
 * time sync and are skipped.
 */
public final class TelemetryIngest implements BusFrameHandler {
    private static final Logger log = LoggerFactory.getLogger(TelemetryIngest.class);
    private static final int NO_ID = -1;

    private final TelemetryStore store;
    private final Clock clock;
    private final AtomicLong stored = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final int statusMessageType;
    private final int systemMonitorType;
    private final int pongCommandId;

    public TelemetryIngest(TelemetryStore store, ProtocolCatalog catalog, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.statusMessageType = catalog.requireMessageTypeId("STATUS");
        this.systemMonitorType = catalog.componentTypeId("SYSTEM_MONITOR").orElse(NO_ID);
        this.pongCommandId = catalog.commandId("SYSTEM_MONITOR", "PONG").orElse(NO_ID);
    }

    public void register(BusAdapter bus) {
        bus.registerHandler(HandlerKey.allOf(statusMessageType), this);
    }

    @Override
    public void onFrame(BusFrame frame) {
        if (isPong(frame)) {
            return;
        }
        long now = clock.millis();
        TelemetryEvent event = new TelemetryEvent(
                now - Math.max(0L, frame.timestampDeltaMs()),
                now,
                frame.messageType(),
                frame.componentType(),
                frame.componentId(),
                frame.commandId(),
                frame.valueType(),
                frame.value()
        );
        OptionalLong id = store.append(event);
        if (id.isPresent()) {
            stored.incrementAndGet();
        } else {
            failed.incrementAndGet();
            log.debug("Dropped frame from node {} after store failure", frame.sourceNodeId());
        }
    }

    public long storedCount() {
        return stored.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private boolean isPong(BusFrame frame) {
        return frame.componentType() == systemMonitorType && frame.commandId() == pongCommandId;
    }
}
