package io.kartlink.timesync;

import io.kartlink.bus.BusAdapter;
import io.kartlink.bus.BusCommand;
import io.kartlink.bus.BusFrame;
import io.kartlink.bus.HandlerKey;
import io.kartlink.config.CollectorSettings;
import io.kartlink.model.TelemetryEvent;
import io.kartlink.protocol.ProtocolCatalog;
import io.kartlink.protocol.ProtocolIds;
import io.kartlink.runtime.StopSignal;
import io.kartlink.storage.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broadcasts time-stamped PINGs on the bus and turns the PONG replies into
 * per-node round-trip estimates. Every accepted reply is answered with a
 * SET_TIME addressed to the replying node. Each PING carries the estimated
 * one-way delay derived from the current RTT averages.
 *
 * <p>PINGs are correlated by their 24-bit millisecond value. The PONG handler
 * runs on the bus pump thread; all shared state is guarded by {@code lock}.
 */
public final class PingBroadcaster implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(PingBroadcaster.class);
    private static final long UINT16_MAX = 0xFFFFL;

    private final BusAdapter bus;
    private final TelemetryStore store;
    private final Clock clock;
    private final StopSignal stop;
    private final long intervalMs;
    private final long maxPingAgeMs;
    private final long pruneIntervalMs;
    private final int windowSize;
    private final int statusMessageType;
    private final int systemMonitorType;
    private final int rttCommandId;
    private final int rttValueType;

    private final Object lock = new Object();
    private final LinkedHashMap<Integer, Long> pendingPings = new LinkedHashMap<>();
    private final Map<Integer, RttWindow> windows = new TreeMap<>();
    private long lastPruneMs;

    private final AtomicLong pingsSent = new AtomicLong();
    private final AtomicLong pongsMatched = new AtomicLong();
    private final AtomicLong pongsUnmatched = new AtomicLong();
    private final AtomicLong clockAnomalies = new AtomicLong();
    private final AtomicLong collisions = new AtomicLong();
    private final AtomicLong setTimeSent = new AtomicLong();

    public PingBroadcaster(BusAdapter bus, ProtocolCatalog catalog, TelemetryStore store,
                           CollectorSettings settings, Clock clock, StopSignal stop) {
        this.bus = bus;
        this.store = store;
        this.clock = clock;
        this.stop = stop;
        this.intervalMs = Math.max(1L, settings.pingIntervalMs());
        this.maxPingAgeMs = settings.maxPingAgeMs();
        this.pruneIntervalMs = settings.pingPruneIntervalMs();
        this.windowSize = settings.rttWindowSize();
        this.statusMessageType = catalog.requireMessageTypeId("STATUS");
        this.systemMonitorType = catalog.requireComponentTypeId("SYSTEM_MONITOR");
        this.rttCommandId = catalog.requireCommandId("SYSTEM_MONITOR", "ROUNDTRIPTIME_MS");
        this.rttValueType = catalog.valueTypeId("UINT16").orElse(ProtocolIds.VALUE_UINT16);
        int pongCommandId = catalog.requireCommandId("SYSTEM_MONITOR", "PONG");
        bus.registerHandler(
                HandlerKey.of(statusMessageType, systemMonitorType, ProtocolIds.WILDCARD, pongCommandId),
                this::handlePong
        );
    }

    @Override
    public void run() {
        log.info("Ping broadcaster started, interval={} ms", intervalMs);
        try {
            do {
                try {
                    tick();
                } catch (RuntimeException e) {
                    log.error("Ping broadcast failed", e);
                }
            } while (!stop.await(intervalMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Ping broadcaster stopped");
    }

    /**
     * Sends one PING stamped with the current time.
     *
     * @return the 24-bit value carried by the PING
     */
    public int tick() {
        long now = clock.millis();
        int value = (int) (now & ProtocolIds.UINT24_MASK);
        int delayMs;
        synchronized (lock) {
            delayMs = estimatedDelayLocked();
            Long previous = pendingPings.remove(value);
            pendingPings.put(value, now);
            if (previous != null) {
                collisions.incrementAndGet();
                log.warn("PING value {} still pending from {} ms, replacing it", value, previous);
            }
            if (now - lastPruneMs >= pruneIntervalMs) {
                prunePending(now);
                lastPruneMs = now;
            }
        }
        BusCommand ping = BusCommand.broadcast("COMMAND", "SYSTEM_MONITOR", "TIME_MASTER", "PING", "UINT24", value)
                .withDelay(delayMs);
        if (bus.sendCommand(ping)) {
            pingsSent.incrementAndGet();
            log.debug("Sent PING {} with estimated delay {} ms", value, delayMs);
        } else {
            log.warn("Failed to send PING {}", value);
        }
        return value;
    }

    void handlePong(BusFrame frame) {
        long now = clock.millis();
        int node = frame.sourceNodeId();
        int value = (int) (frame.value() & ProtocolIds.UINT24_MASK);
        Long sentAt;
        synchronized (lock) {
            sentAt = pendingPings.remove(value);
        }
        if (sentAt == null) {
            pongsUnmatched.incrementAndGet();
            log.warn("PONG from node {} echoes unknown PING value {}, discarding", node, value);
            return;
        }
        long rtt = now - sentAt;
        try {
            recordSample(node, rtt);
        } catch (ClockAnomalyException e) {
            clockAnomalies.incrementAndGet();
            log.warn(e.getMessage());
            return;
        }
        pongsMatched.incrementAndGet();

        long oneWay = rtt / 2;
        long target = (now + oneWay) & ProtocolIds.UINT24_MASK;
        BusCommand setTime = BusCommand.broadcast("COMMAND", "SYSTEM_MONITOR", "TIME_MASTER", "SET_TIME", "UINT24", target)
                .to(node);
        if (bus.sendCommand(setTime)) {
            setTimeSent.incrementAndGet();
        } else {
            log.warn("Failed to send SET_TIME to node {}", node);
        }
        log.debug("PONG from node {}: rtt={} ms, SET_TIME {}", node, rtt, target);
        storeRtt(now, node, rtt);
    }

    private void recordSample(int node, long rttMs) throws ClockAnomalyException {
        if (rttMs < 0) {
            throw new ClockAnomalyException(node, rttMs);
        }
        synchronized (lock) {
            windows.computeIfAbsent(node, n -> new RttWindow(windowSize)).add(rttMs);
        }
    }

    private void storeRtt(long now, int node, long rttMs) {
        store.append(new TelemetryEvent(
                now,
                now,
                statusMessageType,
                systemMonitorType,
                node,
                rttCommandId,
                rttValueType,
                Math.min(UINT16_MAX, rttMs)
        ));
    }

    /**
     * Half the mean of the per-node RTT averages, clamped to what a PING frame
     * can carry. 0 until some node has answered.
     */
    public int estimatedDelayMs() {
        synchronized (lock) {
            return estimatedDelayLocked();
        }
    }

    private int estimatedDelayLocked() {
        double sum = 0.0d;
        int nodes = 0;
        for (RttWindow w : windows.values()) {
            if (w.size() > 0) {
                sum += w.average();
                nodes++;
            }
        }
        if (nodes == 0) {
            return 0;
        }
        long oneWay = (long) (sum / nodes / 2.0d);
        return (int) Math.max(0L, Math.min(BusCommand.MAX_DELAY_MS, oneWay));
    }

    private void prunePending(long now) {
        long cutoff = now - maxPingAgeMs;
        int removed = 0;
        Iterator<Map.Entry<Integer, Long>> it = pendingPings.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() >= cutoff) {
                break;
            }
            it.remove();
            removed++;
        }
        if (removed > 0) {
            log.debug("Pruned {} expired PINGs", removed);
        }
    }

    public OptionalDouble rttEstimateMs(int nodeId) {
        synchronized (lock) {
            RttWindow window = windows.get(nodeId);
            return window == null || window.size() == 0
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(window.average());
        }
    }

    public Map<Integer, RttEstimate> rttEstimates() {
        Map<Integer, RttEstimate> out = new TreeMap<>();
        synchronized (lock) {
            for (Map.Entry<Integer, RttWindow> e : windows.entrySet()) {
                RttWindow w = e.getValue();
                out.put(e.getKey(), new RttEstimate(w.average(), w.size(), w.last()));
            }
        }
        return out;
    }

    public int pendingPingCount() {
        synchronized (lock) {
            return pendingPings.size();
        }
    }

    public Stats stats() {
        return new Stats(
                pingsSent.get(),
                pongsMatched.get(),
                pongsUnmatched.get(),
                clockAnomalies.get(),
                collisions.get(),
                setTimeSent.get(),
                pendingPingCount(),
                estimatedDelayMs()
        );
    }

    public record RttEstimate(double averageMs, int samples, long lastMs) {}

    public record Stats(long pingsSent, long pongsMatched, long pongsUnmatched, long clockAnomalies,
                        long collisions, long setTimeSent, int pendingPings, int estimatedDelayMs) {}
}
