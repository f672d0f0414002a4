package io.kartlink.uplink;

import io.kartlink.config.CollectorSettings;
import io.kartlink.model.TelemetryRecord;
import io.kartlink.model.UplinkState;
import io.kartlink.runtime.StopSignal;
import io.kartlink.storage.StorageException;
import io.kartlink.storage.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams un-uploaded records to the remote collector and retires them once
 * acknowledged.
 *
 * <p>Each connection runs three units in one group: a sender draining the
 * store, a receiver consuming acknowledgments, and periodic maintenance. The
 * first unit to finish or fail ends the group and the connection; pending
 * acknowledgments are discarded and the un-acknowledged records go out again
 * after the reconnect. Within one connection a record left unacknowledged for
 * {@code resendAfterMs} is sent again.
 */
public final class UplinkManager implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(UplinkManager.class);
    private static final int LATENCY_SAMPLE_LIMIT = 100;
    private static final long RECEIVE_POLL_MS = 1_000L;
    private static final long GROUP_SHUTDOWN_WAIT_MS = 5_000L;

    private final TelemetryStore store;
    private final UplinkTransport transport;
    private final CollectorSettings settings;
    private final Clock clock;
    private final StopSignal stop;
    private final URI remote;
    private final List<UplinkStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Long, Long> pendingAcks = new ConcurrentHashMap<>();
    private final Object ackLock = new Object();
    private final Deque<Long> latencySamples = new ArrayDeque<>();
    private final AtomicReference<UplinkState> state = new AtomicReference<>(UplinkState.DISCONNECTED);
    private final AtomicReference<String> lastError = new AtomicReference<>("");
    private final AtomicLong batchesSent = new AtomicLong();
    private final AtomicLong recordsSent = new AtomicLong();
    private final AtomicLong recordsResent = new AtomicLong();
    private final AtomicLong recordsAcknowledged = new AtomicLong();
    private final AtomicLong unknownAcks = new AtomicLong();
    private final AtomicLong rejectedAcks = new AtomicLong();
    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong lastConnectedAtMs = new AtomicLong();
    private final AtomicLong sessions = new AtomicLong();

    public UplinkManager(TelemetryStore store, UplinkTransport transport, CollectorSettings settings,
                         Clock clock, StopSignal stop) {
        if (settings.remoteUrl() == null || settings.remoteUrl().isBlank()) {
            throw new IllegalArgumentException("remoteUrl must be configured for the uplink");
        }
        this.store = store;
        this.transport = transport;
        this.settings = settings;
        this.clock = clock;
        this.stop = stop;
        this.remote = URI.create(settings.remoteUrl());
    }

    public void addStatusListener(UplinkStatusListener listener) {
        listeners.add(listener);
    }

    @Override
    public void run() {
        log.info("Uplink manager starting, remote={} batchSize={}", remote, settings.batchSize());
        try {
            while (!stop.isStopped()) {
                connectAndServe();
                if (stop.isStopped()) {
                    break;
                }
                log.info("Reconnecting uplink in {} ms", settings.reconnectDelayMs());
                if (stop.await(settings.reconnectDelayMs())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pendingAcks.clear();
            transition(UplinkState.DISCONNECTED);
            log.info("Uplink manager stopped");
        }
    }

    private void connectAndServe() throws InterruptedException {
        transition(UplinkState.CONNECTING);
        connectAttempts.incrementAndGet();
        UplinkConnection connection;
        try {
            connection = transport.connect(remote, settings.connectTimeout());
        } catch (UplinkConnectionException e) {
            lastError.set(describe(e));
            log.warn("Uplink connect to {} failed: {}", remote, describe(e));
            transition(UplinkState.ERROR);
            return;
        }
        pendingAcks.clear();
        lastConnectedAtMs.set(clock.millis());
        transition(UplinkState.CONNECTED);
        try {
            serve(connection);
        } finally {
            connection.close();
            pendingAcks.clear();
            transition(UplinkState.DISCONNECTED);
        }
    }

    private void serve(UplinkConnection connection) throws InterruptedException {
        long session = sessions.incrementAndGet();
        ExecutorService group = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "kartlink-uplink-" + session);
            t.setDaemon(true);
            return t;
        });
        ExecutorCompletionService<String> units = new ExecutorCompletionService<>(group);
        units.submit(() -> {
            sendLoop(connection);
            return "sender";
        });
        units.submit(() -> {
            receiveLoop(connection);
            return "receiver";
        });
        units.submit(() -> {
            maintenanceLoop();
            return "maintenance";
        });
        try {
            Future<String> first = units.take();
            try {
                log.info("Uplink {} finished, closing connection", first.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                lastError.set(describe(cause));
                log.warn("Uplink connection lost: {}", describe(cause));
                log.debug("Uplink unit failure", cause);
            }
        } finally {
            group.shutdownNow();
            connection.close();
            if (!group.awaitTermination(GROUP_SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Uplink units did not stop within {} ms", GROUP_SHUTDOWN_WAIT_MS);
            }
        }
    }

    private void sendLoop(UplinkConnection connection) throws UplinkConnectionException, InterruptedException {
        int limit = settings.backpressureLimit();
        boolean throttled = false;
        while (!stop.isStopped()) {
            boolean full = pendingAcks.size() >= limit;
            if (full && !throttled) {
                log.warn("{} records awaiting acknowledgment, pausing new sends", pendingAcks.size());
            }
            throttled = full;
            List<TelemetryRecord> batch;
            int resent = 0;
            synchronized (ackLock) {
                long now = clock.millis();
                batch = nextBatch(now, !full);
                for (TelemetryRecord r : batch) {
                    if (pendingAcks.put(r.id(), now) != null) {
                        resent++;
                    }
                }
            }
            if (batch.isEmpty()) {
                if (stop.await(full ? settings.backpressurePauseMs() : settings.idlePollMs())) {
                    return;
                }
                continue;
            }
            connection.send(UplinkCodec.encodeBatch(batch));
            batchesSent.incrementAndGet();
            recordsSent.addAndGet(batch.size());
            if (resent > 0) {
                recordsResent.addAndGet(resent);
                log.debug("Resent {} unacknowledged records", resent);
            }
            log.debug("Sent batch of {} records, pending={}", batch.size(), pendingAcks.size());
        }
    }

    /**
     * Oldest un-uploaded records that are either not yet sent on this
     * connection or were sent more than {@code resendAfterMs} ago without an
     * acknowledgment. New records are skipped while the sender is throttled.
     */
    private List<TelemetryRecord> nextBatch(long now, boolean includeNew) {
        int batchSize = settings.batchSize();
        // every skipped row is pending, so this limit always leaves room for a full batch
        List<TelemetryRecord> candidates = store.getUnuploaded(batchSize + pendingAcks.size());
        List<TelemetryRecord> batch = new ArrayList<>(batchSize);
        for (TelemetryRecord r : candidates) {
            Long sentAt = pendingAcks.get(r.id());
            boolean eligible = sentAt == null
                    ? includeNew
                    : now - sentAt >= settings.resendAfterMs();
            if (eligible) {
                batch.add(r);
                if (batch.size() == batchSize) {
                    break;
                }
            }
        }
        return batch;
    }

    private void receiveLoop(UplinkConnection connection) throws UplinkConnectionException, InterruptedException {
        long pollMs = settings.ackTimeoutMs() > 0
                ? Math.max(1L, Math.min(RECEIVE_POLL_MS, settings.ackTimeoutMs()))
                : RECEIVE_POLL_MS;
        while (!stop.isStopped()) {
            String message = connection.poll(pollMs);
            if (message != null) {
                handleAck(message);
            }
            checkAckTimeout();
        }
    }

    private void handleAck(String message) {
        UplinkCodec.Ack ack;
        try {
            ack = UplinkCodec.decodeAck(message);
        } catch (ProtocolException e) {
            rejectedAcks.incrementAndGet();
            log.warn("Ignoring uplink message: {}", e.getMessage());
            return;
        }
        long now = clock.millis();
        List<Long> matched = new ArrayList<>(ack.processedIds().size());
        synchronized (ackLock) {
            for (Long id : ack.processedIds()) {
                if (pendingAcks.containsKey(id)) {
                    matched.add(id);
                } else {
                    unknownAcks.incrementAndGet();
                    log.warn("Received ack for unknown record id {}", id);
                }
            }
            if (matched.isEmpty()) {
                return;
            }
            // rows leave the un-uploaded set before they leave pendingAcks
            int changed = store.markUploaded(matched);
            for (Long id : matched) {
                Long sentAt = pendingAcks.remove(id);
                if (sentAt != null) {
                    recordLatency(now - sentAt);
                }
            }
            log.debug("Acknowledged {} records ({} newly marked uploaded)", matched.size(), changed);
        }
        recordsAcknowledged.addAndGet(matched.size());
    }

    private void checkAckTimeout() throws UplinkConnectionException {
        long timeout = settings.ackTimeoutMs();
        if (timeout <= 0 || pendingAcks.isEmpty()) {
            return;
        }
        long oldest = Long.MAX_VALUE;
        for (Long sentAt : pendingAcks.values()) {
            oldest = Math.min(oldest, sentAt);
        }
        if (oldest != Long.MAX_VALUE && clock.millis() - oldest > timeout) {
            throw new UplinkConnectionException("No acknowledgment within " + timeout + " ms");
        }
    }

    private void maintenanceLoop() throws InterruptedException {
        long lastPrune = 0L;
        long lastStatus = 0L;
        boolean first = true;
        do {
            long now = clock.millis();
            if (first || now - lastPrune >= settings.pruneIntervalMs()) {
                try {
                    store.pruneUploaded(settings.retentionSeconds());
                } catch (StorageException e) {
                    log.error("Periodic prune failed", e);
                }
                lastPrune = now;
            }
            if (first || now - lastStatus >= settings.statusIntervalMs()) {
                publishStatus();
                lastStatus = now;
            }
            first = false;
        } while (!stop.await(settings.maintenanceIntervalMs()));
    }

    private void recordLatency(long latencyMs) {
        synchronized (latencySamples) {
            latencySamples.addLast(Math.max(0L, latencyMs));
            while (latencySamples.size() > LATENCY_SAMPLE_LIMIT) {
                latencySamples.removeFirst();
            }
        }
    }

    private void transition(UplinkState next) {
        UplinkState previous = state.getAndSet(next);
        if (previous != next) {
            log.info("Uplink state {} -> {}", previous, next);
            publishStatus();
        }
    }

    private void publishStatus() {
        UplinkStatus snapshot = status();
        for (UplinkStatusListener listener : listeners) {
            try {
                listener.onStatus(snapshot);
            } catch (RuntimeException e) {
                log.warn("Uplink status listener failed", e);
            }
        }
    }

    public UplinkState state() {
        return state.get();
    }

    public int pendingAckCount() {
        return pendingAcks.size();
    }

    public UplinkStatus status() {
        double avg;
        int samples;
        synchronized (latencySamples) {
            samples = latencySamples.size();
            avg = latencySamples.stream().mapToLong(Long::longValue).average().orElse(0.0d);
        }
        return new UplinkStatus(
                state.get(),
                pendingAcks.size(),
                avg,
                samples,
                batchesSent.get(),
                recordsSent.get(),
                recordsResent.get(),
                recordsAcknowledged.get(),
                unknownAcks.get(),
                rejectedAcks.get(),
                connectAttempts.get(),
                lastConnectedAtMs.get(),
                lastError.get()
        );
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        Throwable cause = t.getCause();
        if (cause != null && cause != t && cause.getMessage() != null) {
            message = message + ": " + cause.getMessage();
        }
        return message;
    }
}
