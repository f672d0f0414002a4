package io.kartlink.runtime;

import io.kartlink.bus.BusAdapter;
import io.kartlink.bus.InMemoryBusAdapter;
import io.kartlink.bus.TelemetryIngest;
import io.kartlink.config.CollectorConfig;
import io.kartlink.config.CollectorSettings;
import io.kartlink.model.Role;
import io.kartlink.model.TelemetryEvent;
import io.kartlink.model.TelemetryRecord;
import io.kartlink.observability.PrometheusFormatter;
import io.kartlink.protocol.ProtocolCatalog;
import io.kartlink.protocol.StaticProtocolCatalog;
import io.kartlink.storage.Database;
import io.kartlink.storage.HistoryQuery;
import io.kartlink.storage.TelemetryStore;
import io.kartlink.timesync.PingBroadcaster;
import io.kartlink.uplink.BusUplinkStatusReporter;
import io.kartlink.uplink.UplinkManager;
import io.kartlink.uplink.UplinkStatus;
import io.kartlink.uplink.UplinkTransport;
import io.kartlink.uplink.WebSocketUplinkTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the store, bus ingest, uplink and time sync of one collector process.
 *
 * <p>The bus adapter, protocol catalog and uplink transport are passed in;
 * nothing here is shared through static state. {@link #stop()} fires the one
 * stop signal every loop waits on.
 */
public final class CollectorRuntime {
    private static final Logger log = LoggerFactory.getLogger(CollectorRuntime.class);
    private static final int LOCAL_NODE_ID = 0x01;
    private static final long JOIN_GRACE_MS = 5_000L;

    private final CollectorConfig config;
    private final CollectorSettings settings;
    private final BusAdapter bus;
    private final ProtocolCatalog catalog;
    private final UplinkTransport transport;
    private final Clock clock;
    private final Database database;
    private final TelemetryStore store;
    private final TelemetryIngest ingest;
    private final StopSignal stop = new StopSignal();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<Thread> threads = new ArrayList<>();
    private volatile UplinkManager uplink;
    private volatile PingBroadcaster ping;

    public CollectorRuntime(CollectorConfig config, CollectorSettings settings, BusAdapter bus,
                            ProtocolCatalog catalog, UplinkTransport transport, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.bus = bus;
        this.catalog = catalog;
        this.transport = transport;
        this.clock = clock;
        this.database = new Database(config);
        this.store = new TelemetryStore(database, settings, clock);
        this.ingest = new TelemetryIngest(store, catalog, clock);
    }

    /**
     * Runtime for a host without bus hardware, talking WebSocket to the
     * configured remote.
     */
    public static CollectorRuntime standalone(CollectorConfig config, CollectorSettings settings) {
        StaticProtocolCatalog catalog = StaticProtocolCatalog.standard();
        return new CollectorRuntime(
                config,
                settings,
                new InMemoryBusAdapter(catalog, LOCAL_NODE_ID),
                catalog,
                new WebSocketUplinkTransport(),
                Clock.systemUTC()
        );
    }

    public void init() {
        database.init();
    }

    /**
     * Starts the bus pump and, on the vehicle, the time sync and the uplink
     * when a remote is configured.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Collector runtime already started");
        }
        init();
        ingest.register(bus);
        if (settings.role() == Role.VEHICLE) {
            ping = new PingBroadcaster(bus, catalog, store, settings, clock, stop);
            startThread("kartlink-ping", ping);
            if (!settings.remoteUrl().isBlank()) {
                UplinkManager manager = new UplinkManager(store, transport, settings, clock, stop);
                manager.addStatusListener(new BusUplinkStatusReporter(bus));
                uplink = manager;
                startThread("kartlink-uplink", manager);
            } else {
                log.info("No remote configured, uplink disabled");
            }
        }
        startThread("kartlink-bus-pump", this::pumpBus);
        log.info("Collector started: role={} root={} remote={}",
                settings.role().configName(), config.rootDir(), settings.remoteUrl());
    }

    private void startThread(String name, Runnable body) {
        Thread t = new Thread(body, name);
        t.setDaemon(true);
        threads.add(t);
        t.start();
    }

    private void pumpBus() {
        try {
            do {
                try {
                    bus.process();
                } catch (RuntimeException e) {
                    log.error("Bus processing failed", e);
                }
            } while (!stop.await(settings.busPumpIntervalMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public synchronized void stop() {
        stop.fire();
        long joinMs = settings.connectTimeoutMs() + JOIN_GRACE_MS;
        for (Thread t : threads) {
            try {
                t.join(joinMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (t.isAlive()) {
                log.warn("Thread {} did not stop within {} ms", t.getName(), joinMs);
            }
        }
        threads.clear();
        log.info("Collector stopped");
    }

    public void awaitStop() throws InterruptedException {
        stop.awaitStop();
    }

    public StopSignal stopSignal() {
        return stop;
    }

    public CollectorConfig config() {
        return config;
    }

    public CollectorSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public TelemetryStore store() {
        return store;
    }

    public Optional<TelemetryEvent> currentState() {
        return store.currentState();
    }

    public List<TelemetryRecord> history(int limit, int offset) {
        return store.getHistory(limit, offset, settings.role());
    }

    public TelemetryStore.HistoryPage queryHistory(HistoryQuery query) {
        return store.queryHistory(query);
    }

    public Optional<TelemetryRecord> latestFor(int componentType, int componentId) {
        return store.getLatestFor(componentType, componentId);
    }

    public List<TelemetryStore.ActiveComponent> activeComponents() {
        return store.activeComponents();
    }

    public List<TelemetryRecord> pending(int limit) {
        return store.getUnuploaded(limit);
    }

    public PruneOutcome prune() {
        int uploaded = store.pruneUploaded(settings.retentionSeconds());
        int capped = store.pruneMaxRecords(settings.maxRecords());
        return new PruneOutcome(uploaded, capped, settings.retentionSeconds(), settings.maxRecords());
    }

    public Optional<UplinkStatus> uplinkStatus() {
        UplinkManager manager = uplink;
        return manager == null ? Optional.empty() : Optional.of(manager.status());
    }

    public Map<Integer, PingBroadcaster.RttEstimate> rttEstimates() {
        PingBroadcaster broadcaster = ping;
        return broadcaster == null ? Map.of() : broadcaster.rttEstimates();
    }

    public StatsOutcome stats() {
        PingBroadcaster broadcaster = ping;
        return new StatsOutcome(
                settings.role().configName(),
                store.loadStats(),
                ingest.storedCount(),
                ingest.failedCount(),
                uplinkStatus().orElse(null),
                broadcaster == null ? null : broadcaster.stats(),
                rttEstimates()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public record PruneOutcome(int uploadedPruned, int capPruned, long retentionSeconds, int maxRecords) {}

    public record StatsOutcome(
            String role,
            TelemetryStore.StoreStats store,
            long ingestStored,
            long ingestFailed,
            UplinkStatus uplink,
            PingBroadcaster.Stats ping,
            Map<Integer, PingBroadcaster.RttEstimate> rtt
    ) {
    }
}
