package io.kartlink.uplink;

import io.kartlink.bus.InMemoryBusAdapter;
import io.kartlink.config.CollectorConfig;
import io.kartlink.config.CollectorSettings;
import io.kartlink.model.TelemetryEvent;
import io.kartlink.model.UplinkState;
import io.kartlink.protocol.ProtocolIds;
import io.kartlink.protocol.StaticProtocolCatalog;
import io.kartlink.runtime.StopSignal;
import io.kartlink.storage.Database;
import io.kartlink.storage.TelemetryStore;
import io.kartlink.testing.Await;
import io.kartlink.testing.FakeUplinkTransport;
import io.kartlink.testing.MutableClock;
import io.kartlink.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

final class UplinkManagerTest {
    private static final long T0 = 1_700_000_000_000L;

    private Path root;
    private MutableClock clock;
    private Database database;
    private StopSignal stop;
    private FakeUplinkTransport transport;
    private Thread worker;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("kartlink-test-uplink-");
        clock = new MutableClock(T0);
        database = new Database(CollectorConfig.fromRoot(root.toString()));
        database.init();
        stop = new StopSignal();
        transport = new FakeUplinkTransport();
    }

    @AfterEach
    void tearDown() throws Exception {
        stop.fire();
        if (worker != null) {
            worker.join(10_000L);
        }
        TestFiles.deleteRecursively(root);
    }

    private static CollectorSettings settings() {
        return CollectorSettings.defaults()
                .withRemoteUrl("ws://collector.test/ingest")
                .withUplinkTiming(2, 50L, 20L, 20L)
                .withMaintenance(3_600L, 60_000L, 60_000L, 0L);
    }

    private TelemetryStore store(Clock storeClock) {
        return new TelemetryStore(database, settings(), storeClock);
    }

    private static void appendRecords(TelemetryStore store, int count) {
        for (int i = 0; i < count; i++) {
            store.append(TelemetryEvent.receivedNow(T0 + i, ProtocolIds.MESSAGE_STATUS, 2, 1, 0,
                    ProtocolIds.VALUE_UINT8, i));
        }
    }

    private UplinkManager start(UplinkManager manager) {
        worker = new Thread(manager, "uplink-under-test");
        worker.start();
        return manager;
    }

    @Test
    void acknowledgedRecordsAreRetired() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 5);
        transport.autoAck(true);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));

        Await.until("all records acknowledged", 5_000L, () -> manager.status().recordsAcknowledged() == 5L);
        Assertions.assertEquals(0L, store.countPending());
        UplinkStatus status = manager.status();
        Assertions.assertEquals(UplinkState.CONNECTED, status.state());
        Assertions.assertEquals(3L, status.batchesSent());
        Assertions.assertEquals(5L, status.recordsSent());
        Assertions.assertEquals(0, status.pendingAcks());
        Assertions.assertEquals(5, status.latencySamples());
        Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L), transport.connection(0).sentIds());
    }

    @Test
    void senderPausesAtBackpressureLimit() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 30);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));

        Await.until("backpressure limit reached", 5_000L, () -> manager.pendingAckCount() == 10);
        Thread.sleep(200L);
        Assertions.assertEquals(10, manager.pendingAckCount());
        Assertions.assertEquals(5L, manager.status().batchesSent());
        Assertions.assertEquals(30L, store.countPending());

        transport.connection(0).ack(List.of(1L, 2L));
        Await.until("sender resumes", 5_000L, () -> manager.status().batchesSent() == 6L);
        Await.until("acked records retired", 5_000L, () -> store.countPending() == 28L);
        Assertions.assertEquals(10, manager.pendingAckCount());
    }

    @Test
    void unacknowledgedRecordsAreResentAfterReconnect() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 3);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));

        Await.until("first connection sent everything", 5_000L,
                () -> !transport.connections().isEmpty() && transport.connection(0).sentIds().size() == 3);
        transport.connection(0).drop();

        Await.until("second connection resent everything", 5_000L,
                () -> transport.connections().size() == 2 && transport.connection(1).sentIds().size() == 3);
        Assertions.assertEquals(List.of(1L, 2L, 3L), transport.connection(1).sentIds());
        Assertions.assertEquals(3L, store.countPending());
        Assertions.assertTrue(manager.status().connectAttempts() >= 2L);

        transport.connection(1).ack(List.of(1L, 2L, 3L));
        Await.until("records retired", 5_000L, () -> store.countPending() == 0L);
    }

    @Test
    void partiallyAcknowledgedRecordsAreResentOnTheSameConnection() throws Exception {
        Clock wall = Clock.systemUTC();
        TelemetryStore store = store(wall);
        appendRecords(store, 30);
        Map<Long, Integer> deliveries = new ConcurrentHashMap<>();
        transport.autoAck(true).ackOnly(id -> deliveries.merge(id, 1, Integer::sum) > 1 || id % 2 == 0);
        CollectorSettings settings = settings().withResendAfter(200L);

        UplinkManager manager = start(new UplinkManager(store, transport, settings, wall, stop));

        Await.until("every record retired", 10_000L, () -> store.countPending() == 0L);
        Assertions.assertEquals(1, transport.connections().size());
        List<Long> sent = transport.connection(0).sentIds();
        for (long id = 1; id <= 30; id++) {
            long copies = sent.stream().filter(Long.valueOf(id)::equals).count();
            Assertions.assertEquals(id % 2 == 0 ? 1L : 2L, copies, "deliveries of id " + id);
        }
        Assertions.assertEquals(15L, manager.status().recordsResent());
        Assertions.assertEquals(0, manager.pendingAckCount());
    }

    @Test
    void unacknowledgedRecordsWaitForTheResendInterval() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 1);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));
        Await.until("record sent", 5_000L, () -> manager.pendingAckCount() == 1);
        Thread.sleep(100L);
        Assertions.assertEquals(List.of(1L), transport.connection(0).sentIds());

        clock.advance(CollectorSettings.DEFAULT_RESEND_AFTER_MS);
        Await.until("record resent", 5_000L, () -> transport.connection(0).sentIds().size() == 2);
        Assertions.assertEquals(List.of(1L, 1L), transport.connection(0).sentIds());
        Assertions.assertEquals(1L, manager.status().recordsResent());
        Assertions.assertEquals(1, manager.pendingAckCount());
    }

    @Test
    void unknownIdsAreCountedAndIgnored() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 1);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));
        Await.until("record sent", 5_000L, () -> manager.pendingAckCount() == 1);

        transport.connection(0).ack(List.of(999L));
        Await.until("unknown ack counted", 5_000L, () -> manager.status().unknownAcks() == 1L);
        Assertions.assertEquals(1L, store.countPending());

        transport.connection(0).ack(List.of(1L));
        Await.until("record retired", 5_000L, () -> store.countPending() == 0L);

        transport.connection(0).ack(List.of(1L));
        Await.until("repeated ack counted", 5_000L, () -> manager.status().unknownAcks() == 2L);
        Assertions.assertEquals(1L, manager.status().recordsAcknowledged());
    }

    @Test
    void malformedAcksAreRejectedWithoutDroppingTheConnection() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 1);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));
        Await.until("record sent", 5_000L, () -> manager.pendingAckCount() == 1);

        transport.connection(0).reply("garbage");
        transport.connection(0).reply("{\"status\":\"error\",\"processed_ids\":[1]}");
        Await.until("acks rejected", 5_000L, () -> manager.status().rejectedAcks() == 2L);

        Assertions.assertEquals(UplinkState.CONNECTED, manager.state());
        Assertions.assertEquals(1, transport.connections().size());
        Assertions.assertEquals(1, manager.pendingAckCount());
        Assertions.assertEquals(1L, store.countPending());
    }

    @Test
    void failedConnectsAreRetried() throws Exception {
        TelemetryStore store = store(clock);
        transport.failNextConnects(2);

        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));

        Await.until("connected after retries", 5_000L, () -> manager.state() == UplinkState.CONNECTED);
        Assertions.assertTrue(manager.status().connectAttempts() >= 3L);
        Assertions.assertTrue(manager.status().lastError().contains("connection refused"));
        Assertions.assertEquals(1, transport.connections().size());
    }

    @Test
    void stopEndsTheManagerPromptly() throws Exception {
        TelemetryStore store = store(clock);
        UplinkManager manager = start(new UplinkManager(store, transport, settings(), clock, stop));
        Await.until("connected", 5_000L, () -> manager.state() == UplinkState.CONNECTED);

        stop.fire();
        worker.join(3_000L);

        Assertions.assertFalse(worker.isAlive());
        Assertions.assertEquals(UplinkState.DISCONNECTED, manager.state());
        Assertions.assertFalse(transport.connection(0).isOpen());
    }

    @Test
    void missingAcknowledgmentForcesReconnect() throws Exception {
        Clock wall = Clock.systemUTC();
        TelemetryStore store = store(wall);
        appendRecords(store, 1);
        CollectorSettings settings = settings().withMaintenance(3_600L, 60_000L, 60_000L, 100L);

        UplinkManager manager = start(new UplinkManager(store, transport, settings, wall, stop));

        Await.until("record resent on a new connection", 5_000L,
                () -> transport.connections().size() >= 2 && !transport.connection(1).sentIds().isEmpty());
        Assertions.assertEquals(List.of(1L), transport.connection(1).sentIds());
        Assertions.assertFalse(transport.connection(0).isOpen());
        Assertions.assertTrue(manager.status().lastError().contains("No acknowledgment"));
    }

    @Test
    void statusIsPublishedOnTheBus() throws Exception {
        TelemetryStore store = store(clock);
        InMemoryBusAdapter bus = new InMemoryBusAdapter(StaticProtocolCatalog.standard(), 0x01);
        UplinkManager manager = new UplinkManager(store, transport, settings(), clock, stop);
        manager.addStatusListener(new BusUplinkStatusReporter(bus));

        start(manager);

        Await.until("connected status on the bus", 5_000L, () -> bus.sentWithCommand(
                        ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_UPLINK_STATUS).stream()
                .anyMatch(s -> s.frame().value() == UplinkState.CONNECTED.ordinal()));

        InMemoryBusAdapter.SentFrame status = bus.sentWithCommand(
                ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_UPLINK_STATUS).get(0);
        Assertions.assertEquals(ProtocolIds.MESSAGE_STATUS, status.frame().messageType());
        Assertions.assertEquals(ProtocolIds.SYSTEM_MONITOR_UPLINK_MANAGER, status.frame().componentId());
        Assertions.assertEquals(ProtocolIds.VALUE_UINT8, status.frame().valueType());
        Assertions.assertEquals(ProtocolIds.GROUP_ALL, status.destinationNode());
        Assertions.assertFalse(bus.sentWithCommand(
                ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_UPLINK_QUEUE_SIZE).isEmpty());
        Assertions.assertFalse(bus.sentWithCommand(
                ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_UPLINK_AVG_LATENCY_MS).isEmpty());
    }

    @Test
    void maintenancePrunesUploadedRecordsPastRetention() throws Exception {
        TelemetryStore store = store(clock);
        appendRecords(store, 4);
        transport.autoAck(true);
        CollectorSettings settings = settings().withMaintenance(1L, 50L, 50L, 0L);

        UplinkManager manager = start(new UplinkManager(store, transport, settings, clock, stop));
        Await.until("records acknowledged", 5_000L, () -> manager.status().recordsAcknowledged() == 4L);
        Assertions.assertEquals(4L, store.loadStats().totalRecords());

        clock.advance(5_000L);
        Await.until("uploaded records pruned", 5_000L, () -> store.loadStats().totalRecords() == 0L);
    }

    @Test
    void blankRemoteIsRejected() {
        TelemetryStore store = store(clock);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new UplinkManager(store, transport, settings().withRemoteUrl(" "), clock, stop));
    }
}
