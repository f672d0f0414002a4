package io.kartlink.timesync;

import io.kartlink.bus.BusFrame;
import io.kartlink.bus.InMemoryBusAdapter;
import io.kartlink.config.CollectorConfig;
import io.kartlink.config.CollectorSettings;
import io.kartlink.model.TelemetryRecord;
import io.kartlink.protocol.ProtocolIds;
import io.kartlink.protocol.StaticProtocolCatalog;
import io.kartlink.runtime.StopSignal;
import io.kartlink.storage.Database;
import io.kartlink.storage.TelemetryStore;
import io.kartlink.testing.Await;
import io.kartlink.testing.MutableClock;
import io.kartlink.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class PingBroadcasterTest {
    private static final int NODE = 0x21;

    private Path root;
    private MutableClock clock;
    private InMemoryBusAdapter bus;
    private TelemetryStore store;
    private StopSignal stop;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("kartlink-test-ping-");
        clock = new MutableClock(0L);
        bus = new InMemoryBusAdapter(StaticProtocolCatalog.standard(), 0x01);
        Database database = new Database(CollectorConfig.fromRoot(root.toString()));
        database.init();
        store = new TelemetryStore(database, CollectorSettings.defaults(), clock);
        stop = new StopSignal();
    }

    @AfterEach
    void tearDown() throws Exception {
        stop.fire();
        TestFiles.deleteRecursively(root);
    }

    private PingBroadcaster broadcaster(CollectorSettings settings) {
        return new PingBroadcaster(bus, StaticProtocolCatalog.standard(), store, settings, clock, stop);
    }

    private static BusFrame pong(int node, long value) {
        return new BusFrame(node, ProtocolIds.MESSAGE_STATUS, ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, node,
                ProtocolIds.COMMAND_PONG, ProtocolIds.VALUE_UINT24, value, 0L);
    }

    private List<InMemoryBusAdapter.SentFrame> setTimes() {
        return bus.sentWithCommand(ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_SET_TIME);
    }

    @Test
    void pingIsBroadcastWithItsTimestamp() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(100L);

        Assertions.assertEquals(100, ping.tick());

        List<InMemoryBusAdapter.SentFrame> pings =
                bus.sentWithCommand(ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_PING);
        Assertions.assertEquals(1, pings.size());
        BusFrame frame = pings.get(0).frame();
        Assertions.assertEquals(ProtocolIds.MESSAGE_COMMAND, frame.messageType());
        Assertions.assertEquals(ProtocolIds.SYSTEM_MONITOR_TIME_MASTER, frame.componentId());
        Assertions.assertEquals(ProtocolIds.VALUE_UINT24, frame.valueType());
        Assertions.assertEquals(100L, frame.value());
        Assertions.assertEquals(ProtocolIds.GROUP_ALL, pings.get(0).destinationNode());
        Assertions.assertEquals(1, ping.pendingPingCount());
        Assertions.assertEquals(1L, ping.stats().pingsSent());
    }

    @Test
    void pongYieldsRttSetTimeAndStoredSample() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(100L);
        ping.tick();

        clock.set(140L);
        bus.inject(pong(NODE, 100L));
        Assertions.assertEquals(1, bus.process());

        Assertions.assertEquals(40.0d, ping.rttEstimateMs(NODE).getAsDouble(), 1e-9);
        Assertions.assertEquals(0, ping.pendingPingCount());

        List<InMemoryBusAdapter.SentFrame> setTimes = setTimes();
        Assertions.assertEquals(1, setTimes.size());
        Assertions.assertEquals(NODE, setTimes.get(0).destinationNode());
        Assertions.assertEquals(160L, setTimes.get(0).frame().value());
        Assertions.assertEquals(ProtocolIds.VALUE_UINT24, setTimes.get(0).frame().valueType());

        Optional<TelemetryRecord> stored = store.getLatestFor(ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, NODE);
        Assertions.assertTrue(stored.isPresent());
        Assertions.assertEquals(ProtocolIds.COMMAND_ROUNDTRIPTIME_MS, stored.get().commandId());
        Assertions.assertEquals(ProtocolIds.VALUE_UINT16, stored.get().valueType());
        Assertions.assertEquals(40L, stored.get().value());

        PingBroadcaster.Stats stats = ping.stats();
        Assertions.assertEquals(1L, stats.pongsMatched());
        Assertions.assertEquals(1L, stats.setTimeSent());
    }

    @Test
    void unmatchedAndDuplicatePongsAreDiscarded() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(100L);
        ping.tick();
        clock.set(130L);

        ping.handlePong(pong(NODE, 999L));
        Assertions.assertEquals(1, ping.pendingPingCount());
        Assertions.assertTrue(ping.rttEstimateMs(NODE).isEmpty());

        ping.handlePong(pong(NODE, 100L));
        ping.handlePong(pong(0x22, 100L));

        PingBroadcaster.Stats stats = ping.stats();
        Assertions.assertEquals(1L, stats.pongsMatched());
        Assertions.assertEquals(2L, stats.pongsUnmatched());
        Assertions.assertEquals(1, setTimes().size());
        Assertions.assertTrue(ping.rttEstimateMs(0x22).isEmpty());
    }

    @Test
    void negativeRoundTripIsAClockAnomaly() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(1_000L);
        ping.tick();
        clock.set(900L);

        ping.handlePong(pong(NODE, 1_000L));

        Assertions.assertEquals(1L, ping.stats().clockAnomalies());
        Assertions.assertEquals(0L, ping.stats().pongsMatched());
        Assertions.assertTrue(ping.rttEstimateMs(NODE).isEmpty());
        Assertions.assertTrue(setTimes().isEmpty());
        Assertions.assertTrue(store.getLatestFor(ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, NODE).isEmpty());
    }

    @Test
    void estimateAveragesTheMostRecentSamples() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        for (int i = 1; i <= 12; i++) {
            clock.set(i * 1_000L);
            int value = ping.tick();
            clock.advance(10L * i);
            ping.handlePong(pong(NODE, value));
        }

        Assertions.assertEquals(75.0d, ping.rttEstimateMs(NODE).getAsDouble(), 1e-9);
        Map<Integer, PingBroadcaster.RttEstimate> estimates = ping.rttEstimates();
        Assertions.assertEquals(1, estimates.size());
        Assertions.assertEquals(10, estimates.get(NODE).samples());
        Assertions.assertEquals(120L, estimates.get(NODE).lastMs());
    }

    @Test
    void stalePingsArePruned() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(10_000L);
        ping.tick();
        clock.set(16_000L);
        ping.tick();

        Assertions.assertEquals(1, ping.pendingPingCount());
        ping.handlePong(pong(NODE, 10_000L));
        Assertions.assertEquals(1L, ping.stats().pongsUnmatched());
    }

    @Test
    void reusedValueReplacesThePendingPing() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(5L);
        int first = ping.tick();
        clock.set(5L + (1L << 24));
        int second = ping.tick();

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(1L, ping.stats().collisions());
        Assertions.assertEquals(1, ping.pendingPingCount());

        clock.advance(8L);
        ping.handlePong(pong(NODE, second));
        Assertions.assertEquals(8.0d, ping.rttEstimateMs(NODE).getAsDouble(), 1e-9);
    }

    @Test
    void setTimeWrapsAtTwentyFourBits() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(0xFFFFF0L);
        int value = ping.tick();
        clock.set(0xFFFFF0L + 20L);

        ping.handlePong(pong(NODE, value));

        Assertions.assertEquals((0xFFFFF0L + 30L) & 0xFFFFFFL, setTimes().get(0).frame().value());
    }

    @Test
    void pingsCarryHalfTheMeanRoundTrip() {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults());
        clock.set(1_000L);
        int first = ping.tick();
        Assertions.assertEquals(0L, lastPing().timestampDeltaMs());

        clock.set(1_040L);
        ping.handlePong(pong(NODE, first));
        clock.set(2_000L);
        int second = ping.tick();
        Assertions.assertEquals(20L, lastPing().timestampDeltaMs());

        clock.set(3_000L);
        ping.handlePong(pong(0x22, second));
        ping.tick();
        Assertions.assertEquals(255L, lastPing().timestampDeltaMs());
        Assertions.assertEquals(255, ping.stats().estimatedDelayMs());
    }

    private BusFrame lastPing() {
        List<InMemoryBusAdapter.SentFrame> pings =
                bus.sentWithCommand(ProtocolIds.COMPONENT_TYPE_SYSTEM_MONITOR, ProtocolIds.COMMAND_PING);
        return pings.get(pings.size() - 1).frame();
    }

    @Test
    void runLoopPingsUntilStopped() throws Exception {
        PingBroadcaster ping = broadcaster(CollectorSettings.defaults().withPing(10L, 5_000L, 1_000L, 10));
        Thread worker = new Thread(ping, "ping-under-test");
        worker.start();

        Await.until("several pings", 5_000L, () -> ping.stats().pingsSent() >= 3L);
        stop.fire();
        worker.join(3_000L);

        Assertions.assertFalse(worker.isAlive());
    }
}
