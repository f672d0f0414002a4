package io.kartlink.observability;

import io.kartlink.model.UplinkState;
import io.kartlink.runtime.CollectorRuntime;
import io.kartlink.storage.TelemetryStore;
import io.kartlink.timesync.PingBroadcaster;
import io.kartlink.uplink.UplinkStatus;

import java.util.Map;

public final class PrometheusFormatter {
    private static final String UPLINK_STATE_HELP = uplinkStateHelp();

    private PrometheusFormatter() {
    }

    public static String format(CollectorRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        TelemetryStore.StoreStats store = stats.store();
        appendGauge(sb, "kartlink_records", "Stored telemetry records grouped by upload state", "state", "uploaded", store.uploadedRecords());
        appendGauge(sb, "kartlink_records", "Stored telemetry records grouped by upload state", "state", "pending", store.pendingRecords());
        appendGauge(sb, "kartlink_oldest_pending_id", "Id of the oldest record not yet uploaded (0 when none)", null, null, store.oldestPendingId());
        appendGauge(sb, "kartlink_database_size_bytes", "Size of the telemetry database file", null, null, store.databaseSizeBytes());
        appendGauge(sb, "kartlink_ingest_stored_total", "Bus frames persisted since start", null, null, stats.ingestStored());
        appendGauge(sb, "kartlink_ingest_failed_total", "Bus frames dropped after a store failure", null, null, stats.ingestFailed());

        UplinkStatus uplink = stats.uplink();
        if (uplink != null) {
            appendGauge(sb, "kartlink_uplink_state", UPLINK_STATE_HELP, null, null, uplink.state().ordinal());
            appendGauge(sb, "kartlink_uplink_pending_acks", "Records sent and awaiting acknowledgment", null, null, uplink.pendingAcks());
            appendGauge(sb, "kartlink_uplink_avg_latency_ms", "Average acknowledgment latency in milliseconds", null, null, Math.round(uplink.averageLatencyMs()));
            appendGauge(sb, "kartlink_uplink_batches_sent_total", "Batches written to the remote collector", null, null, uplink.batchesSent());
            appendGauge(sb, "kartlink_uplink_records_acknowledged_total", "Records acknowledged by the remote collector", null, null, uplink.recordsAcknowledged());
            appendGauge(sb, "kartlink_uplink_unknown_acks_total", "Acknowledged ids that were not pending", null, null, uplink.unknownAcks());
            appendGauge(sb, "kartlink_uplink_rejected_acks_total", "Inbound uplink messages that were not valid acknowledgments", null, null, uplink.rejectedAcks());
            appendGauge(sb, "kartlink_uplink_connect_attempts_total", "Uplink connection attempts", null, null, uplink.connectAttempts());
        }

        PingBroadcaster.Stats ping = stats.ping();
        if (ping != null) {
            appendGauge(sb, "kartlink_ping_sent_total", "PING beacons broadcast", null, null, ping.pingsSent());
            appendGauge(sb, "kartlink_pong_total", "PONG replies grouped by outcome", "outcome", "matched", ping.pongsMatched());
            appendGauge(sb, "kartlink_pong_total", "PONG replies grouped by outcome", "outcome", "unmatched", ping.pongsUnmatched());
            appendGauge(sb, "kartlink_pong_total", "PONG replies grouped by outcome", "outcome", "clock_anomaly", ping.clockAnomalies());
            appendGauge(sb, "kartlink_ping_collisions_total", "PING values reused while still pending", null, null, ping.collisions());
            appendGauge(sb, "kartlink_set_time_sent_total", "SET_TIME commands sent", null, null, ping.setTimeSent());
            appendGauge(sb, "kartlink_ping_pending", "PINGs awaiting a PONG", null, null, ping.pendingPings());
            appendGauge(sb, "kartlink_ping_estimated_delay_ms", "One-way delay carried by outgoing PINGs", null, null, ping.estimatedDelayMs());
        }
        for (Map.Entry<Integer, PingBroadcaster.RttEstimate> e : stats.rtt().entrySet()) {
            appendGauge(sb, "kartlink_node_rtt_ms", "Average round trip per bus node in milliseconds", "node",
                    String.format("0x%02X", e.getKey()), Math.round(e.getValue().averageMs()));
        }
        return sb.toString();
    }

    /**
     * Lists every state with its value. ERROR follows a failed connect attempt
     * and holds through the reconnect wait.
     */
    private static String uplinkStateHelp() {
        StringBuilder sb = new StringBuilder("Uplink state (");
        UplinkState[] states = UplinkState.values();
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(states[i].ordinal()).append('=').append(states[i].name());
        }
        return sb.append("; ERROR holds from a failed connect until the next attempt)").toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
