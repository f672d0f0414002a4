package io.kartlink.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kartlink.model.Role;
import io.kartlink.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables of one collector process.
 *
 * <p>Defaults match the field-deployed collector. Any subset can be overridden
 * from {@code kartlink-settings.json} in the data root; absent keys keep their
 * defaults.
 */
public record CollectorSettings(
        Role role,
        String remoteUrl,
        int batchSize,
        long reconnectDelayMs,
        long connectTimeoutMs,
        long retentionSeconds,
        long historyWindowSeconds,
        long pruneIntervalMs,
        long statusIntervalMs,
        long idlePollMs,
        long backpressurePauseMs,
        long ackTimeoutMs,
        long resendAfterMs,
        int maxRecords,
        int capCheckInterval,
        long pingIntervalMs,
        long maxPingAgeMs,
        long pingPruneIntervalMs,
        int rttWindowSize,
        long busPumpIntervalMs
) {
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final long DEFAULT_RECONNECT_DELAY_MS = 5_000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_RETENTION_SECONDS = 3_600L;
    public static final long DEFAULT_HISTORY_WINDOW_SECONDS = 600L;
    public static final long DEFAULT_PRUNE_INTERVAL_MS = 300_000L;
    public static final long DEFAULT_STATUS_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_RESEND_AFTER_MS = 30_000L;
    public static final int DEFAULT_MAX_RECORDS = 10_000;
    public static final long DEFAULT_PING_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_MAX_PING_AGE_MS = 5_000L;
    public static final int DEFAULT_RTT_WINDOW_SIZE = 10;
    public static final int BACKPRESSURE_BATCH_MULTIPLIER = 5;

    public CollectorSettings {
        if (role == null) {
            role = Role.VEHICLE;
        }
        if (remoteUrl == null) {
            remoteUrl = "";
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (rttWindowSize <= 0) {
            throw new IllegalArgumentException("rttWindowSize must be positive");
        }
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive");
        }
    }

    public static CollectorSettings defaults() {
        return new CollectorSettings(
                Role.VEHICLE,
                "",
                DEFAULT_BATCH_SIZE,
                DEFAULT_RECONNECT_DELAY_MS,
                DEFAULT_CONNECT_TIMEOUT_MS,
                DEFAULT_RETENTION_SECONDS,
                DEFAULT_HISTORY_WINDOW_SECONDS,
                DEFAULT_PRUNE_INTERVAL_MS,
                DEFAULT_STATUS_INTERVAL_MS,
                1_000L,
                500L,
                0L,
                DEFAULT_RESEND_AFTER_MS,
                DEFAULT_MAX_RECORDS,
                100,
                DEFAULT_PING_INTERVAL_MS,
                DEFAULT_MAX_PING_AGE_MS,
                1_000L,
                DEFAULT_RTT_WINDOW_SIZE,
                10L
        );
    }

    /**
     * Loads settings for the given config, falling back to defaults when the
     * settings file does not exist.
     */
    public static CollectorSettings load(CollectorConfig config) {
        return load(config.settingsFile());
    }

    public static CollectorSettings load(Path settingsFile) {
        CollectorSettings defaults = defaults();
        if (!Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
    }

    /**
     * Number of unacknowledged records above which the uplink sender pauses.
     */
    public int backpressureLimit() {
        return batchSize * BACKPRESSURE_BATCH_MULTIPLIER;
    }

    public long maintenanceIntervalMs() {
        return Math.max(1L, Math.min(statusIntervalMs, pruneIntervalMs));
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(Math.max(1L, connectTimeoutMs));
    }

    public CollectorSettings withRole(Role newRole) {
        return new CollectorSettings(newRole, remoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, idlePollMs,
                backpressurePauseMs, ackTimeoutMs, resendAfterMs, maxRecords, capCheckInterval, pingIntervalMs, maxPingAgeMs,
                pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    public CollectorSettings withRemoteUrl(String newRemoteUrl) {
        return new CollectorSettings(role, newRemoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, idlePollMs,
                backpressurePauseMs, ackTimeoutMs, resendAfterMs, maxRecords, capCheckInterval, pingIntervalMs, maxPingAgeMs,
                pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    public CollectorSettings withUplinkTiming(int newBatchSize, long newReconnectDelayMs, long newIdlePollMs,
                                              long newBackpressurePauseMs) {
        return new CollectorSettings(role, remoteUrl, newBatchSize, newReconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, newIdlePollMs,
                newBackpressurePauseMs, ackTimeoutMs, resendAfterMs, maxRecords, capCheckInterval, pingIntervalMs, maxPingAgeMs,
                pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    public CollectorSettings withMaintenance(long newRetentionSeconds, long newPruneIntervalMs,
                                             long newStatusIntervalMs, long newAckTimeoutMs) {
        return new CollectorSettings(role, remoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                newRetentionSeconds, historyWindowSeconds, newPruneIntervalMs, newStatusIntervalMs, idlePollMs,
                backpressurePauseMs, newAckTimeoutMs, resendAfterMs, maxRecords, capCheckInterval, pingIntervalMs, maxPingAgeMs,
                pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    public CollectorSettings withStoreLimits(int newMaxRecords, int newCapCheckInterval) {
        return new CollectorSettings(role, remoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, idlePollMs,
                backpressurePauseMs, ackTimeoutMs, resendAfterMs, newMaxRecords, newCapCheckInterval, pingIntervalMs, maxPingAgeMs,
                pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    public CollectorSettings withPing(long newPingIntervalMs, long newMaxPingAgeMs, long newPingPruneIntervalMs,
                                      int newRttWindowSize) {
        return new CollectorSettings(role, remoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, idlePollMs,
                backpressurePauseMs, ackTimeoutMs, resendAfterMs, maxRecords, capCheckInterval, newPingIntervalMs, newMaxPingAgeMs,
                newPingPruneIntervalMs, newRttWindowSize, busPumpIntervalMs);
    }

    /**
     * Unacknowledged records older than {@code newResendAfterMs} are sent again
     * on the same connection.
     */
    public CollectorSettings withResendAfter(long newResendAfterMs) {
        return new CollectorSettings(role, remoteUrl, batchSize, reconnectDelayMs, connectTimeoutMs,
                retentionSeconds, historyWindowSeconds, pruneIntervalMs, statusIntervalMs, idlePollMs,
                backpressurePauseMs, ackTimeoutMs, newResendAfterMs, maxRecords, capCheckInterval, pingIntervalMs,
                maxPingAgeMs, pingPruneIntervalMs, rttWindowSize, busPumpIntervalMs);
    }

    static CollectorSettings fromFile(SettingsFile file, CollectorSettings d) {
        return new CollectorSettings(
                file.role() == null ? d.role() : Role.fromString(file.role()),
                file.remoteUrl() == null ? d.remoteUrl() : file.remoteUrl().trim(),
                file.batchSize() == null ? d.batchSize() : file.batchSize(),
                file.reconnectDelayMs() == null ? d.reconnectDelayMs() : Math.max(0L, file.reconnectDelayMs()),
                file.connectTimeoutMs() == null ? d.connectTimeoutMs() : Math.max(1L, file.connectTimeoutMs()),
                file.retentionSeconds() == null ? d.retentionSeconds() : Math.max(0L, file.retentionSeconds()),
                file.historyWindowSeconds() == null ? d.historyWindowSeconds() : Math.max(1L, file.historyWindowSeconds()),
                file.pruneIntervalMs() == null ? d.pruneIntervalMs() : Math.max(1L, file.pruneIntervalMs()),
                file.statusIntervalMs() == null ? d.statusIntervalMs() : Math.max(1L, file.statusIntervalMs()),
                file.idlePollMs() == null ? d.idlePollMs() : Math.max(1L, file.idlePollMs()),
                file.backpressurePauseMs() == null ? d.backpressurePauseMs() : Math.max(1L, file.backpressurePauseMs()),
                file.ackTimeoutMs() == null ? d.ackTimeoutMs() : Math.max(0L, file.ackTimeoutMs()),
                file.resendAfterMs() == null ? d.resendAfterMs() : Math.max(1L, file.resendAfterMs()),
                file.maxRecords() == null ? d.maxRecords() : file.maxRecords(),
                file.capCheckInterval() == null ? d.capCheckInterval() : Math.max(0, file.capCheckInterval()),
                file.pingIntervalMs() == null ? d.pingIntervalMs() : Math.max(1L, file.pingIntervalMs()),
                file.maxPingAgeMs() == null ? d.maxPingAgeMs() : Math.max(1L, file.maxPingAgeMs()),
                file.pingPruneIntervalMs() == null ? d.pingPruneIntervalMs() : Math.max(0L, file.pingPruneIntervalMs()),
                file.rttWindowSize() == null ? d.rttWindowSize() : file.rttWindowSize(),
                file.busPumpIntervalMs() == null ? d.busPumpIntervalMs() : Math.max(1L, file.busPumpIntervalMs())
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String role,
            String remoteUrl,
            Integer batchSize,
            Long reconnectDelayMs,
            Long connectTimeoutMs,
            Long retentionSeconds,
            Long historyWindowSeconds,
            Long pruneIntervalMs,
            Long statusIntervalMs,
            Long idlePollMs,
            Long backpressurePauseMs,
            Long ackTimeoutMs,
            Long resendAfterMs,
            Integer maxRecords,
            Integer capCheckInterval,
            Long pingIntervalMs,
            Long maxPingAgeMs,
            Long pingPruneIntervalMs,
            Integer rttWindowSize,
            Long busPumpIntervalMs
    ) {
    }
}
