package io.kartlink.storage;

import io.kartlink.config.CollectorSettings;
import io.kartlink.model.Role;
import io.kartlink.model.TelemetryEvent;
import io.kartlink.model.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only telemetry log backed by SQLite.
 *
 * <p>All mutations go through one writer lock. Reads open their own connection
 * and run concurrently with the writer under WAL journaling.
 */
public final class TelemetryStore {
    private static final Logger log = LoggerFactory.getLogger(TelemetryStore.class);
    private static final int MARK_CHUNK_SIZE = 500;
    private static final String COLUMNS =
            "id,recorded_at_ms,received_at_ms,created_at_ms,message_type,component_type,component_id,"
                    + "command_id,value_type,value,uploaded";

    private final Database database;
    private final Clock clock;
    private final int maxRecords;
    private final int capCheckInterval;
    private final long historyWindowMs;
    private final Object writeLock = new Object();
    private final AtomicReference<TelemetryEvent> currentState = new AtomicReference<>();
    private long appendsSinceCapCheck;

    public TelemetryStore(Database database) {
        this(database, CollectorSettings.defaults(), Clock.systemUTC());
    }

    public TelemetryStore(Database database, CollectorSettings settings, Clock clock) {
        this.database = database;
        this.clock = clock;
        this.maxRecords = settings.maxRecords();
        this.capCheckInterval = settings.capCheckInterval();
        this.historyWindowMs = settings.historyWindowSeconds() * 1000L;
    }

    /**
     * Persists one event. Failures are logged and reported as an empty result;
     * the caller is not expected to retry.
     */
    public OptionalLong append(TelemetryEvent event) {
        synchronized (writeLock) {
            long id;
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("""
                         INSERT INTO telemetry_history(recorded_at_ms,received_at_ms,created_at_ms,message_type,
                             component_type,component_id,command_id,value_type,value,uploaded)
                         VALUES(?,?,?,?,?,?,?,?,?,0)
                         """)) {
                ps.setLong(1, event.recordedAtMs());
                ps.setLong(2, event.receivedAtMs());
                ps.setLong(3, clock.millis());
                ps.setInt(4, event.messageType());
                ps.setInt(5, event.componentType());
                ps.setInt(6, event.componentId());
                ps.setInt(7, event.commandId());
                ps.setInt(8, event.valueType());
                ps.setLong(9, event.value());
                ps.executeUpdate();
                id = lastInsertRowId(c);
            } catch (SQLException e) {
                StorageException failure = new StorageException("Failed to append telemetry record", e);
                log.error(failure.getMessage(), failure);
                return OptionalLong.empty();
            }
            currentState.set(event);
            enforceCapIfDue();
            return OptionalLong.of(id);
        }
    }

    private long lastInsertRowId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private void enforceCapIfDue() {
        if (capCheckInterval <= 0) {
            return;
        }
        appendsSinceCapCheck++;
        if (appendsSinceCapCheck < capCheckInterval) {
            return;
        }
        appendsSinceCapCheck = 0;
        try {
            pruneMaxRecords(maxRecords);
        } catch (StorageException e) {
            log.error("Record cap enforcement failed", e);
        }
    }

    public List<TelemetryRecord> getUnuploaded(int limit) {
        return getUnuploadedAfter(0L, limit);
    }

    /**
     * Un-uploaded records with {@code id > afterId}, oldest first.
     */
    public List<TelemetryRecord> getUnuploadedAfter(long afterId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM telemetry_history WHERE uploaded=0 AND id>? ORDER BY id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, afterId);
            ps.setInt(2, limit);
            return readRecords(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to read un-uploaded records", e);
        }
    }

    /**
     * Flags the given records as uploaded. Unknown and already uploaded ids
     * are ignored.
     *
     * @return number of rows that changed state
     */
    public int markUploaded(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    int changed = 0;
                    for (int from = 0; from < distinct.size(); from += MARK_CHUNK_SIZE) {
                        List<Long> chunk = distinct.subList(from, Math.min(distinct.size(), from + MARK_CHUNK_SIZE));
                        String sql = "UPDATE telemetry_history SET uploaded=1 WHERE uploaded=0 AND id IN ("
                                + placeholders(chunk.size()) + ")";
                        try (PreparedStatement ps = c.prepareStatement(sql)) {
                            int i = 1;
                            for (Long id : chunk) {
                                ps.setLong(i++, id);
                            }
                            changed += ps.executeUpdate();
                        }
                    }
                    c.commit();
                    return changed;
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                throw new StorageException("Failed to mark records uploaded", e);
            }
        }
    }

    /**
     * Deletes uploaded records persisted more than {@code retentionSeconds}
     * ago. Records still waiting for upload are never touched.
     */
    public int pruneUploaded(long retentionSeconds) {
        long cutoffMs = clock.millis() - Math.max(0L, retentionSeconds) * 1000L;
        synchronized (writeLock) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "DELETE FROM telemetry_history WHERE uploaded=1 AND created_at_ms<?")) {
                ps.setLong(1, cutoffMs);
                int deleted = ps.executeUpdate();
                if (deleted > 0) {
                    log.info("Pruned {} uploaded records older than {}s", deleted, retentionSeconds);
                }
                return deleted;
            } catch (SQLException e) {
                throw new StorageException("Failed to prune uploaded records", e);
            }
        }
    }

    /**
     * Trims the log to at most {@code cap} rows, dropping the oldest ids first
     * whether or not they were uploaded.
     */
    public int pruneMaxRecords(int cap) {
        int keep = Math.max(0, cap);
        synchronized (writeLock) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    long total = countWhere(c, null);
                    if (total <= keep) {
                        c.commit();
                        return 0;
                    }
                    long excess = total - keep;
                    long droppedPending;
                    try (PreparedStatement ps = c.prepareStatement("""
                            SELECT COUNT(1) FROM (
                                SELECT uploaded FROM telemetry_history ORDER BY id ASC LIMIT ?
                            ) WHERE uploaded=0
                            """)) {
                        ps.setLong(1, excess);
                        try (ResultSet rs = ps.executeQuery()) {
                            droppedPending = rs.next() ? rs.getLong(1) : 0L;
                        }
                    }
                    int deleted;
                    try (PreparedStatement ps = c.prepareStatement("""
                            DELETE FROM telemetry_history
                            WHERE id IN (
                                SELECT id FROM telemetry_history
                                ORDER BY id ASC
                                LIMIT ?
                            )
                            """)) {
                        ps.setLong(1, excess);
                        deleted = ps.executeUpdate();
                    }
                    c.commit();
                    if (droppedPending > 0) {
                        log.warn("Record cap {} exceeded, dropped {} records of which {} were never uploaded",
                                keep, deleted, droppedPending);
                    } else {
                        log.info("Record cap {} exceeded, dropped {} uploaded records", keep, deleted);
                    }
                    return deleted;
                } catch (SQLException e) {
                    c.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                throw new StorageException("Failed to enforce record cap", e);
            }
        }
    }

    /**
     * Newest records first. The vehicle role only sees records received within
     * the configured history window; the remote role sees everything.
     */
    public List<TelemetryRecord> getHistory(int limit, int offset, Role role) {
        boolean windowed = role == Role.VEHICLE;
        String sql = "SELECT " + COLUMNS + " FROM telemetry_history"
                + (windowed ? " WHERE received_at_ms>=?" : "")
                + " ORDER BY recorded_at_ms DESC, id DESC LIMIT ? OFFSET ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (windowed) {
                ps.setLong(i++, clock.millis() - historyWindowMs);
            }
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
            return readRecords(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to read history", e);
        }
    }

    public Optional<TelemetryRecord> getLatestFor(int componentType, int componentId) {
        String sql = "SELECT " + COLUMNS + " FROM telemetry_history WHERE component_type=? AND component_id=?"
                + " ORDER BY recorded_at_ms DESC, id DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, componentType);
            ps.setInt(2, componentId);
            List<TelemetryRecord> rows = readRecords(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new StorageException("Failed to read latest record", e);
        }
    }

    public HistoryPage queryHistory(HistoryQuery query) {
        List<String> where = new ArrayList<>();
        List<Long> args = new ArrayList<>();
        if (query.fromRecordedAtMs() != null) {
            where.add("recorded_at_ms>=?");
            args.add(query.fromRecordedAtMs());
        }
        if (query.toRecordedAtMs() != null) {
            where.add("recorded_at_ms<=?");
            args.add(query.toRecordedAtMs());
        }
        if (query.componentType() != null) {
            where.add("component_type=?");
            args.add(query.componentType().longValue());
        }
        if (query.componentId() != null) {
            where.add("component_id=?");
            args.add(query.componentId().longValue());
        }
        if (query.commandId() != null) {
            where.add("command_id=?");
            args.add(query.commandId().longValue());
        }
        String filter = where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where);
        try (Connection c = database.openConnection()) {
            long total;
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM telemetry_history" + filter)) {
                bindLongs(ps, args, 1);
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0L;
                }
            }
            List<TelemetryRecord> rows;
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM telemetry_history" + filter
                    + " ORDER BY recorded_at_ms DESC, id DESC LIMIT ? OFFSET ?")) {
                int next = bindLongs(ps, args, 1);
                ps.setInt(next++, query.limit());
                ps.setInt(next, query.offset());
                rows = readRecords(ps);
            }
            boolean hasMore = query.offset() + rows.size() < total;
            return new HistoryPage(rows, total, query.limit(), query.offset(), hasMore);
        } catch (SQLException e) {
            throw new StorageException("Failed to query history", e);
        }
    }

    public List<TelemetryRecord> componentHistory(int componentType, int componentId, Integer commandId, int limit) {
        HistoryQuery query = HistoryQuery.page(limit, 0).withComponent(componentType, componentId, commandId);
        return queryHistory(query).records();
    }

    /**
     * Every component seen in the log with its most recent record.
     */
    public List<ActiveComponent> activeComponents() {
        String sql = """
                SELECT t.component_type,t.component_id,t.command_id,t.value,t.recorded_at_ms,g.records
                FROM telemetry_history t
                JOIN (
                    SELECT component_type,component_id,MAX(id) AS last_id,COUNT(1) AS records
                    FROM telemetry_history
                    GROUP BY component_type,component_id
                ) g ON t.id=g.last_id
                ORDER BY t.component_type ASC, t.component_id ASC
                """;
        List<ActiveComponent> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ActiveComponent(
                        rs.getInt("component_type"),
                        rs.getInt("component_id"),
                        rs.getInt("command_id"),
                        rs.getLong("value"),
                        rs.getLong("recorded_at_ms"),
                        rs.getLong("records")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list active components", e);
        }
    }

    public StoreStats loadStats() {
        try (Connection c = database.openConnection()) {
            long total = countWhere(c, null);
            long uploaded = countWhere(c, "uploaded=1");
            long oldestRecorded = 0L;
            long newestRecorded = 0L;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT MIN(recorded_at_ms),MAX(recorded_at_ms) FROM telemetry_history");
                 ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    oldestRecorded = rs.getLong(1);
                    newestRecorded = rs.getLong(2);
                }
            }
            long oldestPendingId = 0L;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT MIN(id) FROM telemetry_history WHERE uploaded=0");
                 ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    oldestPendingId = rs.getLong(1);
                }
            }
            return new StoreStats(total, uploaded, total - uploaded, oldestRecorded, newestRecorded,
                    oldestPendingId, database.fileSizeBytes());
        } catch (SQLException e) {
            throw new StorageException("Failed to load store stats", e);
        }
    }

    public long countPending() {
        try (Connection c = database.openConnection()) {
            return countWhere(c, "uploaded=0");
        } catch (SQLException e) {
            throw new StorageException("Failed to count pending records", e);
        }
    }

    /**
     * Last event appended by this process, if any.
     */
    public Optional<TelemetryEvent> currentState() {
        return Optional.ofNullable(currentState.get());
    }

    private long countWhere(Connection c, String condition) throws SQLException {
        String sql = "SELECT COUNT(1) FROM telemetry_history" + (condition == null ? "" : " WHERE " + condition);
        try (PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private int bindLongs(PreparedStatement ps, List<Long> args, int start) throws SQLException {
        int i = start;
        for (Long arg : args) {
            ps.setLong(i++, arg);
        }
        return i;
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private List<TelemetryRecord> readRecords(PreparedStatement ps) throws SQLException {
        List<TelemetryRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new TelemetryRecord(
                        rs.getLong("id"),
                        rs.getLong("recorded_at_ms"),
                        rs.getLong("received_at_ms"),
                        rs.getLong("created_at_ms"),
                        rs.getInt("message_type"),
                        rs.getInt("component_type"),
                        rs.getInt("component_id"),
                        rs.getInt("command_id"),
                        rs.getInt("value_type"),
                        rs.getLong("value"),
                        rs.getInt("uploaded") == 1
                ));
            }
        }
        return out;
    }

    public record HistoryPage(List<TelemetryRecord> records, long total, int limit, int offset, boolean hasMore) {}

    public record ActiveComponent(int componentType, int componentId, int lastCommandId, long lastValue,
                                  long lastRecordedAtMs, long records) {}

    public record StoreStats(long totalRecords, long uploadedRecords, long pendingRecords, long oldestRecordedAtMs,
                             long newestRecordedAtMs, long oldestPendingId, long databaseSizeBytes) {}
}
