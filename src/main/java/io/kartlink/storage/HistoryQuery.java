package io.kartlink.storage;

/**
 * Filters for paginated history reads. Null fields are not applied.
 */
public record HistoryQuery(
        int limit,
        int offset,
        Long fromRecordedAtMs,
        Long toRecordedAtMs,
        Integer componentType,
        Integer componentId,
        Integer commandId
) {
    public static final int DEFAULT_LIMIT = 100;

    public HistoryQuery {
        limit = Math.max(1, limit);
        offset = Math.max(0, offset);
    }

    public static HistoryQuery page(int limit, int offset) {
        return new HistoryQuery(limit, offset, null, null, null, null, null);
    }

    public HistoryQuery withTimeRange(Long fromMs, Long toMs) {
        return new HistoryQuery(limit, offset, fromMs, toMs, componentType, componentId, commandId);
    }

    public HistoryQuery withComponent(Integer type, Integer id, Integer command) {
        return new HistoryQuery(limit, offset, fromRecordedAtMs, toRecordedAtMs, type, id, command);
    }
}
