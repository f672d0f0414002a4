package io.kartlink.uplink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.kartlink.model.TelemetryRecord;
import io.kartlink.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON framing of uplink batches and acknowledgments.
 *
 * <p>A batch is an array of records; an acknowledgment is
 * {@code {"status":"ok","processed_ids":[...]}}.
 */
public final class UplinkCodec {
    public static final String STATUS_OK = "ok";

    private UplinkCodec() {
    }

    public static String encodeBatch(List<TelemetryRecord> records) {
        List<WireRecord> wire = new ArrayList<>(records.size());
        for (TelemetryRecord r : records) {
            wire.add(new WireRecord(
                    r.id(),
                    r.recordedAtMs(),
                    r.messageType(),
                    r.componentType(),
                    r.componentId(),
                    r.commandId(),
                    r.valueType(),
                    r.value()
            ));
        }
        return Jsons.toCompactJson(wire);
    }

    public static Ack decodeAck(String text) throws ProtocolException {
        JsonNode root;
        try {
            root = Jsons.compactMapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Ack is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Ack must be a JSON object");
        }
        String status = root.path("status").asText("");
        if (!STATUS_OK.equals(status)) {
            throw new ProtocolException("Ack status is not ok: " + (status.isEmpty() ? "<missing>" : status));
        }
        JsonNode ids = root.get("processed_ids");
        if (ids == null || !ids.isArray()) {
            throw new ProtocolException("Ack has no processed_ids array");
        }
        List<Long> processed = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            if (!id.canConvertToLong() || !id.isIntegralNumber()) {
                throw new ProtocolException("Ack contains a non-integer id: " + id);
            }
            processed.add(id.asLong());
        }
        return new Ack(status, List.copyOf(processed));
    }

    public static String encodeAck(List<Long> processedIds) {
        return Jsons.toCompactJson(new AckBody(STATUS_OK, processedIds));
    }

    public record Ack(String status, List<Long> processedIds) {}

    record WireRecord(
            @JsonProperty("id") long id,
            @JsonProperty("recorded_at") long recordedAt,
            @JsonProperty("message_type") int messageType,
            @JsonProperty("component_type") int componentType,
            @JsonProperty("component_id") int componentId,
            @JsonProperty("command_id") int commandId,
            @JsonProperty("value_type") int valueType,
            @JsonProperty("value") long value
    ) {
    }

    record AckBody(
            @JsonProperty("status") String status,
            @JsonProperty("processed_ids") List<Long> processedIds
    ) {
    }
}
