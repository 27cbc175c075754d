package com.aerotravel.realtime.transport.phoenix;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * PhoenixMessageCodec
 * =============================================================================
 * JSON codec for the Phoenix channel protocol (serializer {@code 1.0.0}).
 *
 * <h2>Frame shape</h2>
 * <pre>
 *   {"topic": "...", "event": "...", "payload": {...}, "ref": "7", "join_ref": "3"}
 * </pre>
 *
 * <h2>Row changes</h2>
 * A {@code postgres_changes} frame carries the change under {@code payload.data}:
 * {@code type}, {@code schema}, {@code table}, {@code record},
 * {@code old_record}, {@code commit_timestamp}. The server sends an empty
 * object where an image is absent; those are mapped to {@code null}.
 *
 * <p>This class only translates. It does not track refs, topics or joins.</p>
 */
public final class PhoenixMessageCodec {

    private final ObjectMapper mapper;

    public PhoenixMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(PhoenixMessage message) {
        Objects.requireNonNull(message, "message");
        ObjectNode frame = mapper.createObjectNode();
        frame.put("topic", message.topic());
        frame.put("event", message.event());
        frame.set("payload", message.payload());
        frame.put("ref", message.ref());
        frame.put("join_ref", message.joinRef());
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode frame for topic " + message.topic(), e);
        }
    }

    /**
     * @throws PhoenixDecodeException if {@code text} is not a Phoenix frame
     */
    public PhoenixMessage decode(String text) {
        Objects.requireNonNull(text, "text");
        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new PhoenixDecodeException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new PhoenixDecodeException("Frame is not a JSON object");
        }

        JsonNode topic = root.get("topic");
        JsonNode event = root.get("event");
        if (topic == null || !topic.isTextual() || event == null || !event.isTextual()) {
            throw new PhoenixDecodeException("Frame lacks topic or event");
        }

        return new PhoenixMessage(
                topic.asText(),
                event.asText(),
                root.get("payload"),
                textOrNull(root.get("ref")),
                textOrNull(root.get("join_ref")));
    }

    /**
     * Join payload for one channel.
     */
    public ObjectNode joinPayload(ChannelConfig config, String accessToken) {
        Objects.requireNonNull(config, "config");

        ObjectNode change = mapper.createObjectNode();
        change.put("event", config.event().wireValue());
        change.put("schema", config.schema());
        change.put("table", config.table());
        if (config.filter() != null) {
            change.put("filter", config.filter());
        }

        ObjectNode cfg = mapper.createObjectNode();
        cfg.putObject("broadcast").put("ack", false).put("self", false);
        cfg.putObject("presence").put("key", "");
        cfg.putArray("postgres_changes").add(change);
        cfg.put("private", false);

        ObjectNode payload = mapper.createObjectNode();
        payload.set("config", cfg);
        if (accessToken != null) {
            payload.put("access_token", accessToken);
        }
        return payload;
    }

    public ObjectNode accessTokenPayload(String accessToken) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("access_token", Objects.requireNonNull(accessToken, "accessToken"));
        return payload;
    }

    public ObjectNode emptyPayload() {
        return mapper.createObjectNode();
    }

    /**
     * Map a {@code postgres_changes} payload to a row change.
     *
     * @throws PhoenixDecodeException if the payload is missing fields or
     *         violates the row-image invariants
     */
    public RowChangePayload<JsonNode> decodeRowChange(JsonNode payload) {
        JsonNode data = payload.get("data");
        if (data == null || !data.isObject()) {
            throw new PhoenixDecodeException("postgres_changes frame lacks data");
        }

        final ChangeEvent type;
        try {
            type = ChangeEvent.fromWire(data.path("type").asText(""));
        } catch (IllegalArgumentException e) {
            throw new PhoenixDecodeException("Unknown change type: " + data.path("type"), e);
        }

        JsonNode table = data.get("table");
        if (table == null || !table.isTextual()) {
            throw new PhoenixDecodeException("postgres_changes frame lacks table");
        }

        try {
            return new RowChangePayload<>(
                    type,
                    textOrNull(data.get("schema")),
                    table.asText(),
                    imageOrNull(data.get("record")),
                    imageOrNull(data.get("old_record")),
                    timestampOrNull(data.get("commit_timestamp")));
        } catch (IllegalArgumentException e) {
            throw new PhoenixDecodeException("Malformed row change on " + table.asText(), e);
        }
    }

    private static JsonNode imageOrNull(JsonNode node) {
        if (node == null || node.isNull() || (node.isObject() && node.isEmpty())) {
            return null;
        }
        return node;
    }

    private static String textOrNull(JsonNode node) {
        return (node == null || node.isNull()) ? null : node.asText();
    }

    private static Instant timestampOrNull(JsonNode node) {
        String text = textOrNull(node);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new PhoenixDecodeException("Bad commit_timestamp: " + text, e);
        }
    }
}
