package com.aerotravel.realtime.transport.phoenix;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.config.JacksonConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PhoenixMessageCodecTest
 * -----------------------------------------------------------------------------
 * Frame and row-change translation for the Phoenix JSON serializer.
 */
class PhoenixMessageCodecTest {

    private final ObjectMapper mapper = JacksonConfig.objectMapper();
    private final PhoenixMessageCodec codec = new PhoenixMessageCodec(mapper);

    @Test
    void encodesJoinRefInSnakeCase() throws Exception {
        String text = codec.encode(new PhoenixMessage("realtime:trip-T1", "phx_leave",
                codec.emptyPayload(), "4", "2"));

        JsonNode frame = mapper.readTree(text);
        assertEquals("realtime:trip-T1", frame.get("topic").asText());
        assertEquals("phx_leave", frame.get("event").asText());
        assertEquals("4", frame.get("ref").asText());
        assertEquals("2", frame.get("join_ref").asText());
        assertTrue(frame.get("payload").isObject());
    }

    @Test
    void decodesReplyFrame() {
        PhoenixMessage msg = codec.decode(
                "{\"topic\":\"realtime:trip-T1\",\"event\":\"phx_reply\","
                        + "\"payload\":{\"status\":\"ok\",\"response\":{}},\"ref\":\"3\",\"join_ref\":\"3\"}");

        assertEquals("realtime:trip-T1", msg.topic());
        assertTrue(msg.isReplyTo("3"));
        assertFalse(msg.isReplyTo("4"));
        assertEquals("ok", msg.status());
    }

    @Test
    void missingPayloadBecomesEmptyObject() {
        PhoenixMessage msg = codec.decode("{\"topic\":\"phoenix\",\"event\":\"phx_reply\",\"ref\":null}");

        assertTrue(msg.payload().isObject());
        assertNull(msg.ref());
        assertEquals("", msg.status());
    }

    @Test
    void rejectsMalformedFrames() {
        assertThrows(PhoenixDecodeException.class, () -> codec.decode("not json"));
        assertThrows(PhoenixDecodeException.class, () -> codec.decode("[1,2,3]"));
        assertThrows(PhoenixDecodeException.class, () -> codec.decode("{\"event\":\"phx_reply\"}"));
    }

    @Test
    void joinPayloadDescribesPostgresChanges() {
        ChannelConfig config = ChannelConfig.of("bookings", ChangeEvent.ALL, ChannelConfig.eq("package_id", "P1"));

        JsonNode payload = codec.joinPayload(config, "jwt-token");

        JsonNode change = payload.path("config").path("postgres_changes").get(0);
        assertEquals("*", change.get("event").asText());
        assertEquals("public", change.get("schema").asText());
        assertEquals("bookings", change.get("table").asText());
        assertEquals("package_id=eq.P1", change.get("filter").asText());
        assertEquals("jwt-token", payload.get("access_token").asText());
    }

    @Test
    void joinPayloadOmitsAbsentFilter() {
        JsonNode payload = codec.joinPayload(ChannelConfig.of("trips", ChangeEvent.INSERT), null);

        JsonNode change = payload.path("config").path("postgres_changes").get(0);
        assertFalse(change.has("filter"));
        assertFalse(payload.has("access_token"));
    }

    @Test
    void updateCarriesBothImages() throws Exception {
        RowChangePayload<JsonNode> change = codec.decodeRowChange(mapper.readTree(
                "{\"ids\":[1],\"data\":{\"type\":\"UPDATE\",\"schema\":\"public\",\"table\":\"bookings\","
                        + "\"commit_timestamp\":\"2025-01-02T03:04:05.678Z\","
                        + "\"record\":{\"id\":\"B123\",\"status\":\"confirmed\"},"
                        + "\"old_record\":{\"id\":\"B123\",\"status\":\"pending\"}}}"));

        assertEquals(ChangeEvent.UPDATE, change.eventType());
        assertEquals("bookings", change.table());
        assertEquals("confirmed", change.newRow().get("status").asText());
        assertEquals("pending", change.oldRow().get("status").asText());
        assertEquals(Instant.parse("2025-01-02T03:04:05.678Z"), change.commitTimestamp());
    }

    @Test
    void emptyImagesAreTreatedAsAbsent() throws Exception {
        RowChangePayload<JsonNode> insert = codec.decodeRowChange(mapper.readTree(
                "{\"data\":{\"type\":\"INSERT\",\"table\":\"trip_guides\",\"record\":{\"id\":\"b\"},\"old_record\":{}}}"));
        RowChangePayload<JsonNode> delete = codec.decodeRowChange(mapper.readTree(
                "{\"data\":{\"type\":\"DELETE\",\"table\":\"trip_guides\",\"record\":{},\"old_record\":{\"id\":\"a\"}}}"));

        assertNull(insert.oldRow());
        assertNull(delete.newRow());
        assertEquals("a", delete.latestImage().get("id").asText());
    }

    @Test
    void rejectsInvalidRowChanges() throws Exception {
        assertThrows(PhoenixDecodeException.class, () -> codec.decodeRowChange(mapper.readTree("{}")));
        assertThrows(PhoenixDecodeException.class, () -> codec.decodeRowChange(mapper.readTree(
                "{\"data\":{\"type\":\"TRUNCATE\",\"table\":\"trips\",\"record\":{\"id\":\"x\"}}}")));
        assertThrows(PhoenixDecodeException.class, () -> codec.decodeRowChange(mapper.readTree(
                "{\"data\":{\"type\":\"INSERT\",\"table\":\"trips\",\"record\":{}}}")));
        assertThrows(PhoenixDecodeException.class, () -> codec.decodeRowChange(mapper.readTree(
                "{\"data\":{\"type\":\"INSERT\",\"table\":\"trips\",\"record\":{\"id\":\"x\"},"
                        + "\"commit_timestamp\":\"yesterday\"}}")));
    }
}
