package com.aerotravel.realtime.transport.phoenix;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * One Phoenix channel frame.
 *
 * @param topic   {@code realtime:<channel>} for channel traffic, {@code phoenix} for heartbeats
 * @param event   {@code phx_join}, {@code phx_reply}, {@code postgres_changes}, ...
 * @param payload event body; an empty object when the frame carries none
 * @param ref     client-assigned reference echoed by the server in replies; may be {@code null}
 * @param joinRef ref of the join that opened the topic; may be {@code null}
 */
public record PhoenixMessage(
        String topic,
        String event,
        JsonNode payload,
        String ref,
        String joinRef
) {
    public static final String TOPIC_PREFIX = "realtime:";
    public static final String PHOENIX_TOPIC = "phoenix";

    public static final String EVENT_JOIN = "phx_join";
    public static final String EVENT_LEAVE = "phx_leave";
    public static final String EVENT_REPLY = "phx_reply";
    public static final String EVENT_ERROR = "phx_error";
    public static final String EVENT_CLOSE = "phx_close";
    public static final String EVENT_HEARTBEAT = "heartbeat";
    public static final String EVENT_ACCESS_TOKEN = "access_token";
    public static final String EVENT_POSTGRES_CHANGES = "postgres_changes";
    public static final String EVENT_SYSTEM = "system";

    public PhoenixMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(event, "event");
        payload = (payload == null || payload.isNull()) ? JsonNodeFactory.instance.objectNode() : payload;
    }

    public boolean isReplyTo(String expectedRef) {
        return EVENT_REPLY.equals(event) && expectedRef != null && expectedRef.equals(ref);
    }

    /**
     * {@code payload.status} of a reply or system frame, or {@code ""}.
     */
    public String status() {
        return payload.path("status").asText("");
    }
}
