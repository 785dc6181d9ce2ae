package com.cra.trace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * An event as produced by the resolver, before it is placed in a chain.
 * Carries no sequence or hashes; the trace worker assigns those.
 */
public record RawEvent(
    String sessionId,
    String traceId,
    String eventId,
    String spanId,
    String parentSpanId,
    EventType eventType,
    JsonNode payload,
    Instant timestamp
) {

    public RawEvent {
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        timestamp = timestamp == null ? null : timestamp.truncatedTo(ChronoUnit.MICROS);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public static RawEvent of(String sessionId, String traceId, EventType type, JsonNode payload,
                              String parentSpanId) {
        return new RawEvent(
            sessionId,
            traceId,
            UUID.randomUUID().toString(),
            newSpanId(),
            parentSpanId,
            type,
            payload,
            Instant.now()
        );
    }

    public static String newSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
