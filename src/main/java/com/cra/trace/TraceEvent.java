package com.cra.trace;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A chained, immutable audit event. {@code eventHash} commits to
 * {@code previousEventHash} and to every other field, payload included.
 */
@JsonPropertyOrder({"trace_version", "session_id", "trace_id", "event_id", "span_id", "parent_span_id",
    "sequence", "timestamp", "event_type", "payload", "event_hash", "previous_event_hash"})
public record TraceEvent(
    @JsonProperty("trace_version") String traceVersion,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("span_id") String spanId,
    @JsonProperty("parent_span_id") String parentSpanId,
    @JsonProperty("sequence") long sequence,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("payload") JsonNode payload,
    @JsonProperty("event_hash") String eventHash,
    @JsonProperty("previous_event_hash") String previousEventHash
) {

    public static final String TRACE_VERSION = "1.0";

    public TraceEvent {
        payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
    }

    /** A copy; the stored payload is covered by {@link #eventHash()} and never handed out. */
    @Override
    @JsonProperty("payload")
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /** Places a raw event at {@code sequence} after {@code previousHash} and seals it. */
    public static TraceEvent seal(RawEvent raw, long sequence, String previousHash) {
        TraceEvent unsealed = new TraceEvent(TRACE_VERSION, raw.sessionId(), raw.traceId(), raw.eventId(),
            raw.spanId(), raw.parentSpanId(), sequence, raw.timestamp(), raw.eventType(), raw.payload(),
            null, previousHash);
        return unsealed.withEventHash(TraceHasher.hash(unsealed));
    }

    public TraceEvent withEventHash(String hash) {
        return new TraceEvent(traceVersion, sessionId, traceId, eventId, spanId, parentSpanId, sequence,
            timestamp, eventType, payload, hash, previousEventHash);
    }

    /** Every field except the two hashes, as hashed. */
    @JsonIgnore
    public ObjectNode canonicalBody() {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("trace_version", traceVersion);
        body.put("session_id", sessionId);
        body.put("trace_id", traceId);
        body.put("event_id", eventId);
        body.put("span_id", spanId);
        if (parentSpanId == null) {
            body.putNull("parent_span_id");
        } else {
            body.put("parent_span_id", parentSpanId);
        }
        body.put("sequence", sequence);
        body.put("timestamp", timestamp == null ? null : timestamp.toString());
        body.put("event_type", eventType == null ? null : eventType.getValue());
        body.set("payload", payload.deepCopy());
        return body;
    }
}
