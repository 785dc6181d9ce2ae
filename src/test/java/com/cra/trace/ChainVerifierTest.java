package com.cra.trace;

import com.cra.config.CraProperties;
import com.cra.error.ChainIntegrityException;
import com.cra.protocol.ProtocolCodec;
import com.cra.trace.ChainVerification.ErrorType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ChainVerifierTest {

    private static final String GENESIS = CraProperties.ZERO_GENESIS;

    private List<TraceEvent> chain;

    @BeforeEach
    void setUp() {
        chain = buildChain("s-1", 5);
    }

    static List<TraceEvent> buildChain(String sessionId, int size) {
        List<TraceEvent> events = new ArrayList<>();
        String previous = GENESIS;
        for (int i = 0; i < size; i++) {
            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("index", i);
            RawEvent raw = new RawEvent(sessionId, "trace-1", "evt-" + i, "span-" + i, null,
                i == 0 ? EventType.SESSION_STARTED : EventType.POLICY_EVALUATED, payload,
                Instant.parse("2026-01-01T00:00:00Z").plusSeconds(i));
            TraceEvent event = TraceEvent.seal(raw, i, previous);
            events.add(event);
            previous = event.eventHash();
        }
        return events;
    }

    private static TraceEvent withPayload(TraceEvent e, JsonNode payload) {
        return new TraceEvent(e.traceVersion(), e.sessionId(), e.traceId(), e.eventId(), e.spanId(),
            e.parentSpanId(), e.sequence(), e.timestamp(), e.eventType(), payload, e.eventHash(),
            e.previousEventHash());
    }

    @Test
    void intactChain_isValid() {
        ChainVerification result = ChainVerifier.verify(chain, GENESIS);
        assertTrue(result.valid());
        assertEquals(5, result.eventCount());
        assertEquals(chain.get(4).eventHash(), result.lastValidHash());
        assertNull(result.firstInvalidIndex());
    }

    @Test
    void emptyChain_isValidAtGenesis() {
        ChainVerification result = ChainVerifier.verify(List.of(), GENESIS);
        assertTrue(result.valid());
        assertEquals(GENESIS, result.lastValidHash());
    }

    @Test
    void hash_isLowercaseHexSha256() {
        assertTrue(chain.get(0).eventHash().matches("[0-9a-f]{64}"));
        assertEquals(GENESIS, chain.get(0).previousEventHash());
    }

    @Nested
    @DisplayName("Tamper detection")
    class Tampering {

        @Test
        void payloadEdit_isHashMismatchAtThatIndex() {
            ObjectNode forged = JsonNodeFactory.instance.objectNode();
            forged.put("index", 99);
            chain.set(2, withPayload(chain.get(2), forged));

            ChainVerification result = ChainVerifier.verify(chain, GENESIS);
            assertFalse(result.valid());
            assertEquals(2, result.firstInvalidIndex());
            assertEquals(ErrorType.HASH_MISMATCH, result.errorType());
            assertEquals(chain.get(1).eventHash(), result.lastValidHash());
        }

        @Test
        void removedEvent_breaksChain() {
            chain.remove(2);
            ChainVerification result = ChainVerifier.verify(chain, GENESIS);
            assertEquals(2, result.firstInvalidIndex());
            assertEquals(ErrorType.CHAIN_BROKEN, result.errorType());
        }

        @Test
        void wrongGenesis_isReportedAtIndexZero() {
            ChainVerification result = ChainVerifier.verify(chain, "f".repeat(64));
            assertEquals(0, result.firstInvalidIndex());
            assertEquals(ErrorType.INVALID_GENESIS, result.errorType());
            assertEquals("f".repeat(64), result.lastValidHash());
        }

        @Test
        void renumberedEvent_isSequenceGap() {
            TraceEvent e = chain.get(1);
            TraceEvent renumbered = new TraceEvent(e.traceVersion(), e.sessionId(), e.traceId(), e.eventId(),
                e.spanId(), e.parentSpanId(), 7, e.timestamp(), e.eventType(), e.payload(), null,
                e.previousEventHash());
            chain.set(1, renumbered.withEventHash(TraceHasher.hash(renumbered)));
            ChainVerification result = ChainVerifier.verify(chain, GENESIS);
            assertEquals(1, result.firstInvalidIndex());
            assertEquals(ErrorType.SEQUENCE_GAP, result.errorType());
        }

        @Test
        void orThrow_raisesChainIntegrityError() {
            chain.remove(0);
            ChainVerification result = ChainVerifier.verify(chain, GENESIS);
            ChainIntegrityException ex = assertThrows(ChainIntegrityException.class, () -> result.orThrow("s-1"));
            assertEquals(0, ex.getFirstInvalidIndex());
        }
    }

    @Test
    void jsonRoundTrip_keepsChainVerifiable() {
        ProtocolCodec codec = new ProtocolCodec();
        List<TraceEvent> parsed = new ArrayList<>();
        for (TraceEvent event : chain) {
            String json = codec.toJson(event);
            assertTrue(json.contains("\"event_type\":\"" + event.eventType().getValue() + "\""));
            parsed.add(codec.fromJson(json, TraceEvent.class));
        }
        assertTrue(ChainVerifier.verify(parsed, GENESIS).valid());
    }

    @Test
    void divergenceAndExtension() {
        List<TraceEvent> prefix = chain.subList(0, 3);
        assertTrue(ChainVerifier.isExtension(prefix, chain));
        assertFalse(ChainVerifier.isExtension(chain, prefix));
        assertEquals(OptionalInt.empty(), ChainVerifier.findDivergence(chain, new ArrayList<>(chain)));
        assertEquals(OptionalInt.of(3), ChainVerifier.findDivergence(prefix, chain));

        List<TraceEvent> other = buildChain("s-2", 5);
        assertEquals(OptionalInt.of(0), ChainVerifier.findDivergence(chain, other));
        assertFalse(ChainVerifier.isExtension(prefix, other));
    }
}
