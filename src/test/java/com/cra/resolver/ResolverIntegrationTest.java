package com.cra.resolver;

import com.cra.TestAtlases;
import com.cra.error.InvalidStateException;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.CarpResolution;
import com.cra.protocol.Decision;
import com.cra.protocol.ProtocolCodec;
import com.cra.trace.ChainVerification;
import com.cra.trace.EventType;
import com.cra.trace.TraceEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flow against the wired context:
 * load atlas -> create session -> resolve -> end -> read and verify trace.
 */
@SpringBootTest(properties = {
    "cra.trace.genesis-seed=1111111111111111111111111111111111111111111111111111111111111111",
    "cra.policy.session-rate-limit.max-requests=3"
})
class ResolverIntegrationTest {

    private static final String SEED = "1".repeat(64);

    @Autowired Resolver resolver;
    @Autowired ProtocolCodec codec;

    @BeforeEach
    void loadAtlas() {
        if (!resolver.listAtlases().contains(TestAtlases.DEV_TOOLS)) {
            resolver.loadAtlas(TestAtlases.devTools());
        }
    }

    @Test
    @DisplayName("Full session: resolve, end, trace verifies against the configured seed")
    void fullSession_isVerifiable() {
        String agent = "agent-" + UUID.randomUUID().toString().substring(0, 8);
        String id = resolver.createSession(agent, "maintain tracing docs").getSessionId();

        CarpResolution resolution = resolver.resolve(id, agent,
            CarpRequest.builder(id, agent, "hash trace event hashing").requiredCapabilities("file.read").build());
        assertEquals(Decision.allow(), resolution.decision());
        assertEquals("trace-guide", resolution.contextBlocks().get(0).blockId());

        resolver.endSession(id);
        assertThrows(InvalidStateException.class,
            () -> resolver.resolve(id, agent, CarpRequest.builder(id, agent, "more").build()));

        List<TraceEvent> trace = resolver.getTrace(id);
        assertEquals(SEED, trace.get(0).previousEventHash());
        assertEquals(EventType.SESSION_ENDED, trace.get(trace.size() - 1).eventType());

        ChainVerification verification = resolver.verifyChain(id);
        assertTrue(verification.valid(), () -> codec.toJson(verification));
    }

    @Test
    void sessionRateLimit_fromProperties_deniesFourthRequest() {
        String id = resolver.createSession("agent-rl", "g").getSessionId();
        for (int i = 0; i < 3; i++) {
            resolver.resolve(id, "agent-rl", CarpRequest.builder(id, "agent-rl", "read").build());
        }
        CarpResolution fourth = resolver.resolve(id, "agent-rl", CarpRequest.builder(id, "agent-rl", "read").build());
        assertInstanceOf(Decision.Deny.class, fourth.decision());
    }

    @Test
    void traceEventJson_hasWireFieldNames() {
        String id = resolver.createSession("agent-json", "g").getSessionId();
        TraceEvent first = resolver.getTrace(id).get(0);
        JsonNode json = codec.toTree(first);
        assertEquals("1.0", json.get("trace_version").asText());
        assertEquals("session.started", json.get("event_type").asText());
        assertEquals(0, json.get("sequence").asLong());
        assertTrue(json.has("previous_event_hash"));
        assertTrue(json.has("event_hash"));
    }
}
