package com.cra.protocol;

import com.cra.error.SerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionJsonTest {

    private final ProtocolCodec codec = new ProtocolCodec();

    @Nested
    @DisplayName("Decision wire shape")
    class WireShape {

        @Test
        void allow_isTaggedObject() {
            assertEquals("{\"type\":\"allow\"}", codec.toJson(Decision.allow()));
        }

        @Test
        void deny_carriesReason() {
            JsonNode node = codec.toTree(Decision.deny("nope"));
            assertEquals("deny", node.get("type").asText());
            assertEquals("nope", node.get("reason").asText());
        }

        @Test
        void requiresApproval_usesSnakeCaseTimeout() {
            JsonNode node = codec.toTree(Decision.requiresApproval("ops", 600));
            assertEquals("requires_approval", node.get("type").asText());
            assertEquals("ops", node.get("approver").asText());
            assertEquals(600, node.get("timeout_seconds").asLong());
        }

        @Test
        void parse_selectsVariantFromTag() {
            Decision decision = codec.fromJson("{\"type\":\"partial\",\"reason\":\"some throttled\"}", Decision.class);
            assertInstanceOf(Decision.Partial.class, decision);
            assertEquals("some throttled", ((Decision.Partial) decision).reason());
        }

        @Test
        void parse_unknownTag_raisesSerializationError() {
            assertThrows(SerializationException.class,
                () -> codec.fromJson("{\"type\":\"maybe\"}", Decision.class));
        }
    }

    @Test
    @DisplayName("Resolution survives a JSON round trip with its decision variant")
    void resolution_roundTrip() {
        CarpResolution resolution = new CarpResolution(
            CarpRequest.CARP_VERSION, "res-1", "req-1", "s-1",
            Instant.parse("2026-01-01T00:00:00.123456Z"),
            Decision.requiresApproval("operator", 3600),
            List.of(new ContextBlock("trace-guide", "dev-tools", "text/markdown", 5, 3, "body")),
            List.of(new AllowedAction("file.read", "Read", null, null, RiskTier.LOW)),
            List.of(new DeniedAction("db.drop", "no-db", "database changes are not allowed")),
            List.of(new Constraint("approval_required", "approval from operator within 3600s")),
            300, "trace-1");

        String json = codec.toJson(resolution);
        assertTrue(json.startsWith("{\"carp_version\":\"1.0\",\"resolution_id\":\"res-1\""));
        assertTrue(json.contains("\"timestamp\":\"2026-01-01T00:00:00.123456Z\""));

        CarpResolution parsed = codec.fromJson(json, CarpResolution.class);
        assertEquals(resolution, parsed);
        assertTrue(parsed.isActionAllowed("file.read"));
        assertFalse(parsed.isActionAllowed("db.drop"));
        assertEquals("database changes are not allowed", parsed.denialReason("db.drop").orElseThrow());
    }

    @Test
    void resolution_expiry_isPureRead() {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        CarpResolution resolution = new CarpResolution(CarpRequest.CARP_VERSION, "r", "q", "s", at,
            Decision.allow(), null, null, null, null, 60, "t");
        assertEquals(at.plusSeconds(60), resolution.expiresAt());
        assertFalse(resolution.isExpired(at.plusSeconds(60)));
        assertTrue(resolution.isExpired(at.plusSeconds(61)));
    }

    @Test
    void riskTier_ordering() {
        assertTrue(RiskTier.CRITICAL.isAbove(RiskTier.HIGH));
        assertTrue(RiskTier.HIGH.isAtLeast(RiskTier.HIGH));
        assertFalse(RiskTier.LOW.isAtLeast(RiskTier.MEDIUM));
        assertEquals(RiskTier.MEDIUM, RiskTier.fromValue("Medium"));
    }
}
