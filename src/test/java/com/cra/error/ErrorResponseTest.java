package com.cra.error;

import com.cra.protocol.ProtocolCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorResponseTest {

    @Test
    void typedError_keepsItsCodeAndMessage() {
        ErrorResponse response = ErrorResponse.from(new NotFoundException("session", "s-9"));
        assertEquals("NOT_FOUND", response.errorCode());
        assertEquals("session not found: s-9", response.message());
        assertEquals(404, ErrorResponse.statusOf(new NotFoundException("session", "s-9")));
    }

    @Test
    void unexpectedError_isInternalWithoutDetails() {
        ErrorResponse response = ErrorResponse.from(new IllegalStateException("boom"));
        assertEquals("INTERNAL_ERROR", response.errorCode());
        assertFalse(response.message().contains("boom"));
        assertEquals(500, ErrorResponse.statusOf(new IllegalStateException("boom")));
    }

    @Test
    void validationError_joinsViolations() {
        ValidationException ex = new ValidationException("invalid atlas x", List.of("a is required", "b is required"));
        assertEquals(ErrorCode.VALIDATION_ERROR, ex.getErrorCode());
        assertEquals("invalid atlas x: a is required; b is required", ex.getMessage());
    }

    @Test
    void backpressure_mapsTo503() {
        assertEquals(503, ErrorResponse.statusOf(new BackpressureException(16, "e-1")));
    }

    @Test
    void actionDenied_mapsTo403_andKeepsPolicy() {
        ActionDeniedException ex = new ActionDeniedException("db.drop", "no-db", "database changes are not allowed");
        assertEquals(403, ErrorResponse.statusOf(ex));
        assertEquals("ACTION_DENIED", ErrorResponse.from(ex).errorCode());
        assertEquals("no-db", ex.getPolicyId());
        assertEquals("action db.drop denied: database changes are not allowed", ex.getMessage());
    }

    @Test
    void body_usesSnakeCaseFields() {
        JsonNode json = new ProtocolCodec().toTree(ErrorResponse.from(new InvalidStateException("ended")));
        assertEquals("INVALID_STATE", json.get("error_code").asText());
        assertTrue(json.has("timestamp"));
    }
}
