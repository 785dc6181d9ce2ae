package com.cra.trace;

import com.cra.error.ChainIntegrityException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of verifying a chain. A broken chain is a normal result, not an
 * exception; {@link #orThrow} converts it for callers that want one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"valid", "event_count", "first_invalid_index", "error_type", "error_message",
    "last_valid_hash"})
public record ChainVerification(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("event_count") int eventCount,
    @JsonProperty("first_invalid_index") Integer firstInvalidIndex,
    @JsonProperty("error_type") ErrorType errorType,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("last_valid_hash") String lastValidHash
) {

    public enum ErrorType {
        INVALID_GENESIS("invalid_genesis"),
        CHAIN_BROKEN("chain_broken"),
        SEQUENCE_GAP("sequence_gap"),
        HASH_MISMATCH("hash_mismatch");

        private final String value;

        ErrorType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public static ChainVerification ok(int eventCount, String lastHash) {
        return new ChainVerification(true, eventCount, null, null, null, lastHash);
    }

    public static ChainVerification broken(int eventCount, int index, ErrorType type, String message,
                                           String lastValidHash) {
        return new ChainVerification(false, eventCount, index, type, message, lastValidHash);
    }

    public ChainVerification orThrow(String sessionId) {
        if (!valid) {
            throw new ChainIntegrityException(sessionId, firstInvalidIndex,
                "chain for session " + sessionId + " is broken at index " + firstInvalidIndex
                    + " (" + errorType.getValue() + "): " + errorMessage);
        }
        return this;
    }
}
