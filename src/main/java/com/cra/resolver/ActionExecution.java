package com.cra.resolver;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of an approved {@link Resolver#execute} call. The engine performs no
 * side effect itself; {@code result} is the acknowledgement recorded in the trace.
 */
@JsonPropertyOrder({"execution_id", "resolution_id", "action_id", "duration_ms", "result"})
public record ActionExecution(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("resolution_id") String resolutionId,
    @JsonProperty("action_id") String actionId,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("result") JsonNode result
) {

    public ActionExecution {
        result = result == null ? null : result.deepCopy();
    }

    @Override
    @JsonProperty("result")
    public JsonNode result() {
        return result == null ? null : result.deepCopy();
    }
}
