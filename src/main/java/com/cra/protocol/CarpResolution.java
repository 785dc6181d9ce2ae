package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The engine's answer to one {@link CarpRequest}. Produced once, never mutated.
 * The TTL tells the agent when to ask again. Once it has passed the engine
 * refuses to execute actions under this resolution.
 */
@JsonPropertyOrder({"carp_version", "resolution_id", "request_id", "session_id", "timestamp", "decision",
    "context_blocks", "allowed_actions", "denied_actions", "constraints", "ttl_seconds", "trace_id"})
public record CarpResolution(
    @JsonProperty("carp_version") String carpVersion,
    @JsonProperty("resolution_id") String resolutionId,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("context_blocks") List<ContextBlock> contextBlocks,
    @JsonProperty("allowed_actions") List<AllowedAction> allowedActions,
    @JsonProperty("denied_actions") List<DeniedAction> deniedActions,
    @JsonProperty("constraints") List<Constraint> constraints,
    @JsonProperty("ttl_seconds") long ttlSeconds,
    @JsonProperty("trace_id") String traceId
) {

    public CarpResolution {
        contextBlocks = contextBlocks == null ? List.of() : List.copyOf(contextBlocks);
        allowedActions = allowedActions == null ? List.of() : List.copyOf(allowedActions);
        deniedActions = deniedActions == null ? List.of() : List.copyOf(deniedActions);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public Instant expiresAt() {
        return timestamp.plusSeconds(ttlSeconds);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }

    public boolean isActionAllowed(String actionId) {
        return allowedActions.stream().anyMatch(a -> a.actionId().equals(actionId));
    }

    public Optional<String> denialReason(String actionId) {
        return deniedActions.stream()
            .filter(d -> d.actionId().equals(actionId))
            .map(DeniedAction::reason)
            .findFirst();
    }
}
