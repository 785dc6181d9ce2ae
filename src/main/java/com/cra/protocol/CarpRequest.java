package com.cra.protocol;

import com.cra.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An agent's ask to the governance engine. Immutable once built.
 */
@JsonPropertyOrder({"carp_version", "request_id", "timestamp", "operation", "requester", "task",
    "atlas_ids", "context"})
public record CarpRequest(
    @JsonProperty("carp_version") String carpVersion,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("operation") Operation operation,
    @JsonProperty("requester") Requester requester,
    @JsonProperty("task") Task task,
    @JsonProperty("atlas_ids") List<String> atlasIds,
    @JsonProperty("context") Map<String, Object> context
) {

    public static final String CARP_VERSION = "1.0";

    public CarpRequest {
        atlasIds = atlasIds == null ? List.of() : List.copyOf(atlasIds);
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @JsonPropertyOrder({"agent_id", "session_id", "parent_session_id"})
    public record Requester(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("parent_session_id") String parentSessionId
    ) {}

    @JsonPropertyOrder({"goal", "risk_tier", "context_hints", "required_capabilities"})
    public record Task(
        @JsonProperty("goal") String goal,
        @JsonProperty("risk_tier") RiskTier riskTier,
        @JsonProperty("context_hints") List<String> contextHints,
        @JsonProperty("required_capabilities") List<String> requiredCapabilities
    ) {
        public Task {
            contextHints = contextHints == null ? List.of() : List.copyOf(contextHints);
            requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        }
    }

    public String agentId() {
        return requester == null ? null : requester.agentId();
    }

    public String sessionId() {
        return requester == null ? null : requester.sessionId();
    }

    public String goal() {
        return task == null ? null : task.goal();
    }

    /**
     * Structural checks only. Policy questions are answered by the evaluator.
     */
    public void validate() {
        List<String> violations = new ArrayList<>();
        if (!CARP_VERSION.equals(carpVersion)) {
            violations.add("unsupported carp_version: " + carpVersion);
        }
        if (isBlank(requestId)) {
            violations.add("request_id is required");
        }
        if (timestamp == null) {
            violations.add("timestamp is required");
        }
        if (operation == null) {
            violations.add("operation is required");
        }
        if (requester == null) {
            violations.add("requester is required");
        } else {
            if (isBlank(requester.agentId())) {
                violations.add("requester.agent_id is required");
            }
            if (isBlank(requester.sessionId())) {
                violations.add("requester.session_id is required");
            }
        }
        if (task == null || isBlank(task.goal())) {
            violations.add("task.goal is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("invalid CARP request", violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static Builder builder(String sessionId, String agentId, String goal) {
        return new Builder(sessionId, agentId, goal);
    }

    public static final class Builder {

        private final String sessionId;
        private final String agentId;
        private final String goal;
        private String parentSessionId;
        private Operation operation = Operation.RESOLVE;
        private RiskTier riskTier;
        private final List<String> contextHints = new ArrayList<>();
        private final List<String> requiredCapabilities = new ArrayList<>();
        private final List<String> atlasIds = new ArrayList<>();
        private final Map<String, Object> context = new LinkedHashMap<>();
        private Instant timestamp;

        private Builder(String sessionId, String agentId, String goal) {
            this.sessionId = sessionId;
            this.agentId = agentId;
            this.goal = goal;
        }

        public Builder parentSessionId(String parentSessionId) {
            this.parentSessionId = parentSessionId;
            return this;
        }

        public Builder operation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder riskTier(RiskTier riskTier) {
            this.riskTier = riskTier;
            return this;
        }

        public Builder contextHints(String... hints) {
            this.contextHints.addAll(List.of(hints));
            return this;
        }

        public Builder requiredCapabilities(String... capabilities) {
            this.requiredCapabilities.addAll(List.of(capabilities));
            return this;
        }

        public Builder atlasIds(String... ids) {
            this.atlasIds.addAll(List.of(ids));
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public CarpRequest build() {
            return new CarpRequest(
                CARP_VERSION,
                UUID.randomUUID().toString(),
                timestamp != null ? timestamp : Instant.now().truncatedTo(ChronoUnit.MICROS),
                operation,
                new Requester(agentId, sessionId, parentSessionId),
                new Task(goal, riskTier, contextHints, requiredCapabilities),
                atlasIds,
                context
            );
        }
    }
}
