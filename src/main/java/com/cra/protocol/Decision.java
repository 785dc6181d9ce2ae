package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Outcome of policy evaluation for one resolution. Exactly one variant per
 * resolution, encoded on the wire as an object tagged by {@code "type"}:
 * <pre>
 * {"type":"allow"}
 * {"type":"deny","reason":"..."}
 * {"type":"requires_approval","approver":"...","timeout_seconds":3600}
 * {"type":"partial","reason":"..."}
 * </pre>
 * Rate-limit denials are plain {@link Deny} values with a rate-limit reason.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Decision.Allow.class, name = Decision.ALLOW),
    @JsonSubTypes.Type(value = Decision.Deny.class, name = Decision.DENY),
    @JsonSubTypes.Type(value = Decision.RequiresApproval.class, name = Decision.REQUIRES_APPROVAL),
    @JsonSubTypes.Type(value = Decision.Partial.class, name = Decision.PARTIAL)
})
public sealed interface Decision {

    String ALLOW = "allow";
    String DENY = "deny";
    String REQUIRES_APPROVAL = "requires_approval";
    String PARTIAL = "partial";

    @JsonProperty("type")
    String type();

    /** Whether the agent may act on this resolution without further sign-off. */
    default boolean permitsAction() {
        return this instanceof Allow || this instanceof Partial;
    }

    static Decision allow() {
        return new Allow();
    }

    static Decision deny(String reason) {
        return new Deny(reason);
    }

    static Decision requiresApproval(String approver, long timeoutSeconds) {
        return new RequiresApproval(approver, timeoutSeconds);
    }

    static Decision partial(String reason) {
        return new Partial(reason);
    }

    @JsonPropertyOrder({"type"})
    record Allow() implements Decision {
        @Override
        @JsonProperty("type")
        public String type() {
            return ALLOW;
        }
    }

    @JsonPropertyOrder({"type", "reason"})
    record Deny(@JsonProperty("reason") String reason) implements Decision {
        @Override
        @JsonProperty("type")
        public String type() {
            return DENY;
        }
    }

    @JsonPropertyOrder({"type", "approver", "timeout_seconds"})
    record RequiresApproval(
        @JsonProperty("approver") String approver,
        @JsonProperty("timeout_seconds") long timeoutSeconds
    ) implements Decision {
        @Override
        @JsonProperty("type")
        public String type() {
            return REQUIRES_APPROVAL;
        }
    }

    @JsonPropertyOrder({"type", "reason"})
    record Partial(@JsonProperty("reason") String reason) implements Decision {
        @Override
        @JsonProperty("type")
        public String type() {
            return PARTIAL;
        }
    }
}
