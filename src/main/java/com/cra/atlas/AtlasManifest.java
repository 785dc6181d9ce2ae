package com.cra.atlas;

import com.cra.protocol.RiskTier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Parsed atlas package: the actions, capabilities, policies and context packs
 * one domain contributes. Manifests arrive already parsed; reading them from
 * disk belongs to the caller.
 */
@JsonPropertyOrder({"atlas_version", "atlas_id", "version", "name", "description", "domains",
    "actions", "capabilities", "policies", "context_packs"})
public record AtlasManifest(
    @JsonProperty("atlas_version") String atlasVersion,
    @JsonProperty("atlas_id") String atlasId,
    @JsonProperty("version") String version,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("domains") List<String> domains,
    @JsonProperty("actions") List<ActionDefinition> actions,
    @JsonProperty("capabilities") List<CapabilityDefinition> capabilities,
    @JsonProperty("policies") List<PolicyDefinition> policies,
    @JsonProperty("context_packs") List<ContextPackDefinition> contextPacks
) {

    public static final String ATLAS_VERSION = "1.0";

    public AtlasManifest {
        domains = domains == null ? List.of() : List.copyOf(domains);
        actions = actions == null ? List.of() : List.copyOf(actions);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        policies = policies == null ? List.of() : List.copyOf(policies);
        contextPacks = contextPacks == null ? List.of() : List.copyOf(contextPacks);
    }

    @JsonPropertyOrder({"action_id", "name", "description", "parameters_schema", "risk_tier"})
    public record ActionDefinition(
        @JsonProperty("action_id") String actionId,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("parameters_schema") JsonNode parametersSchema,
        @JsonProperty("risk_tier") RiskTier riskTier
    ) {
        public ActionDefinition {
            riskTier = riskTier == null ? RiskTier.LOW : riskTier;
        }
    }

    /** A named group of actions an agent can ask for in one word. */
    @JsonPropertyOrder({"capability_id", "name", "actions"})
    public record CapabilityDefinition(
        @JsonProperty("capability_id") String capabilityId,
        @JsonProperty("name") String name,
        @JsonProperty("actions") List<String> actions
    ) {
        public CapabilityDefinition {
            actions = actions == null ? List.of() : List.copyOf(actions);
        }
    }

    @JsonPropertyOrder({"policy_id", "type", "actions", "reason", "parameters"})
    public record PolicyDefinition(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("type") PolicyType type,
        @JsonProperty("actions") List<String> actions,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("reason") String reason,
        @JsonProperty("parameters") PolicyParameters parameters
    ) {
        public PolicyDefinition {
            actions = actions == null ? List.of() : List.copyOf(actions);
            parameters = parameters == null ? PolicyParameters.none() : parameters;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"max_calls", "window_seconds", "approver", "timeout_seconds"})
    public record PolicyParameters(
        @JsonProperty("max_calls") Integer maxCalls,
        @JsonProperty("window_seconds") Long windowSeconds,
        @JsonProperty("approver") String approver,
        @JsonProperty("timeout_seconds") Long timeoutSeconds
    ) {
        public static PolicyParameters none() {
            return new PolicyParameters(null, null, null, null);
        }
    }

    @JsonPropertyOrder({"pack_id", "name", "content", "content_type", "priority", "keywords", "condition"})
    public record ContextPackDefinition(
        @JsonProperty("pack_id") String packId,
        @JsonProperty("name") String name,
        @JsonProperty("content") String content,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("priority") int priority,
        @JsonProperty("keywords") List<String> keywords,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("condition") PackCondition condition
    ) {
        public ContextPackDefinition {
            contentType = contentType == null ? "text/markdown" : contentType;
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }
}
