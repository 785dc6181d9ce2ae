package com.cra.atlas;

import com.cra.protocol.RiskTier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Declarative gate on a context pack. Empty clauses are ignored; every
 * non-empty clause must hold for the pack to be eligible.
 */
@JsonPropertyOrder({"risk_tiers", "capabilities", "file_patterns", "context_hints"})
public record PackCondition(
    @JsonProperty("risk_tiers") List<RiskTier> riskTiers,
    @JsonProperty("capabilities") List<String> capabilities,
    @JsonProperty("file_patterns") List<String> filePatterns,
    @JsonProperty("context_hints") List<String> contextHints
) {

    public PackCondition {
        riskTiers = riskTiers == null ? List.of() : List.copyOf(riskTiers);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        contextHints = contextHints == null ? List.of() : List.copyOf(contextHints);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return riskTiers.isEmpty() && capabilities.isEmpty() && filePatterns.isEmpty() && contextHints.isEmpty();
    }
}
