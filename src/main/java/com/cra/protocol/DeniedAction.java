package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"action_id", "policy_id", "reason"})
public record DeniedAction(
    @JsonProperty("action_id") String actionId,
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("reason") String reason
) {}
