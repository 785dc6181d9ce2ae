package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

@JsonPropertyOrder({"action_id", "name", "description", "parameters_schema", "risk_tier"})
public record AllowedAction(
    @JsonProperty("action_id") String actionId,
    @JsonProperty("name") String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("description") String description,
    @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("parameters_schema") JsonNode parametersSchema,
    @JsonProperty("risk_tier") RiskTier riskTier
) {

    public AllowedAction {
        parametersSchema = parametersSchema == null || parametersSchema.isNull() ? null : parametersSchema;
    }
}
