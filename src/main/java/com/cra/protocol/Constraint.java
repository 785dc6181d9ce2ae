package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"constraint_id", "description"})
public record Constraint(
    @JsonProperty("constraint_id") String constraintId,
    @JsonProperty("description") String description
) {}
