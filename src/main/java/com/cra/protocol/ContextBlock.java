package com.cra.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A ranked piece of content injected into the agent as part of a resolution.
 */
@JsonPropertyOrder({"block_id", "source", "content_type", "priority", "score", "content"})
public record ContextBlock(
    @JsonProperty("block_id") String blockId,
    @JsonProperty("source") String source,
    @JsonProperty("content_type") String contentType,
    @JsonProperty("priority") int priority,
    @JsonProperty("score") int score,
    @JsonProperty("content") String content
) {}
