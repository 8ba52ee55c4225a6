package com.migranet.core.usage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Accumulated translator usage for one "provider/model". Token counts are
 * approximations (4 characters per token).
 */
public record ModelUsage(
        @JsonProperty("model")         String modelId,
        @JsonProperty("requests")      int requests,
        @JsonProperty("input_tokens")  long inputTokens,
        @JsonProperty("output_tokens") long outputTokens,
        @JsonProperty("cost")          double cost
) {

    static ModelUsage empty(String modelId) {
        return new ModelUsage(modelId, 0, 0, 0, 0.0);
    }

    ModelUsage plus(long in, long out, double callCost) {
        return new ModelUsage(modelId, requests + 1, inputTokens + in, outputTokens + out, cost + callCost);
    }
}
