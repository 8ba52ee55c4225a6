package com.migranet.core.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Approximate token and cost accounting for fallback translator calls.
 *
 * Prices are per 1000 tokens and apply to whichever model is configured;
 * both default to 0, which keeps the token counts and reports no cost.
 */
@Component
public class UsageTracker {

    private static final Logger log = LoggerFactory.getLogger(UsageTracker.class);

    static final int CHARS_PER_TOKEN = 4;

    private final double inputCostPer1k;
    private final double outputCostPer1k;

    private final Map<String, ModelUsage> byModel = new LinkedHashMap<>();

    public UsageTracker(
            @Value("${migranet.llm.input-cost-per-1k-tokens:0.0}")  double inputCostPer1k,
            @Value("${migranet.llm.output-cost-per-1k-tokens:0.0}") double outputCostPer1k
    ) {
        if (inputCostPer1k < 0 || outputCostPer1k < 0) {
            throw new IllegalArgumentException("LLM token prices must not be negative");
        }
        this.inputCostPer1k  = inputCostPer1k;
        this.outputCostPer1k = outputCostPer1k;
    }

    public synchronized void record(String modelId, String prompt, String completion) {
        long in  = approxTokens(prompt);
        long out = approxTokens(completion);
        double cost = in / 1000.0 * inputCostPer1k + out / 1000.0 * outputCostPer1k;

        byModel.merge(modelId, ModelUsage.empty(modelId).plus(in, out, cost),
                (old, added) -> old.plus(added.inputTokens(), added.outputTokens(), added.cost()));
        log.debug("[Usage] {} +{} in / +{} out tokens", modelId, in, out);
    }

    public synchronized List<ModelUsage> snapshot() {
        return List.copyOf(byModel.values());
    }

    public synchronized void reset() {
        byModel.clear();
    }

    static long approxTokens(String text) {
        int length = text == null ? 0 : text.length();
        return Math.max(1, length / CHARS_PER_TOKEN);
    }
}
