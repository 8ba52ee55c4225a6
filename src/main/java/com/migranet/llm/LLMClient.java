package com.migranet.llm;

/**
 * LLMClient: single interface for all LLM interactions in MigraNet.
 *
 * Implementations supply generateWithRole(LlmRole, String, double) and the
 * model id usage is recorded under.
 *
 * getTemperatureForRole(LlmRole) is a default method so the canonical
 * temperatures live here, not scattered across callers.
 */
public interface LLMClient {

    /**
     * @param role        caller role; drives system prompt selection in the implementation
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature (0.0 = deterministic)
     * @return raw response text; never null, empty string on empty model output
     */
    String generateWithRole(LlmRole role, String userPrompt, double temperature);

    /** "provider/model", the key usage and pricing are tracked under. */
    String getModelId();

    /**
     * CONVERTER 0.1  translation must be reproducible
     * REPAIRER  0.2  small variation helps escape a repeated failure
     */
    default double getTemperatureForRole(LlmRole role) {
        return switch (role) {
            case CONVERTER -> 0.1;
            case REPAIRER  -> 0.2;
        };
    }
}
