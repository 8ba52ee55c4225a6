package com.migranet.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    @Override
    public String generateWithRole(LlmRole role, String userPrompt, double temperature) {
        // Stub: a trivially deployable batch for every conversion or repair
        return """
                ```sql
                -- mock translation
                SELECT 1 AS mock_result;
                ```
                """;
    }

    @Override
    public String getModelId() {
        return "mock/mock";
    }
}
