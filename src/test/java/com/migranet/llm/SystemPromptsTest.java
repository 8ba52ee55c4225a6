package com.migranet.llm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SystemPromptsTest {

    @Test
    void onlyPipelineRolesExist() {
        assertEquals(List.of(LlmRole.CONVERTER, LlmRole.REPAIRER), List.of(LlmRole.values()));
    }

    @Test
    void everyRoleHasPromptAndTemperature() {
        LLMClient client = new MockLLMClient();
        for (LlmRole role : LlmRole.values()) {
            assertTrue(SystemPrompts.forRole(role).contains("```sql"), role.name());
            double temperature = client.getTemperatureForRole(role);
            assertTrue(temperature >= 0.0 && temperature <= 0.2, role.name());
        }
        assertEquals("mock/mock", client.getModelId());
    }
}
