package com.migranet.llm;

/**
 * Role → system prompt. Shared by every LLMClient implementation.
 */
final class SystemPrompts {

    private SystemPrompts() {}

    static String forRole(LlmRole role) {
        return switch (role) {
            case CONVERTER -> """
                    You are an expert database migration engineer.
                    Convert Oracle PL/SQL or Oracle DDL to Microsoft SQL Server T-SQL.
                    Output ONLY the T-SQL inside one ```sql code block. No explanations.
                    Preserve object names, column order, constraints and identity semantics.
                    """;

            case REPAIRER -> """
                    You are an expert SQL Server engineer repairing a failed deployment.
                    You receive the original Oracle source, the failing T-SQL and the error.
                    Output ONLY the corrected, complete T-SQL inside one ```sql code block.
                    Change only what the error requires.
                    """;
        };
    }
}
