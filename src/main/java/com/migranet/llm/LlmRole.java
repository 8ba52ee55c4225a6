package com.migranet.llm;

/**
 * Who is asking the model. Drives system prompt and temperature.
 */
public enum LlmRole {
    CONVERTER,
    REPAIRER
}
