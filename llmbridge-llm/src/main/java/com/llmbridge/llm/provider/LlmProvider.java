package com.llmbridge.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported providers. All of them speak the OpenAI chat-completions dialect.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    OPENAI(
        "OpenAI",
        "openai",
        "https://api.openai.com/v1",
        "gpt-5"
    ),

    GROQ(
        "Groq",
        "groq",
        "https://api.groq.com/openai/v1",
        "llama-3.3-70b-versatile"
    ),

    CEREBRAS(
        "Cerebras",
        "cerebras",
        "https://api.cerebras.ai/v1",
        "llama3.1-70b"
    ),

    SAMBANOVA(
        "SambaNova",
        "sambanova",
        "https://api.sambanova.ai/v1",
        "Meta-Llama-3.1-70B-Instruct"
    );

    private final String displayName;
    /** Path segment used by the relay: {@code /proxy/<slug>/...}. */
    private final String slug;
    private final String baseUrl;
    private final String defaultModel;

    public String getLogTag() {
        return "[" + name() + "]";
    }

    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name) ||
                provider.getSlug().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
