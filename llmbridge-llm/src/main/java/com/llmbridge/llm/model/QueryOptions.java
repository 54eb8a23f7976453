package com.llmbridge.llm.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call options. Unset fields fall back to the adapter's defaults.
 */
@Value
@Builder
@Jacksonized
public class QueryOptions {

    String systemPrompt;

    /** Prior turns, sent in order between the system prompt and the user prompt. */
    @Singular("contextMessage")
    List<ChatMessage> context;

    String model;
    Double temperature;
    Integer maxTokens;

    public static QueryOptions empty() {
        return QueryOptions.builder().build();
    }

    /**
     * Rejects context turns that cannot be sent. Thrown before any request is made.
     *
     * @throws IllegalArgumentException if a context turn is null or has no role
     */
    public void validate() {
        for (int i = 0; i < context.size(); i++) {
            ChatMessage message = context.get(i);
            if (message == null || message.getRole() == null) {
                throw new IllegalArgumentException("Context message " + i + " has no role");
            }
        }
    }

    /**
     * System prompt first, then every context turn in order, then the user prompt.
     */
    public List<ChatMessage> buildMessages(String prompt) {
        validate();
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        messages.addAll(context);
        messages.add(ChatMessage.user(prompt));
        return messages;
    }
}
