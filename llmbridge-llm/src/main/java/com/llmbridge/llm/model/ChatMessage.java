package com.llmbridge.llm.model;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ChatMessage {

    @NotNull(message = "Context message role is required")
    MessageRole role;
    String content;

    public static ChatMessage of(MessageRole role, String content) {
        return new ChatMessage(role, content);
    }

    public static ChatMessage system(String content) {
        return of(MessageRole.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(MessageRole.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return of(MessageRole.ASSISTANT, content);
    }
}
