package com.llmbridge.common.exception;

import lombok.Getter;

/**
 * Base type for every failure this project raises on purpose.
 * The {@link ErrorKind} tells callers whether trying again is worthwhile.
 */
@Getter
public class LlmBridgeException extends RuntimeException {

    private final ErrorKind kind;

    public LlmBridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LlmBridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetriable() {
        return kind.isRetriable();
    }

    /**
     * Resolves the kind of an arbitrary throwable. Anything that was not classified
     * by this project counts as retriable.
     */
    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof LlmBridgeException) {
            return ((LlmBridgeException) error).getKind();
        }
        return ErrorKind.RETRIABLE;
    }
}
