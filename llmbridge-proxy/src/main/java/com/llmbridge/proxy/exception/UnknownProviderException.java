package com.llmbridge.proxy.exception;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;

public class UnknownProviderException extends LlmBridgeException {

    public UnknownProviderException(String slug) {
        super(ErrorKind.NON_RETRIABLE, "No upstream configured for provider '" + slug + "'");
    }
}
