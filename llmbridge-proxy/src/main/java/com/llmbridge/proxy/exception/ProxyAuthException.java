package com.llmbridge.proxy.exception;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;

public class ProxyAuthException extends LlmBridgeException {

    public ProxyAuthException(String message) {
        super(ErrorKind.PROXY_AUTH, message);
    }
}
