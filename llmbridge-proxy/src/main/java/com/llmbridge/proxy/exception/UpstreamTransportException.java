package com.llmbridge.proxy.exception;

import com.llmbridge.common.exception.ErrorKind;
import com.llmbridge.common.exception.LlmBridgeException;

/**
 * The relay could not obtain a usable response from the upstream API.
 */
public class UpstreamTransportException extends LlmBridgeException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_TRANSPORT, message, cause);
    }
}
