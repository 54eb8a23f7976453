package com.llmbridge.llm.provider;

import io.netty.channel.ConnectTimeoutException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import reactor.netty.http.client.PrematureCloseException;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Network-level failures that are worth retrying.
 */
@Getter
@RequiredArgsConstructor
public enum NetworkErrorCode {

    CONNECTION_RESET("ECONNRESET"),
    DNS_FAILURE("ENOTFOUND"),
    CONNECTION_REFUSED("ECONNREFUSED"),
    TIMEOUT("ETIMEDOUT");

    private final String code;

    /**
     * Walks the cause chain and returns the first recognized network fault, or null.
     */
    public static NetworkErrorCode fromThrowable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            NetworkErrorCode code = match(current);
            if (code != null) {
                return code;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    public static NetworkErrorCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NetworkErrorCode value : values()) {
            if (value.getCode().equalsIgnoreCase(code)) {
                return value;
            }
        }
        return null;
    }

    private static NetworkErrorCode match(Throwable error) {
        // ConnectTimeoutException extends ConnectException, so timeouts are checked first
        if (error instanceof SocketTimeoutException ||
            error instanceof ConnectTimeoutException ||
            error instanceof TimeoutException ||
            error instanceof io.netty.handler.timeout.TimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof UnknownHostException) {
            return DNS_FAILURE;
        }
        if (error instanceof ConnectException) {
            return CONNECTION_REFUSED;
        }
        if (error instanceof PrematureCloseException) {
            return CONNECTION_RESET;
        }
        String message = error.getMessage();
        if ((error instanceof SocketException || error instanceof java.io.IOException) &&
            message != null && message.toLowerCase().contains("connection reset")) {
            return CONNECTION_RESET;
        }
        return null;
    }
}
