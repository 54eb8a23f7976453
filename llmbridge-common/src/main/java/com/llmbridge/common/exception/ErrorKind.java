package com.llmbridge.common.exception;

/**
 * Classification of failures raised while talking to an LLM provider or relay.
 */
public enum ErrorKind {

    /** Transient fault (5xx, 429, 408, network fault or unclassified). Eligible for backoff. */
    RETRIABLE,

    /** Client-side fault (4xx other than 408/429). Retrying with the same input will not help. */
    NON_RETRIABLE,

    /** Missing or malformed Authorization header at the relay boundary. */
    PROXY_AUTH,

    /** The upstream API could not be reached at all. */
    UPSTREAM_TRANSPORT;

    public boolean isRetriable() {
        return this == RETRIABLE || this == UPSTREAM_TRANSPORT;
    }
}
