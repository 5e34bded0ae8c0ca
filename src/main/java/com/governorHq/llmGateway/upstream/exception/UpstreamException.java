package com.governorHq.llmGateway.upstream.exception;

import lombok.Getter;

/**
 * Thrown when the upstream LLM provider cannot be reached, times out, or returns
 * a body that cannot be parsed. Terminal for the request: the gateway never retries.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final boolean timeout;

    public UpstreamException(String message) {
        super(message);
        this.timeout = false;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
    }

    private UpstreamException(String message, boolean timeout) {
        super(message);
        this.timeout = timeout;
    }

    public static UpstreamException timedOut(long timeoutMs) {
        return new UpstreamException("Upstream request timed out after " + timeoutMs + "ms", true);
    }
}
