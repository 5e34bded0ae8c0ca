package com.governorHq.llmGateway.gateway.exception;

/**
 * Thrown when a client identity exhausted its rate window.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(int limit) {
        super("Rate limit exceeded — max " + limit + " requests/minute");
    }
}
