package com.governorHq.llmGateway.gateway.exception;

/**
 * Thrown when a request body is structurally unusable (e.g. missing required fields).
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
