package com.governorHq.llmGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI-style error body: {@code {"error": {"message", "type", "code"}}}.
 */
public record ApiError(@JsonProperty("error") Detail error) {

    public static final String INVALID_REQUEST = "invalid_request_error";
    public static final String AUTHENTICATION = "authentication_error";
    public static final String RATE_LIMIT = "rate_limit_error";
    public static final String API_ERROR = "api_error";
    public static final String NOT_FOUND = "not_found";
    public static final String SERVER_ERROR = "server_error";

    public static ApiError of(int status, String type, String message) {
        return new ApiError(new Detail(message, type, status));
    }

    public record Detail(@JsonProperty("message") String message,
                         @JsonProperty("type") String type,
                         @JsonProperty("code") int code) {
    }
}
