package com.governorHq.llmGateway.gateway.controller;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.governorHq.llmGateway.gateway.dto.ApiError;
import com.governorHq.llmGateway.gateway.exception.InvalidRequestException;
import com.governorHq.llmGateway.gateway.exception.RateLimitExceededException;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the Gateway. Every error leaves in the OpenAI error shape.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_JSON = "Invalid JSON body";
    static final String MESSAGES_REQUIRED = "\"messages\" array is required";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String message = isMessagesShapeError(ex) ? MESSAGES_REQUIRED : INVALID_JSON;
        log.warn("Unreadable request body: {}", message);
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, message);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported content type: {}", ex.getContentType());
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, INVALID_JSON);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiError> handleRateLimitExceeded(RateLimitExceededException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, ApiError.RATE_LIMIT, ex.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamException ex) {
        HttpStatus status = ex.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        log.error("Upstream failure - status: {}, error: {}", status.value(), ex.getMessage());
        return error(status, ApiError.API_ERROR, ex.getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ApiError> handleRouteNotFound(Exception ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ApiError.NOT_FOUND,
                "Route not found: " + request.getMethod() + " " + request.getRequestURI());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.SERVER_ERROR, "Internal server error");
    }

    private static boolean isMessagesShapeError(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof MismatchedInputException mismatch) {
            return mismatch.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .anyMatch("messages"::equals);
        }
        return false;
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String type, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiError.of(status.value(), type, message));
    }
}
