package com.governorHq.llmGateway.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Request context passed through the enforcement pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    public static final String ATTRIBUTE = "com.governorHq.llmGateway.gateway.model.RequestContext";

    /**
     * Client identity used as the rate-limit key: first {@code X-Forwarded-For}
     * entry, else the remote address, else {@code unknown}.
     */
    private String clientIdentity;

    /**
     * Correlation ID for request tracking; present on every log line of the request.
     */
    private String correlationId;

    /**
     * How long the upstream exchange may take before the request fails.
     */
    private Duration upstreamTimeout;

    /**
     * When admission ran; request durations are measured from here.
     */
    private Instant receivedAt;
}
