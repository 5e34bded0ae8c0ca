package com.governorHq.llmGateway.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Service for resolving correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    private static final Pattern ACCEPTED_REQUEST_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    /**
     * Reuses a caller-supplied request ID when it is well-formed, otherwise generates one.
     *
     * @param requestIdHeader value of the {@code X-Request-ID} header, may be null
     * @return correlation ID for the request
     */
    public String resolveCorrelationId(String requestIdHeader) {
        if (requestIdHeader != null && ACCEPTED_REQUEST_ID.matcher(requestIdHeader.trim()).matches()) {
            return requestIdHeader.trim();
        }
        return UUID.randomUUID().toString();
    }
}
