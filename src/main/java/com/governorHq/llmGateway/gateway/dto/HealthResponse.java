package com.governorHq.llmGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("uptime_ms")
    private long uptimeMs;

    @JsonProperty("uptime_human")
    private String uptimeHuman;

    /**
     * ISO-8601 instant of the health check.
     */
    @JsonProperty("timestamp")
    private String timestamp;
}
