package com.governorHq.llmGateway.guard.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of the safety layer counters.
 */
@Value
@Builder
public class PolicyStatsSnapshot {
    long totalValidated;
    long inputBlocked;
    long outputBlocked;
    long inputWarnings;
    long outputWarnings;
    long crisisDetected;
    long rateLimited;
    long systemPromptsInjected;
}
