package com.governorHq.llmGateway.guard.service;

import com.governorHq.llmGateway.guard.model.PolicyStatsSnapshot;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters of the safety layer.
 * Incremented from concurrent pipelines; totals read from a snapshot may be
 * momentarily inconsistent with each other.
 */
@Component
public class PolicyCounters {

    private final AtomicLong totalValidated = new AtomicLong();
    private final AtomicLong inputBlocked = new AtomicLong();
    private final AtomicLong outputBlocked = new AtomicLong();
    private final AtomicLong inputWarnings = new AtomicLong();
    private final AtomicLong outputWarnings = new AtomicLong();
    private final AtomicLong crisisDetected = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong systemPromptsInjected = new AtomicLong();

    void validated() {
        totalValidated.incrementAndGet();
    }

    void inputBlocked() {
        inputBlocked.incrementAndGet();
    }

    void outputBlocked() {
        outputBlocked.incrementAndGet();
    }

    void inputWarning() {
        inputWarnings.incrementAndGet();
    }

    void outputWarning() {
        outputWarnings.incrementAndGet();
    }

    void crisisDetected() {
        crisisDetected.incrementAndGet();
    }

    void rateLimited() {
        rateLimited.incrementAndGet();
    }

    void systemPromptInjected() {
        systemPromptsInjected.incrementAndGet();
    }

    public PolicyStatsSnapshot snapshot() {
        return PolicyStatsSnapshot.builder()
                .totalValidated(totalValidated.get())
                .inputBlocked(inputBlocked.get())
                .outputBlocked(outputBlocked.get())
                .inputWarnings(inputWarnings.get())
                .outputWarnings(outputWarnings.get())
                .crisisDetected(crisisDetected.get())
                .rateLimited(rateLimited.get())
                .systemPromptsInjected(systemPromptsInjected.get())
                .build();
    }
}
