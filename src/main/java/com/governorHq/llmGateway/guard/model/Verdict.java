package com.governorHq.llmGateway.guard.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of scoring one text against the pattern rule set.
 */
@Value
@Builder
public class Verdict {

    private static final Verdict NEUTRAL = Verdict.builder()
            .safe(true)
            .confidence(1.0)
            .crisisSignal(false)
            .build();

    /**
     * True iff no negative rule matched.
     */
    boolean safe;

    /**
     * Negative matches in category order, then rule order.
     */
    @Singular
    List<Violation> violations;

    /**
     * Between 0.0 and 1.0, two decimals.
     */
    double confidence;

    /**
     * Whether self-harm or harm-to-others language was found. Never affects {@link #safe}.
     */
    boolean crisisSignal;

    /**
     * Verdict used when the engine is disabled or there is nothing to score.
     */
    public static Verdict neutral() {
        return NEUTRAL;
    }

    public int violationCount() {
        return violations.size();
    }
}
