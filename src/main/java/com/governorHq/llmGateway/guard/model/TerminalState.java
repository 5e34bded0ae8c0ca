package com.governorHq.llmGateway.guard.model;

/**
 * Where a request ended inside the enforcement pipeline.
 */
public enum TerminalState {
    REJECTED_BY_RATE_LIMIT,
    BLOCKED_ON_INPUT,
    BLOCKED_ON_OUTPUT,
    PASSED_CLEAN,
    PASSED_ANNOTATED,
    PASSED_CRISIS_AUGMENTED,
    STREAMED
}
