package com.governorHq.llmGateway.guard.model;

/**
 * What the pipeline does with a scored text.
 */
public enum EnforcementAction {
    PASS,
    ANNOTATE,
    SUBSTITUTE
}
