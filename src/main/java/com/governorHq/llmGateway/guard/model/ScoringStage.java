package com.governorHq.llmGateway.guard.model;

/**
 * Point in the pipeline where text was scored.
 */
public enum ScoringStage {
    INPUT,
    OUTPUT;

    public String getId() {
        return name().toLowerCase();
    }
}
