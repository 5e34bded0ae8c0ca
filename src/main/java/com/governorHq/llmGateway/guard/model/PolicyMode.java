package com.governorHq.llmGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a negative verdict is acted upon.
 */
public enum PolicyMode {
    /** Substitute the domain safe alternative. */
    BLOCK,
    /** Pass through, log, and annotate output with violation metadata. */
    WARN,
    /** Pass through unchanged. */
    LOG;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
