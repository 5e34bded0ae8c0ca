package com.governorHq.llmGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reporting label of a negative rule category. Has no effect on scoring.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        return Severity.valueOf(label.trim().toUpperCase());
    }
}
