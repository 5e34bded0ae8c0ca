package com.governorHq.llmGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Safety-policy vertical. Selects the injected system prompt and the
 * substitute response text.
 */
public enum PolicyDomain {
    GENERAL,
    WEARABLES,
    BCI,
    THERAPY;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }

    /**
     * Resolves a configured domain identifier, falling back to {@link #GENERAL}
     * for blank or unrecognized values.
     */
    public static PolicyDomain fromId(String id) {
        if (id == null || id.isBlank()) {
            return GENERAL;
        }
        for (PolicyDomain domain : values()) {
            if (domain.name().equalsIgnoreCase(id.trim())) {
                return domain;
            }
        }
        return GENERAL;
    }
}
