package com.governorHq.llmGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a pattern rule.
 * <p>
 * Declaration order is the order in which the scorer evaluates categories and
 * therefore the order of violations in a {@link Verdict}.
 */
public enum RuleCategory {

    FORBIDDEN("forbidden", Kind.NEGATIVE),
    MEDICAL_SCOPE("medicalScope", Kind.NEGATIVE),
    PRESCRIPTIVE("prescriptive", Kind.NEGATIVE),
    ALARMING("alarming", Kind.NEGATIVE),
    SUGGESTIVE("suggestive", Kind.POSITIVE),
    CRISIS("crisis", Kind.CRISIS);

    /**
     * How matches of a category affect a verdict.
     */
    public enum Kind {
        /** Lowers confidence and counts as a violation. */
        NEGATIVE,
        /** Raises confidence, never a violation. */
        POSITIVE,
        /** Sets the crisis flag only. */
        CRISIS
    }

    private final String id;
    private final Kind kind;

    RuleCategory(String id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public boolean isNegative() {
        return kind == Kind.NEGATIVE;
    }

    @JsonCreator
    public static RuleCategory fromId(String id) {
        for (RuleCategory category : values()) {
            if (category.id.equalsIgnoreCase(id) || category.name().equalsIgnoreCase(id)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown rule category: " + id);
    }
}
