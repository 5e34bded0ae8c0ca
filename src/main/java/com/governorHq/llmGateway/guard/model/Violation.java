package com.governorHq.llmGateway.guard.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single negative rule match.
 */
@Value
@Builder
public class Violation {

    RuleCategory category;

    Severity severity;

    /**
     * Identifier of the rule that matched.
     */
    String ruleId;

    /**
     * Source of the matching pattern, truncated for reporting.
     */
    String pattern;

    /**
     * The substring of the scored text that matched.
     */
    String matched;

    /**
     * Renders the violation as {@code [severity] category: "matched"}.
     */
    public String describe() {
        return "[" + severity.getLabel() + "] " + category.getId() + ": \"" + matched + "\"";
    }
}
