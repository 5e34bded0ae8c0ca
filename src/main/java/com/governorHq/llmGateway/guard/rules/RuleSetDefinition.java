package com.governorHq.llmGateway.guard.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.governorHq.llmGateway.guard.model.RuleCategory;
import com.governorHq.llmGateway.guard.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON shape of the pattern rule table ({@code policy/pattern-rules.json}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleSetDefinition {

    @JsonProperty("version")
    private String version;

    @JsonProperty("categories")
    private List<CategoryDefinition> categories;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CategoryDefinition {
        @JsonProperty("category")
        private RuleCategory category;

        /**
         * Confidence deducted per matching rule. Negative categories only.
         */
        @JsonProperty("weight")
        private Double weight;

        @JsonProperty("severity")
        private Severity severity;

        @JsonProperty("rules")
        private List<RuleDefinition> rules;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class RuleDefinition {
        @JsonProperty("id")
        private String id;

        @JsonProperty("description")
        private String description;

        @JsonProperty("patterns")
        private List<String> patterns;
    }
}
