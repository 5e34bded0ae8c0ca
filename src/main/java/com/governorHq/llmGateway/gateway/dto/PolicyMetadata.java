package com.governorHq.llmGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.governorHq.llmGateway.guard.model.PolicyDomain;
import com.governorHq.llmGateway.guard.model.PolicyMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code _constitution} block attached to responses the safety layer touched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyMetadata {

    @JsonProperty("blocked")
    private Boolean blocked;

    @JsonProperty("mode")
    private PolicyMode mode;

    @JsonProperty("domain")
    private PolicyDomain domain;

    @JsonProperty("violations")
    private Integer violations;

    /**
     * {@code [severity] category: "matched"} per violation, joined by {@code "; "}.
     */
    @JsonProperty("summary")
    private String summary;

    @JsonProperty("outputValidation")
    private OutputValidation outputValidation;

    @JsonProperty("crisisResourcesAppended")
    private Boolean crisisResourcesAppended;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OutputValidation {
        @JsonProperty("safe")
        private boolean safe;

        @JsonProperty("violations")
        private int violations;

        @JsonProperty("confidence")
        private double confidence;

        @JsonProperty("mode")
        private PolicyMode mode;
    }
}
