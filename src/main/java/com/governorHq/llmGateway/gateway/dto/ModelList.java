package com.governorHq.llmGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible {@code /v1/models} listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelList {

    @JsonProperty("object")
    @Builder.Default
    private String object = "list";

    @JsonProperty("data")
    private List<Model> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Model {
        @JsonProperty("id")
        private String id;

        @JsonProperty("object")
        @Builder.Default
        private String object = "model";

        @JsonProperty("created")
        private long created;

        @JsonProperty("owned_by")
        private String ownedBy;
    }
}
