package com.governorHq.llmGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message of a chat-completion request or response.
 * Content may be a plain string or structured (e.g. multimodal parts);
 * fields this gateway does not model are kept and forwarded as-is.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    @JsonProperty("role")
    private String role;

    @JsonProperty("content")
    private JsonNode content;

    @Builder.Default
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    public static ChatMessage of(String role, String content) {
        return ChatMessage.builder()
                .role(role)
                .content(TextNode.valueOf(content))
                .build();
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        additionalProperties.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonIgnore
    public boolean hasRole(String expected) {
        return expected.equals(role);
    }

    /**
     * Whether the content is a plain string.
     */
    @JsonIgnore
    public boolean hasTextContent() {
        return content != null && content.isTextual();
    }

    /**
     * String content, or null when absent or structured.
     */
    @JsonIgnore
    public String getTextContent() {
        return hasTextContent() ? content.asText() : null;
    }
}
