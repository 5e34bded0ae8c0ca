package com.governorHq.llmGateway.guard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.governorHq.llmGateway.gateway.dto.ChatMessage;
import com.governorHq.llmGateway.guard.model.PolicyDomain;
import com.governorHq.llmGateway.guard.prompt.SafetySystemPrompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the domain safety prompt to an outbound message list.
 * <p>
 * Without a system message, a new one carrying the prompt is put first.
 * Otherwise the prompt is prefixed to <em>every</em> system message, so no
 * caller-supplied system message can displace the safety instructions.
 */
@Service
public class PromptInjector {

    static final String PROMPT_SEPARATOR = "\n\n";

    /**
     * Returns a rewritten copy of the messages; the input list is not modified.
     *
     * @param messages outbound messages
     * @param domain   policy domain selecting the prompt
     * @return messages with the safety prompt applied
     */
    public List<ChatMessage> inject(List<ChatMessage> messages, PolicyDomain domain) {
        String safetyPrompt = SafetySystemPrompt.promptFor(domain);
        List<ChatMessage> source = messages != null ? messages : List.of();

        boolean hasSystemMessage = source.stream()
                .anyMatch(message -> message != null && message.hasRole(ChatMessage.ROLE_SYSTEM));

        List<ChatMessage> injected = new ArrayList<>(source.size() + 1);
        if (!hasSystemMessage) {
            injected.add(ChatMessage.of(ChatMessage.ROLE_SYSTEM, safetyPrompt));
            injected.addAll(source);
            return injected;
        }

        for (ChatMessage message : source) {
            if (message != null && message.hasRole(ChatMessage.ROLE_SYSTEM)) {
                String existing = contentAsText(message.getContent());
                injected.add(message.toBuilder()
                        .content(TextNode.valueOf(safetyPrompt + PROMPT_SEPARATOR + existing))
                        .build());
            } else {
                injected.add(message);
            }
        }
        return injected;
    }

    /**
     * String content as-is; structured content as its JSON text.
     */
    static String contentAsText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        return content.isTextual() ? content.asText() : content.toString();
    }
}
