package com.governorHq.llmGateway.guard.service;

import com.fasterxml.jackson.databind.node.TextNode;
import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import com.governorHq.llmGateway.gateway.dto.ChatMessage;
import com.governorHq.llmGateway.gateway.dto.PolicyMetadata;
import com.governorHq.llmGateway.guard.model.PolicyDomain;
import com.governorHq.llmGateway.guard.model.Verdict;
import com.governorHq.llmGateway.guard.model.Violation;
import com.governorHq.llmGateway.guard.prompt.SafetySystemPrompt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the payloads the safety layer returns instead of, or on top of, upstream replies.
 * Total over its inputs: every verdict yields a response.
 */
@Service
@RequiredArgsConstructor
public class ResponseSynthesizer {

    public static final String SAFETY_MODEL = "governor-safety-layer";

    private static final String ID_PREFIX = "chatcmpl-gov-";

    private final Clock clock;

    /**
     * Substitute response carrying the domain safe alternative.
     *
     * @param verdict the unsafe verdict that caused the block
     * @param policy  active policy (mode and domain are reported)
     * @return chat-completion payload with {@code _constitution.blocked = true}
     */
    public ChatCompletionResponse blocked(Verdict verdict, PolicyProperties policy) {
        PolicyDomain domain = policy.resolvedDomain();
        long nowMillis = clock.millis();

        return ChatCompletionResponse.builder()
                .id(ID_PREFIX + nowMillis)
                .object("chat.completion")
                .created(nowMillis / 1000)
                .model(SAFETY_MODEL)
                .choices(List.of(ChatCompletionResponse.Choice.builder()
                        .index(0)
                        .message(ChatMessage.of(ChatMessage.ROLE_ASSISTANT, SafetySystemPrompt.safeAlternativeFor(domain)))
                        .finishReason("stop")
                        .build()))
                .usage(ChatCompletionResponse.Usage.builder()
                        .promptTokens(0)
                        .completionTokens(0)
                        .totalTokens(0)
                        .build())
                .constitution(PolicyMetadata.builder()
                        .blocked(true)
                        .mode(policy.mode())
                        .domain(domain)
                        .violations(verdict.violationCount())
                        .summary(summarize(verdict.getViolations()))
                        .build())
                .build();
    }

    /**
     * Attaches output-validation metadata without touching the visible content.
     */
    public ChatCompletionResponse annotated(ChatCompletionResponse response, Verdict verdict, PolicyProperties policy) {
        PolicyMetadata metadata = metadataOf(response).toBuilder()
                .outputValidation(PolicyMetadata.OutputValidation.builder()
                        .safe(verdict.isSafe())
                        .violations(verdict.violationCount())
                        .confidence(verdict.getConfidence())
                        .mode(policy.mode())
                        .build())
                .build();
        return response.toBuilder().constitution(metadata).build();
    }

    /**
     * Appends the crisis resource block to the first choice's content.
     * Responses without string content are returned unchanged.
     */
    public ChatCompletionResponse withCrisisResources(ChatCompletionResponse response) {
        if (response == null || !response.hasContent()) {
            return response;
        }
        ChatMessage message = response.firstMessage();
        ChatMessage augmented = message.toBuilder()
                .content(TextNode.valueOf(message.getTextContent()
                        + SafetySystemPrompt.CRISIS_SEPARATOR
                        + SafetySystemPrompt.crisisResources))
                .build();

        List<ChatCompletionResponse.Choice> choices = new ArrayList<>(response.getChoices());
        choices.set(0, choices.get(0).toBuilder().message(augmented).build());

        return response.toBuilder()
                .choices(choices)
                .constitution(metadataOf(response).toBuilder().crisisResourcesAppended(true).build())
                .build();
    }

    static String summarize(List<Violation> violations) {
        return violations.stream()
                .map(Violation::describe)
                .collect(Collectors.joining("; "));
    }

    private static PolicyMetadata metadataOf(ChatCompletionResponse response) {
        return response.getConstitution() != null ? response.getConstitution() : new PolicyMetadata();
    }
}
