package com.governorHq.llmGateway.guard.service;

import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import com.governorHq.llmGateway.gateway.dto.ChatMessage;
import com.governorHq.llmGateway.gateway.exception.RateLimitExceededException;
import com.governorHq.llmGateway.gateway.model.RequestContext;
import com.governorHq.llmGateway.gateway.service.RateLimiter;
import com.governorHq.llmGateway.guard.model.EnforcementAction;
import com.governorHq.llmGateway.guard.model.PipelineOutcome;
import com.governorHq.llmGateway.guard.model.PolicyMode;
import com.governorHq.llmGateway.guard.model.ScoringStage;
import com.governorHq.llmGateway.guard.model.TerminalState;
import com.governorHq.llmGateway.guard.model.Verdict;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import com.governorHq.llmGateway.upstream.model.UpstreamReply;
import com.governorHq.llmGateway.upstream.service.LlmUpstream;
import com.governorHq.llmGateway.upstream.util.UpstreamFutures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Enforcement pipeline - runs every chat-completion request through the safety layers.
 *
 * Admission (per-identity rate limit) runs first through {@link #admit}, before the
 * request body is read. {@link #process} then applies, in order:
 * - Safety prompt injection
 * - Input scoring of user-authored text
 * - Upstream exchange
 * - Output scoring of non-streamed assistant text
 * - Crisis resource augmentation
 *
 * Policy violations are outcomes, never exceptions. The only exceptions leaving
 * this class are {@link RateLimitExceededException} and {@link UpstreamException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnforcementPipeline {

    private static final String USER_TEXT_SEPARATOR = " ";

    private final PolicyProperties policy;
    private final RateLimiter rateLimiter;
    private final PromptInjector promptInjector;
    private final TextScorer textScorer;
    private final ResponseSynthesizer responseSynthesizer;
    private final PolicyCounters counters;
    private final LlmUpstream upstream;
    private final List<PolicyEventListener> listeners;

    /**
     * Maps a verdict to the action the active mode demands.
     * Shared by the input and the output scoring point.
     *
     * @param verdict scoring result
     * @param mode    enforcement mode
     * @return PASS for safe verdicts, otherwise SUBSTITUTE (block), ANNOTATE (warn) or PASS (log)
     */
    public static EnforcementAction decide(Verdict verdict, PolicyMode mode) {
        if (verdict.isSafe()) {
            return EnforcementAction.PASS;
        }
        return switch (mode) {
            case BLOCK -> EnforcementAction.SUBSTITUTE;
            case WARN -> EnforcementAction.ANNOTATE;
            case LOG -> EnforcementAction.PASS;
        };
    }

    /**
     * Processes one admitted chat-completion request.
     *
     * @param request Chat-completion request as received from the caller
     * @param context Request context (identity, correlation id, upstream timeout)
     * @return outcome carrying the response or the live chunk relay
     * @throws UpstreamException if the upstream fails or times out
     */
    public PipelineOutcome process(ChatCompletionRequest request, RequestContext context) {
        String correlationId = context.getCorrelationId();

        ChatCompletionRequest outbound = injectSafetyPrompt(request, correlationId);

        boolean pendingCrisis = false;
        if (policy.enabled() && policy.validateInput()) {
            Verdict inputVerdict = textScorer.score(userText(outbound.getMessages()), policy);
            counters.validated();

            if (inputVerdict.isCrisisSignal()) {
                counters.crisisDetected();
                pendingCrisis = true;
                notifyListeners(listener -> listener.onCrisisSignal(ScoringStage.INPUT, policy, correlationId));
            }

            if (!inputVerdict.isSafe()) {
                EnforcementAction action = decide(inputVerdict, policy.mode());
                notifyListeners(listener ->
                        listener.onViolations(ScoringStage.INPUT, inputVerdict, action, policy, correlationId));

                if (action == EnforcementAction.SUBSTITUTE) {
                    counters.inputBlocked();
                    ChatCompletionResponse substitute = responseSynthesizer.blocked(inputVerdict, policy);
                    if (pendingCrisis) {
                        substitute = responseSynthesizer.withCrisisResources(substitute);
                    }
                    return finish(PipelineOutcome.builder()
                            .terminalState(TerminalState.BLOCKED_ON_INPUT)
                            .statusCode(200)
                            .response(substitute)
                            .build(), correlationId);
                }
                counters.inputWarning();
            }
        }

        UpstreamReply reply = exchange(outbound, context);

        if (reply.isStreamed()) {
            return finish(PipelineOutcome.builder()
                    .terminalState(TerminalState.STREAMED)
                    .statusCode(reply.getStatusCode())
                    .chunks(reply.getChunks())
                    .build(), correlationId);
        }

        return finish(enforceOnOutput(reply, pendingCrisis, correlationId), correlationId);
    }

    /**
     * Admission check shared by every rate-limited route.
     *
     * @param context Request context carrying the client identity
     * @throws RateLimitExceededException if the identity exhausted its window
     */
    public void admit(RequestContext context) {
        if (!rateLimiter.admit(context.getClientIdentity())) {
            counters.rateLimited();
            notifyListeners(listener ->
                    listener.onRateLimited(context.getClientIdentity(), policy, context.getCorrelationId()));
            throw new RateLimitExceededException(policy.rateLimit());
        }
    }

    private ChatCompletionRequest injectSafetyPrompt(ChatCompletionRequest request, String correlationId) {
        if (!policy.enabled() || !policy.systemPrompt()) {
            return request;
        }
        List<ChatMessage> injected = promptInjector.inject(request.getMessages(), policy.resolvedDomain());
        counters.systemPromptInjected();
        log.debug("Safety prompt applied - correlationId: {}, domain: {}, messages: {}",
                correlationId, policy.resolvedDomain().getId(), injected.size());
        return request.toBuilder().messages(injected).build();
    }

    private PipelineOutcome enforceOnOutput(UpstreamReply reply, boolean pendingCrisis, String correlationId) {
        ChatCompletionResponse response = reply.getResponse();
        TerminalState state = TerminalState.PASSED_CLEAN;
        int statusCode = reply.getStatusCode();

        if (!response.hasContent()) {
            return PipelineOutcome.builder()
                    .terminalState(state)
                    .statusCode(statusCode)
                    .response(response)
                    .build();
        }

        boolean crisis = pendingCrisis;
        if (policy.enabled() && policy.validateOutput()) {
            Verdict outputVerdict = textScorer.score(response.getContent(), policy);
            counters.validated();

            if (outputVerdict.isCrisisSignal()) {
                counters.crisisDetected();
                crisis = true;
                notifyListeners(listener -> listener.onCrisisSignal(ScoringStage.OUTPUT, policy, correlationId));
            }

            if (!outputVerdict.isSafe()) {
                EnforcementAction action = decide(outputVerdict, policy.mode());
                notifyListeners(listener ->
                        listener.onViolations(ScoringStage.OUTPUT, outputVerdict, action, policy, correlationId));

                switch (action) {
                    case SUBSTITUTE -> {
                        counters.outputBlocked();
                        response = responseSynthesizer.blocked(outputVerdict, policy);
                        state = TerminalState.BLOCKED_ON_OUTPUT;
                        statusCode = 200;
                    }
                    case ANNOTATE -> {
                        counters.outputWarning();
                        response = responseSynthesizer.annotated(response, outputVerdict, policy);
                        state = TerminalState.PASSED_ANNOTATED;
                    }
                    case PASS -> counters.outputWarning();
                }
            }
        }

        if (crisis) {
            response = responseSynthesizer.withCrisisResources(response);
            if (state != TerminalState.BLOCKED_ON_OUTPUT) {
                state = TerminalState.PASSED_CRISIS_AUGMENTED;
            }
        }

        return PipelineOutcome.builder()
                .terminalState(state)
                .statusCode(statusCode)
                .response(response)
                .build();
    }

    private UpstreamReply exchange(ChatCompletionRequest outbound, RequestContext context) {
        log.info("chat/completions forwarded - correlationId: {}, model: {}, stream: {}, messages: {}",
                context.getCorrelationId(), outbound.getModel(), outbound.isStreaming(),
                outbound.getMessages() != null ? outbound.getMessages().size() : 0);
        return UpstreamFutures.await(upstream.chatCompletion(outbound), context.getUpstreamTimeout(),
                context.getCorrelationId());
    }

    /**
     * User-role contents joined with single spaces; structured content as its JSON text.
     */
    static String userText(List<ChatMessage> messages) {
        if (messages == null) {
            return "";
        }
        return messages.stream()
                .filter(Objects::nonNull)
                .filter(message -> message.hasRole(ChatMessage.ROLE_USER))
                .map(message -> PromptInjector.contentAsText(message.getContent()))
                .collect(Collectors.joining(USER_TEXT_SEPARATOR));
    }

    private PipelineOutcome finish(PipelineOutcome outcome, String correlationId) {
        notifyListeners(listener -> listener.onOutcome(outcome.getTerminalState(), correlationId));
        return outcome;
    }

    private void notifyListeners(Consumer<PolicyEventListener> event) {
        for (PolicyEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Policy event listener failed - listener: {}, error: {}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
