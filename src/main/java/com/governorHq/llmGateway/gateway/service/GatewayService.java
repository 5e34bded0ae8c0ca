package com.governorHq.llmGateway.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ModelList;
import com.governorHq.llmGateway.gateway.exception.InvalidRequestException;
import com.governorHq.llmGateway.gateway.exception.RateLimitExceededException;
import com.governorHq.llmGateway.gateway.model.RequestContext;
import com.governorHq.llmGateway.gateway.util.ClientIdMasker;
import com.governorHq.llmGateway.guard.model.PipelineOutcome;
import com.governorHq.llmGateway.guard.service.EnforcementPipeline;
import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import com.governorHq.llmGateway.upstream.service.LlmUpstream;
import com.governorHq.llmGateway.upstream.util.UpstreamFutures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Gateway service - handles all business logic behind the OpenAI-compatible routes.
 *
 * Responsibilities:
 * - Resolve the client identity (rate-limit key) and the correlation ID, and run admission
 * - Run chat completions through the enforcement pipeline
 * - Pass text completions through to the upstream (rate limiting only)
 * - List the configured model
 */
@Slf4j
@Service
public class GatewayService {

    public static final String UNKNOWN_IDENTITY = "unknown";

    private static final String MODEL_OWNER = "llm-api-proxy";

    private final CorrelationIdService correlationIdService;
    private final EnforcementPipeline enforcementPipeline;
    private final LlmUpstream upstream;
    private final Clock clock;
    private final String defaultModel;
    private final Duration upstreamTimeout;

    public GatewayService(CorrelationIdService correlationIdService,
                          EnforcementPipeline enforcementPipeline,
                          LlmUpstream upstream,
                          Clock clock,
                          @Value("${llm.model:gpt-4o-mini}") String defaultModel,
                          @Value("${llm.request-timeout-ms:120000}") long requestTimeoutMs) {
        this.correlationIdService = correlationIdService;
        this.enforcementPipeline = enforcementPipeline;
        this.upstream = upstream;
        this.clock = clock;
        this.defaultModel = defaultModel;
        this.upstreamTimeout = Duration.ofMillis(requestTimeoutMs);
    }

    /**
     * Opens the request context and runs admission. Called before the request body is read.
     *
     * @param forwardedForHeader value of {@code X-Forwarded-For}, may be null
     * @param remoteAddress      socket peer address, may be null
     * @param requestIdHeader    value of {@code X-Request-ID}, may be null
     * @return context of the admitted request
     * @throws RateLimitExceededException if the client exhausted its window
     */
    public RequestContext admit(String forwardedForHeader, String remoteAddress, String requestIdHeader) {
        RequestContext context = RequestContext.builder()
                .clientIdentity(resolveClientIdentity(forwardedForHeader, remoteAddress))
                .correlationId(correlationIdService.resolveCorrelationId(requestIdHeader))
                .upstreamTimeout(upstreamTimeout)
                .receivedAt(clock.instant())
                .build();
        enforcementPipeline.admit(context);
        return context;
    }

    /**
     * Processes a chat-completion request through the enforcement pipeline.
     *
     * @param request Chat-completion request (messages already validated as present)
     * @param context Context of the admitted request
     * @return pipeline outcome (response or live chunk relay)
     * @throws UpstreamException if the upstream fails or times out
     */
    public PipelineOutcome processChatCompletion(ChatCompletionRequest request, RequestContext context) {
        log.info("Chat completion received - correlationId: {}, ip: {}, model: {}, stream: {}, messages: {}",
                context.getCorrelationId(), ClientIdMasker.mask(context.getClientIdentity()),
                request.getModel(), request.isStreaming(), request.getMessages().size());

        PipelineOutcome outcome = enforcementPipeline.process(request, context);

        log.info("Chat completion finished - correlationId: {}, state: {}, status: {}, elapsedMs: {}",
                context.getCorrelationId(), outcome.getTerminalState(), outcome.getStatusCode(),
                Duration.between(context.getReceivedAt(), clock.instant()).toMillis());
        return outcome;
    }

    /**
     * Passes a text-completion request through to the upstream.
     * Only rate limiting applies; the safety prompt and pattern scoring are chat-only.
     *
     * @param body    raw request body
     * @param context Context of the admitted request
     * @return untyped upstream reply
     * @throws InvalidRequestException if {@code prompt} is missing
     * @throws UpstreamException       if the upstream fails or times out
     */
    public LlmUpstream.RawReply processCompletion(JsonNode body, RequestContext context) {
        ObjectNode outbound = validateCompletionBody(body);
        if (!outbound.hasNonNull("model") || outbound.get("model").asText().isBlank()) {
            outbound.put("model", defaultModel);
        }
        boolean streaming = outbound.path("stream").asBoolean(false);

        log.info("Completion received - correlationId: {}, ip: {}, model: {}, stream: {}",
                context.getCorrelationId(), ClientIdMasker.mask(context.getClientIdentity()),
                outbound.get("model").asText(), streaming);

        return UpstreamFutures.await(upstream.completion(outbound, streaming), context.getUpstreamTimeout(),
                context.getCorrelationId());
    }

    /**
     * Lists the configured upstream model.
     */
    public ModelList listModels() {
        return ModelList.builder()
                .data(List.of(ModelList.Model.builder()
                        .id(defaultModel)
                        .created(clock.instant().getEpochSecond())
                        .ownedBy(MODEL_OWNER)
                        .build()))
                .build();
    }

    /**
     * Resolves the client identity: first {@code X-Forwarded-For} entry, else the
     * remote address, else {@value #UNKNOWN_IDENTITY}.
     */
    static String resolveClientIdentity(String forwardedForHeader, String remoteAddress) {
        if (forwardedForHeader != null) {
            String first = forwardedForHeader.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remoteAddress != null && !remoteAddress.isBlank()) {
            return remoteAddress;
        }
        return UNKNOWN_IDENTITY;
    }

    private ObjectNode validateCompletionBody(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidRequestException("Invalid JSON body");
        }
        JsonNode prompt = body.get("prompt");
        if (prompt == null || prompt.isNull() || (prompt.isTextual() && prompt.asText().isEmpty())) {
            throw new InvalidRequestException("\"prompt\" is required");
        }
        return ((ObjectNode) body).deepCopy();
    }
}
