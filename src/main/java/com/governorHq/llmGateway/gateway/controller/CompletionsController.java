package com.governorHq.llmGateway.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.gateway.dto.ModelList;
import com.governorHq.llmGateway.gateway.model.RequestContext;
import com.governorHq.llmGateway.gateway.service.GatewayService;
import com.governorHq.llmGateway.guard.model.PipelineOutcome;
import com.governorHq.llmGateway.upstream.model.ChunkRelay;
import com.governorHq.llmGateway.upstream.service.LlmUpstream;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * OpenAI-compatible REST controller - thin HTTP layer over {@link GatewayService}.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Hand the admitted request context to {@link GatewayService}
 * - Relay streamed upstream replies as {@code text/event-stream}
 */
@RestController
@RequestMapping("/v1")
@CrossOrigin(origins = "*", methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
@RequiredArgsConstructor
public class CompletionsController {

    private final GatewayService gatewayService;

    /**
     * Chat completions, routed through the constitutional safety layer.
     *
     * @param request Chat-completion request
     * @return the upstream, annotated or substitute response; or a {@link StreamingResponseBody}
     *         relaying the upstream event stream
     */
    @PostMapping("/chat/completions")
    public Object chatCompletions(
            @Valid @RequestBody ChatCompletionRequest request,
            @RequestAttribute(RequestContext.ATTRIBUTE) RequestContext context,
            HttpServletResponse servletResponse) {

        PipelineOutcome outcome = gatewayService.processChatCompletion(request, context);

        if (outcome.isStreamed()) {
            return eventStream(servletResponse, outcome.getStatusCode(), outcome.getChunks());
        }
        return ResponseEntity.status(outcome.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(outcome.getResponse());
    }

    /**
     * Text completions, passed through with rate limiting only.
     */
    @PostMapping("/completions")
    public Object completions(
            @RequestBody JsonNode body,
            @RequestAttribute(RequestContext.ATTRIBUTE) RequestContext context,
            HttpServletResponse servletResponse) {

        LlmUpstream.RawReply reply = gatewayService.processCompletion(body, context);

        if (reply.chunks() != null) {
            return eventStream(servletResponse, reply.statusCode(), reply.chunks());
        }
        return ResponseEntity.status(reply.statusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(reply.body());
    }

    @GetMapping("/models")
    public ResponseEntity<ModelList> models() {
        return ResponseEntity.ok(gatewayService.listModels());
    }

    /**
     * Relays upstream chunks as they arrive. Status and headers go on the servlet
     * response directly since the body is written asynchronously.
     */
    private static StreamingResponseBody eventStream(HttpServletResponse response, int statusCode, ChunkRelay chunks) {
        response.setStatus(statusCode);
        response.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        response.setHeader("X-Accel-Buffering", "no");
        return chunks::relayTo;
    }
}
