package com.governorHq.llmGateway.upstream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.governorHq.llmGateway.gateway.dto.ChatCompletionRequest;
import com.governorHq.llmGateway.upstream.model.ChunkRelay;
import com.governorHq.llmGateway.upstream.model.UpstreamReply;

import java.util.concurrent.CompletableFuture;

/**
 * Transport to the upstream LLM provider.
 * <p>
 * Calls are asynchronous; the caller decides how long to wait. A failed future
 * carries an {@link com.governorHq.llmGateway.upstream.exception.UpstreamException}.
 */
public interface LlmUpstream {

    /**
     * Sends a chat-completion request. Streaming requests resolve as soon as the
     * upstream starts answering.
     */
    CompletableFuture<UpstreamReply> chatCompletion(ChatCompletionRequest request);

    /**
     * Sends a raw text-completion request ({@code /completions}).
     */
    CompletableFuture<RawReply> completion(JsonNode body, boolean streaming);

    /**
     * Untyped upstream reply used by the text-completion pass-through.
     *
     * @param statusCode upstream HTTP status
     * @param body       parsed JSON body, null when streamed
     * @param chunks     live chunk sequence, null when materialized
     */
    record RawReply(int statusCode, JsonNode body, ChunkRelay chunks) {

        public void release() {
            if (chunks != null) {
                chunks.release();
            }
        }
    }
}
