package com.governorHq.llmGateway.upstream.model;

import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What the upstream exchange yields: either a materialized response or a live chunk sequence.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpstreamReply {

    private final int statusCode;
    private final ChatCompletionResponse response;
    private final ChunkRelay chunks;

    public static UpstreamReply materialized(int statusCode, ChatCompletionResponse response) {
        return new UpstreamReply(statusCode, response, null);
    }

    public static UpstreamReply streamed(int statusCode, ChunkRelay chunks) {
        return new UpstreamReply(statusCode, null, chunks);
    }

    public boolean isStreamed() {
        return chunks != null;
    }

    /**
     * Releases a streamed reply that will never be relayed.
     */
    public void release() {
        if (chunks != null) {
            chunks.release();
        }
    }
}
