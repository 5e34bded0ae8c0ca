package com.governorHq.llmGateway.guard.model;

import com.governorHq.llmGateway.gateway.dto.ChatCompletionResponse;
import com.governorHq.llmGateway.upstream.model.ChunkRelay;
import lombok.Builder;
import lombok.Value;

/**
 * Final result of one pass through the enforcement pipeline.
 * Exactly one of {@link #response} and {@link #chunks} is set.
 */
@Value
@Builder
public class PipelineOutcome {

    TerminalState terminalState;

    int statusCode;

    ChatCompletionResponse response;

    ChunkRelay chunks;

    public boolean isStreamed() {
        return chunks != null;
    }
}
