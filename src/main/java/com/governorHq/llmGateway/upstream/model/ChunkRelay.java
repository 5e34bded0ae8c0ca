package com.governorHq.llmGateway.upstream.model;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A live upstream chunk sequence, copied to the caller as bytes arrive.
 */
@FunctionalInterface
public interface ChunkRelay {

    /**
     * Copies the remaining chunks to {@code out} and releases the upstream connection.
     */
    void relayTo(OutputStream out) throws IOException;

    /**
     * Releases the upstream connection without relaying. Used when nobody is left to read the chunks.
     */
    default void release() {
    }
}
