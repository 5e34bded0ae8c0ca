package com.governorHq.llmGateway.upstream.util;

import com.governorHq.llmGateway.upstream.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Waits on upstream futures with a deadline.
 */
@Slf4j
public final class UpstreamFutures {

    private UpstreamFutures() {
    }

    /**
     * Runs an upstream call on {@code executor}.
     * <p>
     * A value produced after the returned future was cancelled is handed to {@code discard},
     * so a late reply never keeps its connection. A saturated executor yields a failed future
     * carrying an {@link UpstreamException}.
     *
     * @param task     the blocking upstream call
     * @param executor upstream worker pool
     * @param discard  releases a value nobody is waiting for
     * @return future of the call
     */
    public static <T> CompletableFuture<T> supply(Supplier<T> task, Executor executor, Consumer<? super T> discard) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    T value = task.get();
                    if (!future.complete(value) && value != null) {
                        log.warn("Upstream reply arrived after the caller gave up - releasing it");
                        discard.accept(value);
                    }
                } catch (Throwable e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Upstream executor saturated - rejecting call: {}", e.getMessage());
            return CompletableFuture.failedFuture(
                    new UpstreamException("Upstream error: gateway is at capacity, try again later", e));
        }
        return future;
    }

    /**
     * Blocks until the upstream future completes or the timeout elapses.
     * A timed-out future is cancelled.
     *
     * @param future        pending upstream call
     * @param timeout       maximum wait
     * @param correlationId correlation ID for logging
     * @return the completed value
     * @throws UpstreamException on failure, timeout or interruption
     */
    public static <T> T await(CompletableFuture<T> future, Duration timeout, String correlationId) {
        long timeoutMs = timeout.toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Upstream timed out - correlationId: {}, timeoutMs: {}", correlationId, timeoutMs);
            throw UpstreamException.timedOut(timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof UpstreamException upstreamException) {
                throw upstreamException;
            }
            log.error("Upstream call failed - correlationId: {}, error: {}", correlationId, cause.getMessage());
            throw new UpstreamException("Upstream error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new UpstreamException("Interrupted while waiting for upstream", e);
        }
    }

    /**
     * Unwraps the cause of a failed upstream future.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
