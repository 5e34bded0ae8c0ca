package com.governorHq.llmGateway.gateway.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.governorHq.llmGateway.config.PolicyProperties;
import com.governorHq.llmGateway.gateway.util.ClientIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory fixed-window rate limiter keyed by client identity.
 * <p>
 * Each identity owns a window of {@link #WINDOW} starting at its first admitted
 * request. The window resets once more than {@link #WINDOW} has elapsed since it
 * started; within a window the first {@code rateLimit} requests are admitted and
 * every further one is rejected. Bursts straddling a window boundary can reach
 * twice the nominal rate.
 * <p>
 * Windows are updated with {@code compute} on the cache map, so concurrent
 * requests from the same identity never lose an increment. Entries idle for
 * twice the window are evicted by Caffeine; an evicted identity behaves exactly
 * like one whose window has elapsed.
 */
@Slf4j
@Service
public class RateLimiter {

    public static final Duration WINDOW = Duration.ofSeconds(60);

    private static final long MAX_TRACKED_IDENTITIES = 100_000;

    private final PolicyProperties policy;
    private final Clock clock;

    private final Cache<String, RequestWindow> windows = Caffeine.newBuilder()
            .expireAfterWrite(WINDOW.multipliedBy(2))
            .maximumSize(MAX_TRACKED_IDENTITIES)
            .build();

    public RateLimiter(PolicyProperties policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Checks whether a request from the identity is admitted, using the injected clock.
     *
     * @param identity client identity (typically the origin address)
     * @return true if admitted, false if the identity exhausted its window
     */
    public boolean admit(String identity) {
        return admit(identity, clock.instant());
    }

    /**
     * Checks whether a request from the identity is admitted at {@code now}.
     *
     * @param identity client identity
     * @param now      request time
     * @return true if admitted, false if the identity exhausted its window
     */
    public boolean admit(String identity, Instant now) {
        if (!policy.rateLimitingActive()) {
            return true;
        }
        int limit = policy.rateLimit();
        AtomicBoolean admitted = new AtomicBoolean();
        windows.asMap().compute(identity, (key, window) -> {
            if (window == null || window.isElapsed(now)) {
                admitted.set(true);
                return new RequestWindow(1, now);
            }
            RequestWindow next = window.increment();
            admitted.set(next.count() <= limit);
            return next;
        });
        if (!admitted.get()) {
            log.debug("Rate window exhausted - identity: {}, limit: {}", ClientIdMasker.mask(identity), limit);
        }
        return admitted.get();
    }

    /**
     * Number of identities currently tracked.
     */
    public long trackedIdentities() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    /**
     * Counter state of one identity's current window.
     */
    private record RequestWindow(int count, Instant windowStart) {

        boolean isElapsed(Instant now) {
            return Duration.between(windowStart, now).compareTo(WINDOW) > 0;
        }

        RequestWindow increment() {
            // saturate so a flood within one window cannot overflow
            return new RequestWindow(count == Integer.MAX_VALUE ? count : count + 1, windowStart);
        }
    }
}
