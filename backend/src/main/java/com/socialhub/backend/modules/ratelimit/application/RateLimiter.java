package com.socialhub.backend.modules.ratelimit.application;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Per-IP admission control over a {@link RequestCounterStore}. The limit+1-th request inside
 * one window is rejected.
 */
@Service
public class RateLimiter {

    static final String KEY_PREFIX = "rl:ip:";

    private final RequestCounterStore counterStore;
    private final long limit;
    private final Duration window;
    private final WindowMode windowMode;

    public RateLimiter(
            RequestCounterStore counterStore,
            @Value("${social.rate-limit.limit:100}") long limit,
            @Value("${social.rate-limit.window:PT1M}") Duration window,
            @Value("${social.rate-limit.window-mode:FIXED}") WindowMode windowMode
    ) {
        if (limit <= 0) {
            throw new IllegalArgumentException("rate limit must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("rate limit window must be positive");
        }
        this.counterStore = counterStore;
        this.limit = limit;
        this.window = window;
        this.windowMode = windowMode;
    }

    public RateLimitDecision admit(String clientIp) {
        CounterSnapshot snapshot = counterStore.increment(KEY_PREFIX + clientIp, window, windowMode);
        if (snapshot.count() <= limit) {
            return new RateLimitDecision(true, snapshot.count(), limit, 0);
        }
        return new RateLimitDecision(false, snapshot.count(), limit, retryAfterSeconds(snapshot.remainingMillis()));
    }

    private long retryAfterSeconds(long remainingMillis) {
        long millis = remainingMillis > 0 ? remainingMillis : window.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
