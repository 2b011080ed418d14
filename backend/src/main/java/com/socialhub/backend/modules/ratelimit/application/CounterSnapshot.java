package com.socialhub.backend.modules.ratelimit.application;

/**
 * Post-increment count and the milliseconds left before the counter expires.
 */
public record CounterSnapshot(long count, long remainingMillis) {
}
