package com.socialhub.backend.modules.ratelimit.application;

public record RateLimitDecision(boolean admitted, long count, long limit, long retryAfterSeconds) {
}
