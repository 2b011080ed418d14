package com.socialhub.backend.modules.auth.application;

import java.time.Duration;

/**
 * The four token purposes. Each is signed with its own secret and has a fixed lifetime.
 */
public enum TokenClass {

    ACCESS(Duration.ofMinutes(30)),
    REFRESH(Duration.ofHours(6)),
    PASSWORD_RESET(Duration.ofMinutes(15)),
    ACTIVATION(Duration.ofMinutes(15));

    private final Duration ttl;

    TokenClass(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration ttl() {
        return ttl;
    }
}
