package com.socialhub.backend.modules.ratelimit.application;

import java.time.Duration;

/**
 * Atomic counter with expiry. Implementations must increment and arm the expiry in one step.
 */
public interface RequestCounterStore {

    /**
     * @throws org.springframework.dao.DataAccessException when the store cannot be reached
     */
    CounterSnapshot increment(String key, Duration window, WindowMode mode);
}
