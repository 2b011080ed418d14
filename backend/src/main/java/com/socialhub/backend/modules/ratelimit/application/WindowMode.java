package com.socialhub.backend.modules.ratelimit.application;

/**
 * When the counter's expiry is (re)armed.
 */
public enum WindowMode {
    /** Expiry set only when the increment opens a new window. */
    FIXED,
    /** Expiry pushed to now + window on every increment. */
    REARM
}
