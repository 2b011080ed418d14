package com.socialhub.backend.modules.auth.domain;

/**
 * Integer ranks stored in {@code roles.level}. Higher means more privileged.
 */
public enum RoleLevel {

    NORMAL(1),
    MODERATOR(2),
    ADMIN(3);

    private final int level;

    RoleLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
