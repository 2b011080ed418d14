package com.socialhub.backend.modules.moderation.domain;

import com.socialhub.backend.modules.auth.domain.RoleLevel;

/**
 * Privileged actions with their minimum actor level and target-role rule.
 */
public enum ModerationAction {

    TIMEOUT("timeout", RoleLevel.MODERATOR, TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN),
    REMOVE_TIMEOUT("remove timeout of", RoleLevel.MODERATOR, TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN),
    LIST_TIMED_OUT("list timed out", RoleLevel.MODERATOR, TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN),
    DEACTIVATE("deactivate", RoleLevel.MODERATOR, TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN),
    ACTIVATE("activate", RoleLevel.MODERATOR, TargetRule.NORMAL_FOR_MODERATOR),
    BAN("ban", RoleLevel.ADMIN, TargetRule.NOT_ADMIN_FOR_ADMIN),
    UNBAN("unban", RoleLevel.ADMIN, TargetRule.NOT_ADMIN_FOR_ADMIN),
    DELETE_COMMENT("delete comment of", RoleLevel.MODERATOR, TargetRule.ANY),
    DELETE_POST("delete post of", RoleLevel.ADMIN, TargetRule.ANY);

    public enum TargetRule {
        ANY,
        /** A moderator may only act on normal users. */
        NORMAL_FOR_MODERATOR,
        /** An admin may not act on another admin. */
        NOT_ADMIN_FOR_ADMIN,
        NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN
    }

    private final String verb;
    private final RoleLevel minimumLevel;
    private final TargetRule targetRule;

    ModerationAction(String verb, RoleLevel minimumLevel, TargetRule targetRule) {
        this.verb = verb;
        this.minimumLevel = minimumLevel;
        this.targetRule = targetRule;
    }

    public String verb() {
        return verb;
    }

    public RoleLevel minimumLevel() {
        return minimumLevel;
    }

    public TargetRule targetRule() {
        return targetRule;
    }
}
