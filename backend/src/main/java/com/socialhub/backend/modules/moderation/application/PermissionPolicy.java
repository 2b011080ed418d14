package com.socialhub.backend.modules.moderation.application;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.RoleLevel;
import com.socialhub.backend.modules.moderation.domain.DenialReason;
import com.socialhub.backend.modules.moderation.domain.ModerationAction;
import com.socialhub.backend.modules.moderation.domain.ModerationAction.TargetRule;
import com.socialhub.backend.modules.moderation.domain.PermissionDecision;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * The role-hierarchy matrix for moderation. Pure: the same levels and action always give the
 * same decision. Endpoints call {@link #require} and never compare levels themselves.
 */
@Component
public class PermissionPolicy {

    public PermissionDecision decide(int actorLevel, int targetLevel, ModerationAction action) {
        if (actorLevel < action.minimumLevel().level()) {
            return PermissionDecision.deny(action, DenialReason.INSUFFICIENT_PERMISSIONS);
        }
        TargetRule rule = action.targetRule();
        boolean moderatorRule = rule == TargetRule.NORMAL_FOR_MODERATOR
                || rule == TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN;
        boolean adminRule = rule == TargetRule.NOT_ADMIN_FOR_ADMIN
                || rule == TargetRule.NORMAL_FOR_MODERATOR_NOT_ADMIN_FOR_ADMIN;

        if (moderatorRule && actorLevel == RoleLevel.MODERATOR.level() && targetLevel > RoleLevel.NORMAL.level()) {
            return PermissionDecision.deny(action, DenialReason.MODERATOR_CANNOT_ACT_ON_PEER);
        }
        if (adminRule && actorLevel >= RoleLevel.ADMIN.level() && targetLevel >= RoleLevel.ADMIN.level()) {
            return PermissionDecision.deny(action, DenialReason.ADMIN_CANNOT_ACT_ON_ADMIN);
        }
        return PermissionDecision.allow(action);
    }

    /**
     * @throws ProblemException 403 carrying the denial reason code
     */
    public void require(int actorLevel, int targetLevel, ModerationAction action) {
        PermissionDecision decision = decide(actorLevel, targetLevel, action);
        if (!decision.allowed()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, decision.reason().code(), decision.message());
        }
    }
}
