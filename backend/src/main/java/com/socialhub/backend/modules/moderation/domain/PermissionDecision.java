package com.socialhub.backend.modules.moderation.domain;

/**
 * Result of a policy check. {@code reason} is {@code null} when allowed.
 */
public record PermissionDecision(boolean allowed, ModerationAction action, DenialReason reason) {

    public static PermissionDecision allow(ModerationAction action) {
        return new PermissionDecision(true, action, null);
    }

    public static PermissionDecision deny(ModerationAction action, DenialReason reason) {
        return new PermissionDecision(false, action, reason);
    }

    public String message() {
        if (allowed) {
            return "allowed";
        }
        return switch (reason) {
            case INSUFFICIENT_PERMISSIONS -> "insufficient permissions";
            case MODERATOR_CANNOT_ACT_ON_PEER -> "moderator can only " + action.verb() + " normal users";
            case ADMIN_CANNOT_ACT_ON_ADMIN -> "admin cannot " + action.verb() + " another admin";
        };
    }
}
