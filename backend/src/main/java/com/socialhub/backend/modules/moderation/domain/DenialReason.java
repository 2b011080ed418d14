package com.socialhub.backend.modules.moderation.domain;

public enum DenialReason {

    INSUFFICIENT_PERMISSIONS("forbidden.insufficient_permissions"),
    MODERATOR_CANNOT_ACT_ON_PEER("forbidden.moderator_cannot_act_on_peer"),
    ADMIN_CANNOT_ACT_ON_ADMIN("forbidden.admin_cannot_act_on_admin");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
