package com.socialhub.backend.global.security;

import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.SocialUser;

public record SessionPrincipal(UUID userId, String username, String email, int roleLevel, String roleDescription) {

    public static SessionPrincipal from(SocialUser user) {
        return new SessionPrincipal(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getRoleLevel(),
                user.getRole().getDescription()
        );
    }
}
