package com.socialhub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.SocialUser;

public record UserResponse(
        UUID id,
        String username,
        String email,
        int roleLevel,
        String roleDescription,
        boolean banned,
        boolean active,
        OffsetDateTime timeoutUntil,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserResponse from(SocialUser user) {
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getRoleLevel(),
                user.getRole().getDescription(),
                user.isBanned(),
                user.isActive(),
                user.getTimeoutUntil(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
