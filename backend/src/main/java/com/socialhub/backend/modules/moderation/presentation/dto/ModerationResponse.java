package com.socialhub.backend.modules.moderation.presentation.dto;

import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

public record ModerationResponse(String message, UserResponse user) {
}
