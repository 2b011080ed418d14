package com.socialhub.backend.modules.moderation.presentation.dto;

import java.util.List;

import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

public record TimedOutUsersResponse(String message, int page, List<UserResponse> users) {
}
