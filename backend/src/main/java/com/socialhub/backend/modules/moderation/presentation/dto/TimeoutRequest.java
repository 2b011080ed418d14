package com.socialhub.backend.modules.moderation.presentation.dto;

public record TimeoutRequest(String timeoutDuration) {
}
