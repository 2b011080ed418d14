package com.socialhub.backend.modules.moderation.presentation.dto;

public record MessageResponse(String message) {
}
