package com.socialhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(@NotBlank(message = "identifier is required") String identifier) {
}
