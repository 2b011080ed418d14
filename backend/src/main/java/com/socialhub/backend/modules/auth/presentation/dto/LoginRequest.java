package com.socialhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Credentials for the last step of the login chain. {@code identifier} is a username or an email.
 */
public record LoginRequest(
        @NotBlank(message = "identifier is required") String identifier,
        @NotBlank(message = "password is required") @Size(min = 8, max = 64) String password
) {
}
