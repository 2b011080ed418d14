package com.socialhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username is required") @Size(min = 3, max = 32)
        @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "username may only contain letters, digits, '_', '.' and '-'")
        String username,
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 64) String password
) {
}
