package com.socialhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "newPassword is required") @Size(min = 8, max = 64) String newPassword,
        @NotBlank(message = "confirmPassword is required") String confirmPassword
) {
}
