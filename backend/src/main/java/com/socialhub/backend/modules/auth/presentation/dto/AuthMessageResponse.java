package com.socialhub.backend.modules.auth.presentation.dto;

public record AuthMessageResponse(String message, UserResponse user, String link) {

    public static AuthMessageResponse of(String message) {
        return new AuthMessageResponse(message, null, null);
    }
}
