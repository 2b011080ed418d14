package com.socialhub.backend.modules.auth.application;

public record TokenPair(String accessToken, String refreshToken) {
}
