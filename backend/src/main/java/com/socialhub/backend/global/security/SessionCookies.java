package com.socialhub.backend.global.security;

import java.time.Duration;

import com.socialhub.backend.modules.auth.application.TokenClass;
import com.socialhub.backend.modules.auth.application.TokenPair;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Reads and writes the {@code access_token} / {@code refresh_token} cookies.
 * Max-ages follow the token lifetimes (1800s and 21600s).
 */
@Component
public class SessionCookies {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";

    private final boolean secure;
    private final String sameSite;

    public SessionCookies(
            @Value("${social.cookie.secure:true}") boolean secure,
            @Value("${social.cookie.same-site:Lax}") String sameSite
    ) {
        this.secure = secure;
        this.sameSite = sameSite;
    }

    public String readAccessToken(HttpServletRequest request) {
        return read(request, ACCESS_TOKEN_COOKIE);
    }

    public String readRefreshToken(HttpServletRequest request) {
        return read(request, REFRESH_TOKEN_COOKIE);
    }

    public void write(HttpServletResponse response, TokenPair tokens) {
        add(response, ACCESS_TOKEN_COOKIE, tokens.accessToken(), TokenClass.ACCESS.ttl());
        add(response, REFRESH_TOKEN_COOKIE, tokens.refreshToken(), TokenClass.REFRESH.ttl());
    }

    public void clear(HttpServletResponse response) {
        add(response, ACCESS_TOKEN_COOKIE, "", Duration.ZERO);
        add(response, REFRESH_TOKEN_COOKIE, "", Duration.ZERO);
    }

    private void add(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .path("/")
                .sameSite(sameSite)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private static String read(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return null;
        }
        return cookie.getValue();
    }
}
