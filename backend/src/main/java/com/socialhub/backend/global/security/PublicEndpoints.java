package com.socialhub.backend.global.security;

import java.util.List;
import java.util.stream.Stream;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.web.util.UrlPathHelper;

/**
 * Paths reachable without a session.
 */
public final class PublicEndpoints {

    static final List<String> PATHS = List.of(
            "/auth/register",
            "/auth/login",
            "/auth/logout",
            "/auth/forgot-password",
            "/auth/reset-password",
            "/auth/activate",
            "/auth/resend-activation",
            "/actuator/health"
    );

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private PublicEndpoints() {
    }

    public static boolean matches(HttpServletRequest request) {
        return matches(pathOf(request));
    }

    /**
     * Request path without the context path. Does not depend on the servlet mapping.
     */
    public static String pathOf(HttpServletRequest request) {
        return PATH_HELPER.getPathWithinApplication(request);
    }

    public static boolean matches(String path) {
        if (path == null) {
            return false;
        }
        for (String publicPath : PATHS) {
            if (path.equals(publicPath) || path.startsWith(publicPath + "/")) {
                return true;
            }
        }
        return false;
    }

    static String[] patterns() {
        return PATHS.stream()
                .flatMap(path -> Stream.of(path, path + "/**"))
                .toArray(String[]::new);
    }
}
