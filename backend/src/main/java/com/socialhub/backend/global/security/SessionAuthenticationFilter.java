package com.socialhub.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.socialhub.backend.global.error.ProblemResponseWriter;
import com.socialhub.backend.modules.auth.application.SessionResolution;
import com.socialhub.backend.modules.auth.application.SessionResolver;
import com.socialhub.backend.modules.auth.domain.RoleLevel;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the cookie session on every protected request. Rotated tokens are written back
 * before any rejection so the browser keeps the freshest pair.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private final SessionResolver sessionResolver;
    private final SessionCookies sessionCookies;
    private final ProblemResponseWriter problemResponseWriter;

    public SessionAuthenticationFilter(
            SessionResolver sessionResolver,
            SessionCookies sessionCookies,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.sessionResolver = sessionResolver;
        this.sessionCookies = sessionCookies;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        SessionResolution resolution = sessionResolver.resolve(
                sessionCookies.readAccessToken(request),
                sessionCookies.readRefreshToken(request)
        );
        if (resolution.isRotated()) {
            sessionCookies.write(response, resolution.rotatedTokens());
        }
        if (!resolution.isAccepted()) {
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, resolution.rejection());
            return;
        }

        SessionPrincipal principal = SessionPrincipal.from(resolution.user());
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null, authoritiesFor(principal.roleLevel()));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return PublicEndpoints.matches(request);
    }

    private static List<SimpleGrantedAuthority> authoritiesFor(int roleLevel) {
        if (roleLevel >= RoleLevel.ADMIN.level()) {
            return List.of(new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_MODERATOR"),
                    new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        if (roleLevel >= RoleLevel.MODERATOR.level()) {
            return List.of(new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_MODERATOR"));
        }
        return List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }
}
