package com.socialhub.backend.modules.ratelimit.presentation;

import java.io.IOException;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.global.error.ProblemResponseWriter;
import com.socialhub.backend.global.error.RetryableProblemException;
import com.socialhub.backend.global.security.PublicEndpoints;
import com.socialhub.backend.global.web.ClientIpResolver;
import com.socialhub.backend.modules.ratelimit.application.RateLimitDecision;
import com.socialhub.backend.modules.ratelimit.application.RateLimiter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Throttles every request by client IP. The counter store is a hard dependency: when it is
 * unreachable the request fails with {@code internal_error} instead of being let through.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    private static final String HEALTH_PATH = "/actuator/health";

    private final RateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final ProblemResponseWriter problemResponseWriter;

    public RateLimitFilter(RateLimiter rateLimiter, ClientIpResolver clientIpResolver,
                           ProblemResponseWriter problemResponseWriter) {
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String clientIp = clientIpResolver.resolve(request);
        RateLimitDecision decision;
        try {
            decision = rateLimiter.admit(clientIp);
        } catch (DataAccessException ex) {
            log.error("rate limit store unavailable for {}", clientIp, ex);
            problemResponseWriter.write(request, response,
                    new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "internal server error"));
            return;
        }
        if (!decision.admitted()) {
            log.warn("throttled {} after {} requests, retry in {}s", clientIp, decision.count(), decision.retryAfterSeconds());
            problemResponseWriter.write(request, response, new RetryableProblemException(
                    HttpStatus.TOO_MANY_REQUESTS, "too_many_requests", "too many requests", decision.retryAfterSeconds()));
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = PublicEndpoints.pathOf(request);
        return path.equals(HEALTH_PATH) || path.startsWith(HEALTH_PATH + "/");
    }
}
