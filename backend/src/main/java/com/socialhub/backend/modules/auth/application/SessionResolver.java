package com.socialhub.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.SocialUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Single-pass session resolution from the access and refresh cookies.
 *
 * <p>A valid access token whose user still exists resolves directly. Otherwise the refresh token
 * is required; when it resolves, a new access/refresh pair is always minted. The resolved
 * account then goes through {@link AccountStatusGate}. Store errors become {@code internal_error}
 * and are never retried here.
 */
@Service
public class SessionResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

    private final TokenService tokenService;
    private final UserRepository userRepository;
    private final AccountStatusGate accountStatusGate;

    public SessionResolver(TokenService tokenService, UserRepository userRepository, AccountStatusGate accountStatusGate) {
        this.tokenService = tokenService;
        this.userRepository = userRepository;
        this.accountStatusGate = accountStatusGate;
    }

    public SessionResolution resolve(String accessToken, String refreshToken) {
        SocialUser user;
        TokenPair rotated = null;
        try {
            user = resolveByAccessToken(accessToken).orElse(null);
            if (user == null) {
                if (refreshToken == null || refreshToken.isBlank()) {
                    return SessionResolution.rejected(new ProblemException(HttpStatus.UNAUTHORIZED,
                            "unauthorized.missing_auth_tokens", "missing auth tokens"));
                }
                UUID subject;
                try {
                    subject = tokenService.verify(TokenClass.REFRESH, refreshToken);
                } catch (TokenVerificationException ex) {
                    log.info("refresh token rejected: {}", ex.getFailure());
                    return SessionResolution.rejected(new ProblemException(HttpStatus.UNAUTHORIZED,
                            "unauthorized.invalid_refresh_token", "invalid refresh token"));
                }
                Optional<SocialUser> found = userRepository.findWithRoleById(subject);
                if (found.isEmpty()) {
                    log.info("refresh token subject {} no longer exists", subject);
                    return SessionResolution.rejected(new ProblemException(HttpStatus.UNAUTHORIZED,
                            "unauthorized.user_not_found", "user not found"));
                }
                user = found.get();
                rotated = issuePair(user.getId());
                log.debug("rotated session tokens for user {}", user.getId());
            }
        } catch (DataAccessException ex) {
            log.error("user lookup failed during session resolution", ex);
            return SessionResolution.rejected(new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "internal_error", "internal server error"));
        }

        ProblemException gateRejection = accountStatusGate.check(user);
        if (gateRejection != null) {
            log.warn("session for user {} rejected: {}", user.getId(), gateRejection.getCode());
            return SessionResolution.rejected(user, rotated, gateRejection);
        }
        return SessionResolution.accepted(user, rotated);
    }

    public TokenPair issuePair(UUID userId) {
        return new TokenPair(
                tokenService.issue(TokenClass.ACCESS, userId),
                tokenService.issue(TokenClass.REFRESH, userId)
        );
    }

    private Optional<SocialUser> resolveByAccessToken(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Optional.empty();
        }
        UUID subject;
        try {
            subject = tokenService.verify(TokenClass.ACCESS, accessToken);
        } catch (TokenVerificationException ex) {
            log.debug("access token not usable: {}", ex.getFailure());
            return Optional.empty();
        }
        Optional<SocialUser> found = userRepository.findWithRoleById(subject);
        if (found.isEmpty()) {
            log.info("access token subject {} not found, trying refresh token", subject);
        }
        return found;
    }
}
