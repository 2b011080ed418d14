package com.socialhub.backend.modules.auth.application;

import static com.socialhub.backend.support.TestUsers.TEST_SECRET_ACCESS;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_ACTIVATION;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_REFRESH;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_RESET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.socialhub.backend.modules.auth.domain.SocialUser;
import com.socialhub.backend.modules.auth.infrastructure.jwt.TokenSecretProvider;
import com.socialhub.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.socialhub.backend.support.MutableClock;
import com.socialhub.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class SessionResolverTest {

    @Mock
    private UserRepository userRepository;

    private MutableClock clock;
    private TokenService tokenService;
    private SessionResolver sessionResolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        TokenSecretProvider provider = new TokenSecretProvider(
                TEST_SECRET_ACCESS, TEST_SECRET_REFRESH, TEST_SECRET_RESET, TEST_SECRET_ACTIVATION);
        tokenService = new TokenService(provider, clock);
        sessionResolver = new SessionResolver(tokenService, userRepository, new AccountStatusGate(clock));
    }

    @Test
    void validAccessTokenResolvesWithoutRotation() {
        SocialUser user = TestUsers.user(1);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));

        SessionResolution resolution = sessionResolver.resolve(tokenService.issue(TokenClass.ACCESS, user.getId()), null);

        assertThat(resolution.isAccepted()).isTrue();
        assertThat(resolution.isRotated()).isFalse();
        assertThat(resolution.user()).isSameAs(user);
    }

    @Test
    void expiredAccessTokenFallsBackToRefreshAndRotatesBothTokens() {
        SocialUser user = TestUsers.user(1);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));
        String accessToken = tokenService.issue(TokenClass.ACCESS, user.getId());
        String refreshToken = tokenService.issue(TokenClass.REFRESH, user.getId());

        clock.advance(Duration.ofMinutes(45));
        SessionResolution resolution = sessionResolver.resolve(accessToken, refreshToken);

        assertThat(resolution.isAccepted()).isTrue();
        assertThat(resolution.isRotated()).isTrue();
        TokenPair rotated = resolution.rotatedTokens();
        assertThat(rotated.accessToken()).isNotEqualTo(accessToken);
        assertThat(rotated.refreshToken()).isNotEqualTo(refreshToken);
        assertThat(tokenService.verify(TokenClass.ACCESS, rotated.accessToken())).isEqualTo(user.getId());
        assertThat(tokenService.verify(TokenClass.REFRESH, rotated.refreshToken())).isEqualTo(user.getId());
    }

    @Test
    void missingAccessTokenWithValidRefreshRotates() {
        SocialUser user = TestUsers.user(2);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));

        SessionResolution resolution = sessionResolver.resolve(null, tokenService.issue(TokenClass.REFRESH, user.getId()));

        assertThat(resolution.isAccepted()).isTrue();
        assertThat(resolution.isRotated()).isTrue();
    }

    @Test
    void noCookiesIsUnauthorized() {
        SessionResolution resolution = sessionResolver.resolve(null, null);

        assertThat(resolution.isAccepted()).isFalse();
        assertThat(resolution.rejection().getHttpStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resolution.rejection().getCode()).isEqualTo("unauthorized.missing_auth_tokens");
        verify(userRepository, never()).findWithRoleById(any());
    }

    @Test
    void invalidRefreshTokenIsUnauthorized() {
        String wrongClass = tokenService.issue(TokenClass.ACCESS, TestUsers.user(1).getId());

        SessionResolution resolution = sessionResolver.resolve("garbage", wrongClass);

        assertThat(resolution.rejection().getHttpStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resolution.rejection().getCode()).isEqualTo("unauthorized.invalid_refresh_token");
        assertThat(resolution.isRotated()).isFalse();
    }

    @Test
    void unknownAccessSubjectFallsThroughToRefresh() {
        SocialUser stale = TestUsers.user(1);
        SocialUser current = TestUsers.user(1);
        when(userRepository.findWithRoleById(stale.getId())).thenReturn(Optional.empty());
        when(userRepository.findWithRoleById(current.getId())).thenReturn(Optional.of(current));

        SessionResolution resolution = sessionResolver.resolve(
                tokenService.issue(TokenClass.ACCESS, stale.getId()),
                tokenService.issue(TokenClass.REFRESH, current.getId()));

        assertThat(resolution.isAccepted()).isTrue();
        assertThat(resolution.user()).isSameAs(current);
        assertThat(resolution.isRotated()).isTrue();
    }

    @Test
    void unknownRefreshSubjectIsUnauthorized() {
        SocialUser ghost = TestUsers.user(1);
        when(userRepository.findWithRoleById(ghost.getId())).thenReturn(Optional.empty());

        SessionResolution resolution = sessionResolver.resolve(null, tokenService.issue(TokenClass.REFRESH, ghost.getId()));

        assertThat(resolution.rejection().getCode()).isEqualTo("unauthorized.user_not_found");
    }

    @Test
    void lookupFailureIsInternalError() {
        SocialUser user = TestUsers.user(1);
        when(userRepository.findWithRoleById(user.getId()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        SessionResolution resolution = sessionResolver.resolve(tokenService.issue(TokenClass.ACCESS, user.getId()), null);

        assertThat(resolution.rejection().getHttpStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resolution.rejection().getCode()).isEqualTo("internal_error");
        assertThat(resolution.rejection().getDetailMessage()).doesNotContain("connection refused");
    }

    @Test
    void bannedCheckWinsOverInactive() {
        SocialUser user = TestUsers.user(1);
        user.setBanned(true);
        user.setActive(false);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));

        SessionResolution resolution = sessionResolver.resolve(tokenService.issue(TokenClass.ACCESS, user.getId()), null);

        assertThat(resolution.rejection().getHttpStatus()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(resolution.rejection().getCode()).isEqualTo("forbidden.account_banned");
    }

    @Test
    void inactiveAccountIsForbidden() {
        SocialUser user = TestUsers.user(1);
        user.setActive(false);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));

        SessionResolution resolution = sessionResolver.resolve(tokenService.issue(TokenClass.ACCESS, user.getId()), null);

        assertThat(resolution.rejection().getCode()).isEqualTo("forbidden.account_not_active");
    }

    @Test
    void activeTimeoutIsForbiddenAndElapsedTimeoutIsIgnored() {
        SocialUser user = TestUsers.user(1);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));
        String accessToken = tokenService.issue(TokenClass.ACCESS, user.getId());

        user.setTimeoutUntil(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).plusMinutes(10));
        assertThat(sessionResolver.resolve(accessToken, null).rejection().getCode())
                .isEqualTo("forbidden.account_timeout");

        user.setTimeoutUntil(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).minusMinutes(1));
        assertThat(sessionResolver.resolve(accessToken, null).isAccepted()).isTrue();
    }

    @Test
    void gateRejectionOnRefreshPathStillCarriesRotatedTokens() {
        SocialUser user = TestUsers.user(1);
        user.setBanned(true);
        when(userRepository.findWithRoleById(user.getId())).thenReturn(Optional.of(user));

        SessionResolution resolution = sessionResolver.resolve(null, tokenService.issue(TokenClass.REFRESH, user.getId()));

        assertThat(resolution.isAccepted()).isFalse();
        assertThat(resolution.isRotated()).isTrue();
        assertThat(resolution.rejection().getCode()).isEqualTo("forbidden.account_banned");
    }
}
