package com.socialhub.backend.modules.auth.application;

import static com.socialhub.backend.support.TestUsers.TEST_SECRET_ACCESS;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_ACTIVATION;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_REFRESH;
import static com.socialhub.backend.support.TestUsers.TEST_SECRET_RESET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import com.socialhub.backend.modules.auth.application.TokenVerificationException.Failure;
import com.socialhub.backend.modules.auth.infrastructure.jwt.TokenSecretProvider;
import com.socialhub.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TokenServiceTest {

    private MutableClock clock;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        TokenSecretProvider provider = new TokenSecretProvider(
                TEST_SECRET_ACCESS, TEST_SECRET_REFRESH, TEST_SECRET_RESET, TEST_SECRET_ACTIVATION);
        tokenService = new TokenService(provider, clock);
    }

    @ParameterizedTest
    @EnumSource(TokenClass.class)
    void verifiesTokenOfSameClass(TokenClass tokenClass) {
        UUID subject = UUID.randomUUID();

        String token = tokenService.issue(tokenClass, subject);

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(tokenService.verify(tokenClass, token)).isEqualTo(subject);
    }

    @Test
    void rejectsTokenOfAnotherClassAsInvalidSignature() {
        String accessToken = tokenService.issue(TokenClass.ACCESS, UUID.randomUUID());

        for (TokenClass other : new TokenClass[]{TokenClass.REFRESH, TokenClass.PASSWORD_RESET, TokenClass.ACTIVATION}) {
            assertThatThrownBy(() -> tokenService.verify(other, accessToken))
                    .isInstanceOf(TokenVerificationException.class)
                    .extracting(ex -> ((TokenVerificationException) ex).getFailure())
                    .isEqualTo(Failure.INVALID_SIGNATURE);
        }
    }

    @Test
    void expiredTokenFailsAsExpired() {
        String token = tokenService.issue(TokenClass.ACCESS, UUID.randomUUID());

        clock.advance(TokenClass.ACCESS.ttl().plusSeconds(1));

        assertThatThrownBy(() -> tokenService.verify(TokenClass.ACCESS, token))
                .isInstanceOf(TokenVerificationException.class)
                .extracting(ex -> ((TokenVerificationException) ex).getFailure())
                .isEqualTo(Failure.EXPIRED);
    }

    @Test
    void tokenIsStillValidJustBeforeExpiry() {
        UUID subject = UUID.randomUUID();
        String token = tokenService.issue(TokenClass.REFRESH, subject);

        clock.advance(Duration.ofHours(6).minusSeconds(5));

        assertThat(tokenService.verify(TokenClass.REFRESH, token)).isEqualTo(subject);
    }

    @Test
    void tamperedPayloadFailsAsInvalidSignature() {
        String token = tokenService.issue(TokenClass.ACCESS, UUID.randomUUID());
        String[] parts = token.split("\\.");
        String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
                ("{\"sub\":\"" + UUID.randomUUID() + "\",\"exp\":4102444800}").getBytes(StandardCharsets.UTF_8));

        String forged = parts[0] + "." + forgedPayload + "." + parts[2];

        assertThatThrownBy(() -> tokenService.verify(TokenClass.ACCESS, forged))
                .isInstanceOf(TokenVerificationException.class)
                .extracting(ex -> ((TokenVerificationException) ex).getFailure())
                .isEqualTo(Failure.INVALID_SIGNATURE);
    }

    @Test
    void unsignedTokenIsRejected() {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
        String payload = encoder.encodeToString(
                ("{\"sub\":\"" + UUID.randomUUID() + "\",\"exp\":4102444800}").getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> tokenService.verify(TokenClass.ACCESS, header + "." + payload + "."))
                .isInstanceOf(TokenVerificationException.class);
    }

    @Test
    void garbageFailsAsMalformed() {
        assertThatThrownBy(() -> tokenService.verify(TokenClass.ACCESS, "not-a-token"))
                .isInstanceOf(TokenVerificationException.class)
                .extracting(ex -> ((TokenVerificationException) ex).getFailure())
                .isEqualTo(Failure.MALFORMED);
        assertThatThrownBy(() -> tokenService.verify(TokenClass.ACCESS, ""))
                .isInstanceOf(TokenVerificationException.class)
                .extracting(ex -> ((TokenVerificationException) ex).getFailure())
                .isEqualTo(Failure.MALFORMED);
    }

    @Test
    void everyIssuedTokenIsDistinct() {
        UUID subject = UUID.randomUUID();

        assertThat(tokenService.issue(TokenClass.ACCESS, subject))
                .isNotEqualTo(tokenService.issue(TokenClass.ACCESS, subject));
    }
}
