package com.socialhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.socialhub.backend.modules.auth.application.TokenVerificationException.Failure;
import com.socialhub.backend.modules.auth.infrastructure.jwt.TokenSecretProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SecurityException;

import org.springframework.stereotype.Service;

/**
 * Issues and verifies stateless HS256 tokens. Nothing is stored; validity is signature plus expiry.
 */
@Service
public class TokenService {

    private static final String HMAC_ALGORITHM_PREFIX = "HS";

    private final TokenSecretProvider secretProvider;
    private final Clock clock;

    public TokenService(TokenSecretProvider secretProvider, Clock clock) {
        this.secretProvider = secretProvider;
        this.clock = clock;
    }

    public String issue(TokenClass tokenClass, UUID subjectId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(subjectId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(tokenClass.ttl())))
                .signWith(secretProvider.getSecretKey(tokenClass), SIG.HS256)
                .compact();
    }

    /**
     * Verifies {@code token} against the key of {@code tokenClass} and returns its subject.
     *
     * @throws TokenVerificationException when the signature, shape or expiry is wrong
     */
    public UUID verify(TokenClass tokenClass, String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(Failure.MALFORMED, "token is empty", null);
        }
        SecretKey key = secretProvider.getSecretKey(tokenClass);
        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (ExpiredJwtException ex) {
            throw new TokenVerificationException(Failure.EXPIRED, "token expired", ex);
        } catch (SecurityException ex) {
            throw new TokenVerificationException(Failure.INVALID_SIGNATURE, "token signature rejected", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new TokenVerificationException(Failure.MALFORMED, "token is malformed", ex);
        }

        String algorithm = jws.getHeader().getAlgorithm();
        if (algorithm == null || !algorithm.startsWith(HMAC_ALGORITHM_PREFIX)) {
            throw new TokenVerificationException(Failure.INVALID_SIGNATURE, "unexpected signing algorithm", null);
        }
        Claims claims = jws.getPayload();
        if (claims.getExpiration() == null) {
            throw new TokenVerificationException(Failure.MALFORMED, "token has no expiry", null);
        }
        try {
            return UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new TokenVerificationException(Failure.MALFORMED, "token subject is not a user id", ex);
        }
    }
}
