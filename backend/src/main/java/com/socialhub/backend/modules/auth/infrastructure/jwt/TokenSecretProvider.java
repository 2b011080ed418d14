package com.socialhub.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.socialhub.backend.modules.auth.application.TokenClass;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds one HMAC key per {@link TokenClass}. Keys are never shared between classes.
 */
@Component
public class TokenSecretProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    static final int MIN_SECRET_BYTES = 32;

    private final Map<TokenClass, SecretKey> keys = new EnumMap<>(TokenClass.class);

    public TokenSecretProvider(
            @Value("${social.jwt.access-secret}") String accessSecret,
            @Value("${social.jwt.refresh-secret}") String refreshSecret,
            @Value("${social.jwt.reset-secret}") String resetSecret,
            @Value("${social.jwt.activation-secret}") String activationSecret
    ) {
        register(TokenClass.ACCESS, accessSecret);
        register(TokenClass.REFRESH, refreshSecret);
        register(TokenClass.PASSWORD_RESET, resetSecret);
        register(TokenClass.ACTIVATION, activationSecret);
    }

    public SecretKey getSecretKey(TokenClass tokenClass) {
        return keys.get(tokenClass);
    }

    private void register(TokenClass tokenClass, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("secret for " + tokenClass + " tokens is not configured");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("secret for " + tokenClass + " tokens must be at least "
                    + MIN_SECRET_BYTES + " bytes");
        }
        for (Map.Entry<TokenClass, SecretKey> existing : keys.entrySet()) {
            if (Arrays.equals(existing.getValue().getEncoded(), keyBytes)) {
                throw new IllegalStateException(tokenClass + " tokens reuse the " + existing.getKey() + " secret");
            }
        }
        keys.put(tokenClass, new SecretKeySpec(keyBytes, HMAC_SHA_256));
    }
}
