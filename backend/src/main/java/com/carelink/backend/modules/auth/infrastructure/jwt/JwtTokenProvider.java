package com.carelink.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC signing key. {@code jwt.secret} (env {@code JWT_SECRET}) may be Base64 or plain text.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        byte[] keyBytes = decode(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT_SECRET must provide at least " + MIN_KEY_BYTES
                    + " bytes (256 bits) of key material, got " + keyBytes.length);
        }
        this.secretKey = Keys.hmacShaKeyFor(keyBytes);
    }

    private static byte[] decode(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException notBase64) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
