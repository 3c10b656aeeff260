package com.carelink.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import io.swagger.v3.oas.annotations.media.Schema;

public record TokenPairResponse(
        @Schema(description = "HS256 JWT. Subject is the user id, claims carry email and role.")
        String accessToken,
        String tokenType,
        @Schema(description = "Access token lifetime in seconds")
        long expiresIn,
        @Schema(description = "Opaque token. Only its SHA-256 hash is stored server side.")
        String refreshToken,
        @Schema(description = "Refresh session lifetime in seconds")
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
