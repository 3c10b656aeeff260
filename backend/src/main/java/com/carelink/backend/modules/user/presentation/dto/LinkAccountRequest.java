package com.carelink.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LinkAccountRequest(
        @NotBlank(message = "provider is required") @Size(max = 64) String provider,
        @NotBlank(message = "providerAccountId is required") @Size(max = 255) String providerAccountId,
        @NotBlank(message = "type is required") @Size(max = 32) String type,
        String accessToken,
        String refreshToken,
        Long expiresAt,
        @Size(max = 32) String tokenType,
        @Size(max = 512) String scope,
        String idToken
) {
}
