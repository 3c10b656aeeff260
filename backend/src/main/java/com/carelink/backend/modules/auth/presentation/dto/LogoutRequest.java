package com.carelink.backend.modules.auth.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import jakarta.validation.constraints.NotBlank;

public record LogoutRequest(
        @Schema(description = "Refresh token of the session to end. Unknown tokens are accepted silently.")
        @NotBlank(message = "refreshToken is required") String refreshToken
) {
}
