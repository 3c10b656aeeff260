package com.carelink.backend.modules.auth.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "Rotates a refresh session. A device id that is missing or differs from the one used at login revokes the session.")
public record RefreshRequest(
        @NotBlank(message = "refreshToken is required") String refreshToken,
        @Size(max = 100) String deviceId
) {
}
