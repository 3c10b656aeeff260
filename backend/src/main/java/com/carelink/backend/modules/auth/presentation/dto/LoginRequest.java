package com.carelink.backend.modules.auth.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotBlank(message = "password is required") String password,
        @Schema(description = "Stable id of the browser or app install. Required later to refresh the session.")
        @Size(max = 100) String deviceId
) {
}
