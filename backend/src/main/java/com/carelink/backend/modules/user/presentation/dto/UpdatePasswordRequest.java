package com.carelink.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdatePasswordRequest(
        @NotBlank(message = "currentPassword is required") String currentPassword,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "confirmPassword is required") String confirmPassword
) {
}
