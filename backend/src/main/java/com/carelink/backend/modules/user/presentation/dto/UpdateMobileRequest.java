package com.carelink.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateMobileRequest(@NotBlank(message = "mobile is required") String mobile) {
}
