package com.carelink.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RoleChangeRequest(@NotBlank(message = "role is required") String role) {
}
