package com.carelink.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import io.swagger.v3.oas.annotations.media.Schema;

public record UserProfileResponse(
        UUID userId,
        String email,
        @Schema(allowableValues = {"WORKER", "CLIENT", "COORDINATOR", "ADMIN"})
        String role,
        @Schema(allowableValues = {"ACTIVE", "SUSPENDED", "LOCKED", "PENDING_VERIFICATION"})
        String status,
        boolean emailVerified,
        @Schema(description = "First and last name from the role profile, or the email local part when there is none")
        String displayName,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
