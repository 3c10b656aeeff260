package com.carelink.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record AdminUsersResponse(
        List<User> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {

    public record User(
            UUID id,
            String email,
            String role,
            String status,
            boolean emailVerified,
            int failedLoginAttempts,
            OffsetDateTime accountLockedUntil,
            OffsetDateTime lastLoginAt,
            OffsetDateTime createdAt
    ) {
    }
}
