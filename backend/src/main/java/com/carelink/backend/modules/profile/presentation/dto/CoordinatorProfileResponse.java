package com.carelink.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CoordinatorProfileResponse(
        UUID id,
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String mobile,
        String organization,
        String location,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
