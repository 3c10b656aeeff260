package com.carelink.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ClientProfileResponse(
        UUID id,
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String mobile,
        String location,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
