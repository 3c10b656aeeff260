package com.carelink.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SubmitRequirementRequest(
        @NotBlank(message = "requirementType is required") @Size(max = 64) String requirementType,
        @NotBlank(message = "documentUrl is required") @Size(max = 2048) String documentUrl,
        @Size(max = 255) String documentName,
        OffsetDateTime expiresAt
) {
}
