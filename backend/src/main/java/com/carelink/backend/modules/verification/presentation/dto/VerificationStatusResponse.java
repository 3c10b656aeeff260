package com.carelink.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record VerificationStatusResponse(UUID profileId, String verificationStatus, OffsetDateTime submittedAt) {
}
