package com.carelink.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.WorkerProfile;

public record WorkerVerificationSummary(
        UUID profileId,
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String verificationStatus,
        boolean published,
        OffsetDateTime verificationSubmittedAt,
        OffsetDateTime verificationReviewedAt,
        String verificationNotes
) {

    public static WorkerVerificationSummary from(WorkerProfile profile) {
        return new WorkerVerificationSummary(
                profile.getId(),
                profile.getUser().getId(),
                profile.getUser().getEmail(),
                profile.getFirstName(),
                profile.getLastName(),
                profile.getVerificationStatus().name(),
                profile.isPublished(),
                profile.getVerificationSubmittedAt(),
                profile.getVerificationReviewedAt(),
                profile.getVerificationNotes()
        );
    }
}
