package com.carelink.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.carelink.backend.modules.verification.domain.VerificationRequirement;

public record RequirementResponse(
        UUID id,
        String requirementType,
        String requirementName,
        String documentCategory,
        boolean required,
        String status,
        String documentUrl,
        OffsetDateTime documentUploadedAt,
        OffsetDateTime submittedAt,
        OffsetDateTime reviewedAt,
        String reviewedBy,
        OffsetDateTime approvedAt,
        OffsetDateTime rejectedAt,
        OffsetDateTime expiresAt,
        String notes,
        String rejectionReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RequirementResponse from(VerificationRequirement requirement) {
        return new RequirementResponse(
                requirement.getId(),
                requirement.getRequirementType(),
                requirement.getRequirementName(),
                requirement.getDocumentCategory() != null ? requirement.getDocumentCategory().name() : null,
                requirement.isRequired(),
                requirement.getStatus().name(),
                requirement.getDocumentUrl(),
                requirement.getDocumentUploadedAt(),
                requirement.getSubmittedAt(),
                requirement.getReviewedAt(),
                requirement.getReviewedBy(),
                requirement.getApprovedAt(),
                requirement.getRejectedAt(),
                requirement.getExpiresAt(),
                requirement.getNotes(),
                requirement.getRejectionReason(),
                requirement.getCreatedAt(),
                requirement.getUpdatedAt()
        );
    }
}
