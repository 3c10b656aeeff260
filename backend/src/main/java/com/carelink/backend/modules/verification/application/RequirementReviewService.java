package com.carelink.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.modules.verification.domain.RequirementStatus;
import com.carelink.backend.modules.verification.domain.VerificationRequirement;
import com.carelink.backend.modules.verification.infrastructure.persistence.VerificationRequirementRepository;
import com.carelink.backend.modules.verification.presentation.dto.RequirementResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin decisions on a single document. Each transition lists the states it may start from;
 * repeating a decision that is already in place is a no-op.
 */
@Service
@Transactional
public class RequirementReviewService {

    private static final Logger log = LoggerFactory.getLogger(RequirementReviewService.class);

    private static final Set<RequirementStatus> APPROVABLE = EnumSet.of(RequirementStatus.SUBMITTED, RequirementStatus.REJECTED);
    private static final Set<RequirementStatus> REJECTABLE = EnumSet.of(RequirementStatus.SUBMITTED, RequirementStatus.APPROVED);
    private static final Set<RequirementStatus> RESETTABLE = EnumSet.of(RequirementStatus.APPROVED, RequirementStatus.REJECTED);

    private final VerificationRequirementRepository requirementRepository;
    private final Clock clock;

    public RequirementReviewService(VerificationRequirementRepository requirementRepository, Clock clock) {
        this.requirementRepository = requirementRepository;
        this.clock = clock;
    }

    public RequirementResponse approve(UUID profileId, UUID requirementId, UUID adminId) {
        VerificationRequirement requirement = load(profileId, requirementId);
        if (requirement.getStatus() == RequirementStatus.APPROVED) {
            return RequirementResponse.from(requirement);
        }
        requireState(requirement, APPROVABLE, "approve");

        requirement.approve(adminId.toString(), OffsetDateTime.now(clock));
        log.info("Requirement {} of profile {} approved by {}", requirementId, profileId, adminId);
        return RequirementResponse.from(requirement);
    }

    public RequirementResponse reject(UUID profileId, UUID requirementId, UUID adminId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "REJECTION_REASON_REQUIRED", "A rejection reason is required");
        }
        VerificationRequirement requirement = load(profileId, requirementId);
        if (requirement.getStatus() == RequirementStatus.REJECTED) {
            return RequirementResponse.from(requirement);
        }
        requireState(requirement, REJECTABLE, "reject");

        requirement.reject(adminId.toString(), reason.trim(), OffsetDateTime.now(clock));
        log.info("Requirement {} of profile {} rejected by {}", requirementId, profileId, adminId);
        return RequirementResponse.from(requirement);
    }

    public RequirementResponse resetToReview(UUID profileId, UUID requirementId, UUID adminId) {
        VerificationRequirement requirement = load(profileId, requirementId);
        requireState(requirement, RESETTABLE, "reset");

        String timestamp = OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        requirement.resetToReview("[" + timestamp + "] Reset to review by " + adminId);
        return RequirementResponse.from(requirement);
    }

    public RequirementResponse updateExpiry(UUID profileId, UUID requirementId, OffsetDateTime expiresAt) {
        VerificationRequirement requirement = load(profileId, requirementId);
        requirement.setExpiresAt(expiresAt);
        return RequirementResponse.from(requirement);
    }

    private VerificationRequirement load(UUID profileId, UUID requirementId) {
        return requirementRepository.findByIdAndWorkerProfileId(requirementId, profileId)
                .orElseThrow(RequirementReviewService::requirementNotFound);
    }

    private static void requireState(VerificationRequirement requirement, Set<RequirementStatus> allowed, String transition) {
        if (!allowed.contains(requirement.getStatus())) {
            throw ProblemException.conflict("INVALID_REQUIREMENT_TRANSITION",
                    "Cannot " + transition + " a requirement in status " + requirement.getStatus());
        }
    }

    static ProblemException requirementNotFound() {
        return ProblemException.notFound("REQUIREMENT_NOT_FOUND", "Requirement not found");
    }
}
