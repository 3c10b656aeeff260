package com.carelink.backend.modules.verification.application;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.verification.domain.DocumentCatalog;
import com.carelink.backend.modules.verification.domain.DocumentCatalog.DocumentDefinition;
import com.carelink.backend.modules.verification.domain.RequirementStatus;
import com.carelink.backend.modules.verification.domain.VerificationRequirement;
import com.carelink.backend.modules.verification.infrastructure.persistence.VerificationRequirementRepository;
import com.carelink.backend.modules.verification.presentation.dto.RequirementResponse;
import com.carelink.backend.modules.verification.presentation.dto.SubmitRequirementRequest;
import com.carelink.backend.modules.verification.presentation.dto.VerificationStatusResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Worker side of verification: uploading compliance documents and asking for review.
 */
@Service
@Transactional
public class RequirementSubmissionService {

    private final WorkerProfileRepository workerProfileRepository;
    private final VerificationRequirementRepository requirementRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RequirementSubmissionService(
            WorkerProfileRepository workerProfileRepository,
            VerificationRequirementRepository requirementRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.workerProfileRepository = workerProfileRepository;
        this.requirementRepository = requirementRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<RequirementResponse> listRequirements(UUID userId, String types) {
        WorkerProfile profile = loadProfile(userId);
        List<String> requested = parseTypes(types);
        List<VerificationRequirement> requirements = requested.isEmpty()
                ? requirementRepository.findByWorkerProfileIdOrderByCreatedAtDesc(profile.getId())
                : requirementRepository.findByWorkerProfileIdAndRequirementTypeInOrderByCreatedAtDesc(profile.getId(), requested);
        return requirements.stream().map(RequirementResponse::from).toList();
    }

    /**
     * Creates or replaces the document for a requirement type. Any submission puts the profile into the review queue.
     */
    public RequirementResponse submitRequirement(UUID userId, SubmitRequirementRequest request) {
        WorkerProfile profile = loadProfile(userId);
        String documentUrl = requireHttpUrl(request.documentUrl());
        String requirementType = request.requirementType().trim();
        OffsetDateTime now = OffsetDateTime.now(clock);

        VerificationRequirement requirement = requirementRepository
                .findByWorkerProfileIdAndRequirementType(profile.getId(), requirementType)
                .orElseGet(() -> newRequirement(profile, requirementType, request.documentName()));
        requirement.submitDocument(documentUrl, now, request.expiresAt());
        VerificationRequirement saved = requirementRepository.save(requirement);

        if (profile.getVerificationStatus() != VerificationStatus.PENDING_REVIEW) {
            profile.setVerificationStatus(VerificationStatus.PENDING_REVIEW);
            profile.setVerificationSubmittedAt(now);
        }
        return RequirementResponse.from(saved);
    }

    public void deleteRequirement(UUID userId, UUID requirementId) {
        WorkerProfile profile = loadProfile(userId);
        VerificationRequirement requirement = requirementRepository.findByIdAndWorkerProfileId(requirementId, profile.getId())
                .orElseThrow(RequirementReviewService::requirementNotFound);
        requirementRepository.delete(requirement);
    }

    public VerificationStatusResponse submitForReview(UUID userId, ClientRequestInfo client) {
        WorkerProfile profile = loadProfile(userId);
        VerificationStatus status = profile.getVerificationStatus();
        if (!status.canSubmitForReview()) {
            throw status == VerificationStatus.APPROVED
                    ? ProblemException.conflict("VERIFICATION_ALREADY_APPROVED",
                            "Verification has already been approved")
                    : ProblemException.conflict("VERIFICATION_ALREADY_SUBMITTED",
                            "Verification is already awaiting review");
        }
        if (!requirementRepository.existsByWorkerProfileIdAndStatus(profile.getId(), RequirementStatus.SUBMITTED)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "NO_SUBMITTED_REQUIREMENTS",
                    "Upload at least one document before submitting for verification");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        profile.setVerificationStatus(VerificationStatus.PENDING_REVIEW);
        profile.setVerificationSubmittedAt(now);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", "SUBMITTED_FOR_VERIFICATION");
        metadata.put("profileId", profile.getId().toString());
        auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, userId, client, metadata));

        return new VerificationStatusResponse(profile.getId(), profile.getVerificationStatus().name(), now);
    }

    private VerificationRequirement newRequirement(WorkerProfile profile, String requirementType, String documentName) {
        DocumentDefinition definition = DocumentCatalog.resolve(requirementType, documentName);
        VerificationRequirement requirement = new VerificationRequirement();
        requirement.setWorkerProfile(profile);
        requirement.setRequirementType(requirementType);
        requirement.setRequirementName(definition.name());
        requirement.setDocumentCategory(definition.category());
        requirement.setRequired(definition.required());
        return requirement;
    }

    private WorkerProfile loadProfile(UUID userId) {
        return workerProfileRepository.findByUserId(userId)
                .orElseThrow(() -> ProblemException.notFound("WORKER_PROFILE_NOT_FOUND", "Worker profile not found"));
    }

    static String requireHttpUrl(String raw) {
        String candidate = raw == null ? "" : raw.trim();
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null) {
                return candidate;
            }
        } catch (URISyntaxException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_DOCUMENT_URL", "documentUrl is not a valid URL");
        }
        throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_DOCUMENT_URL", "documentUrl must be an http(s) URL");
    }

    private static List<String> parseTypes(String types) {
        if (types == null || types.isBlank()) {
            return List.of();
        }
        return Arrays.stream(types.split(","))
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .distinct()
                .toList();
    }
}
