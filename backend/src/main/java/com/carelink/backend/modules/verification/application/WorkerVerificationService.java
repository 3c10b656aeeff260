package com.carelink.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
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
import com.carelink.backend.modules.verification.domain.RequirementStatus;
import com.carelink.backend.modules.verification.domain.VerificationRequirement;
import com.carelink.backend.modules.verification.infrastructure.persistence.VerificationRequirementRepository;
import com.carelink.backend.modules.verification.presentation.dto.RequirementResponse;
import com.carelink.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.carelink.backend.modules.verification.presentation.dto.WorkerVerificationDetailResponse;
import com.carelink.backend.modules.verification.presentation.dto.WorkerVerificationSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin review of whole worker profiles: the queue, counts per status, and the final decision.
 */
@Service
@Transactional
public class WorkerVerificationService {

    private static final Logger log = LoggerFactory.getLogger(WorkerVerificationService.class);

    static final String DEFAULT_APPROVAL_NOTE = "Approved by admin";

    private final WorkerProfileRepository workerProfileRepository;
    private final VerificationRequirementRepository requirementRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public WorkerVerificationService(
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

    /**
     * Without a status: the review queue, oldest submission first. With one: that status, most recently changed first.
     */
    @Transactional(readOnly = true)
    public List<WorkerVerificationSummary> listWorkers(String status) {
        List<WorkerProfile> profiles = (status == null || status.isBlank())
                ? workerProfileRepository.findAwaitingReview()
                : workerProfileRepository.findByVerificationStatus(parseStatus(status));
        return profiles.stream().map(WorkerVerificationSummary::from).toList();
    }

    @Transactional(readOnly = true)
    public VerificationStatsResponse stats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (VerificationStatus status : VerificationStatus.values()) {
            counts.put(status.name(), 0L);
        }
        long total = 0;
        for (Object[] row : workerProfileRepository.countByVerificationStatus()) {
            VerificationStatus status = (VerificationStatus) row[0];
            long count = ((Number) row[1]).longValue();
            counts.put(status.name(), count);
            total += count;
        }
        return new VerificationStatsResponse(counts, total);
    }

    @Transactional(readOnly = true)
    public WorkerVerificationDetailResponse getWorker(UUID profileId) {
        WorkerProfile profile = loadProfile(profileId);
        List<RequirementResponse> requirements = requirementRepository.findByWorkerProfileIdOrderByCreatedAtDesc(profileId)
                .stream()
                .map(RequirementResponse::from)
                .toList();
        return new WorkerVerificationDetailResponse(WorkerVerificationSummary.from(profile), requirements);
    }

    public WorkerVerificationSummary approve(UUID profileId, UUID adminId, String notes, ClientRequestInfo client) {
        WorkerProfile profile = loadProfile(profileId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        String effectiveNotes = notes != null && !notes.isBlank() ? notes.trim() : DEFAULT_APPROVAL_NOTE;

        profile.setVerificationStatus(VerificationStatus.APPROVED);
        profile.setVerificationReviewedAt(now);
        profile.setVerificationApprovedAt(now);
        profile.setVerificationNotes(effectiveNotes);
        profile.setPublished(true);

        List<VerificationRequirement> submitted = requirementRepository.findByWorkerProfileIdAndStatus(profileId, RequirementStatus.SUBMITTED);
        submitted.forEach(requirement -> requirement.approve(adminId.toString(), now));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", "VERIFICATION_APPROVED");
        metadata.put("adminUserId", adminId.toString());
        metadata.put("notes", effectiveNotes);
        metadata.put("requirementsApproved", submitted.size());
        auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, profile.getUser().getId(), client, metadata));

        log.info("Worker profile {} approved by {} ({} document(s))", profileId, adminId, submitted.size());
        return WorkerVerificationSummary.from(profile);
    }

    public WorkerVerificationSummary reject(UUID profileId, UUID adminId, String reason, ClientRequestInfo client) {
        WorkerProfile profile = loadProfile(profileId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        String trimmedReason = reason.trim();

        profile.setVerificationStatus(VerificationStatus.REJECTED);
        profile.setVerificationReviewedAt(now);
        profile.setVerificationRejectedAt(now);
        profile.setVerificationNotes(trimmedReason);
        profile.setPublished(false);

        List<VerificationRequirement> submitted = requirementRepository.findByWorkerProfileIdAndStatus(profileId, RequirementStatus.SUBMITTED);
        submitted.forEach(requirement -> requirement.reject(adminId.toString(), trimmedReason, now));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", "VERIFICATION_REJECTED");
        metadata.put("adminUserId", adminId.toString());
        metadata.put("reason", trimmedReason);
        metadata.put("requirementsRejected", submitted.size());
        auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, profile.getUser().getId(), client, metadata));

        log.info("Worker profile {} rejected by {}", profileId, adminId);
        return WorkerVerificationSummary.from(profile);
    }

    /**
     * Lists or hides an approved worker in the directory. Only APPROVED profiles can be published;
     * hiding is always allowed.
     */
    public WorkerVerificationSummary updatePublished(UUID profileId, UUID adminId, boolean published, ClientRequestInfo client) {
        WorkerProfile profile = loadProfile(profileId);
        if (published && profile.getVerificationStatus() != VerificationStatus.APPROVED) {
            throw ProblemException.conflict("WORKER_NOT_APPROVED", "Only approved workers can be published");
        }
        if (profile.isPublished() == published) {
            return WorkerVerificationSummary.from(profile);
        }

        profile.setPublished(published);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", published ? "PROFILE_PUBLISHED" : "PROFILE_UNPUBLISHED");
        metadata.put("adminUserId", adminId.toString());
        auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, profile.getUser().getId(), client, metadata));

        log.info("Worker profile {} {} by {}", profileId, published ? "published" : "unpublished", adminId);
        return WorkerVerificationSummary.from(profile);
    }

    private WorkerProfile loadProfile(UUID profileId) {
        return workerProfileRepository.findWithUserById(profileId)
                .orElseThrow(() -> ProblemException.notFound("WORKER_PROFILE_NOT_FOUND", "Worker profile not found"));
    }

    private static VerificationStatus parseStatus(String raw) {
        try {
            return VerificationStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_VERIFICATION_STATUS",
                    "Unknown verification status: " + raw);
        }
    }
}
