package com.carelink.backend.modules.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.verification.application.WorkerVerificationService;
import com.carelink.backend.modules.verification.domain.RequirementStatus;
import com.carelink.backend.modules.verification.domain.VerificationRequirement;
import com.carelink.backend.modules.verification.infrastructure.persistence.VerificationRequirementRepository;
import com.carelink.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.carelink.backend.modules.verification.presentation.dto.WorkerVerificationSummary;
import com.carelink.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class WorkerVerificationServiceTest {

    private static final UUID PROFILE_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");
    private static final UUID WORKER_ID = UUID.fromString("00000000-0000-0000-0000-000000000402");
    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Mock
    private WorkerProfileRepository workerProfileRepository;

    @Mock
    private VerificationRequirementRepository requirementRepository;

    @Mock
    private AuditLogService auditLogService;

    private Clock clock;
    private WorkerVerificationService verificationService;
    private WorkerProfile profile;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        verificationService = new WorkerVerificationService(workerProfileRepository, requirementRepository, auditLogService, clock);

        User worker = TestEntities.withId(new User(), WORKER_ID);
        worker.setEmail("worker@example.com");
        worker.setRole(UserRole.WORKER);

        profile = TestEntities.withId(new WorkerProfile(), PROFILE_ID);
        profile.setUser(worker);
        profile.setFirstName("Wendy");
        profile.setLastName("Walker");
        profile.setVerificationStatus(VerificationStatus.PENDING_REVIEW);
        profile.setVerificationSubmittedAt(OffsetDateTime.now(clock).minusDays(2));

        lenient().when(workerProfileRepository.findWithUserById(PROFILE_ID)).thenReturn(Optional.of(profile));
    }

    @Test
    void approvePublishesProfileAndApprovesSubmittedDocuments() {
        VerificationRequirement police = submittedRequirement("police-check");
        VerificationRequirement wwcc = submittedRequirement("working-with-children");
        when(requirementRepository.findByWorkerProfileIdAndStatus(PROFILE_ID, RequirementStatus.SUBMITTED))
                .thenReturn(List.of(police, wwcc));

        WorkerVerificationSummary summary = verificationService.approve(PROFILE_ID, ADMIN_ID, null, ClientRequestInfo.UNKNOWN);

        assertThat(summary.verificationStatus()).isEqualTo("APPROVED");
        assertThat(summary.published()).isTrue();
        assertThat(summary.verificationNotes()).isEqualTo("Approved by admin");
        assertThat(profile.getVerificationApprovedAt()).isEqualTo(OffsetDateTime.now(clock));
        assertThat(police.getStatus()).isEqualTo(RequirementStatus.APPROVED);
        assertThat(wwcc.getStatus()).isEqualTo(RequirementStatus.APPROVED);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.PROFILE_UPDATE);
        assertThat(captor.getValue().userId()).isEqualTo(WORKER_ID);
        assertThat(captor.getValue().metadata())
                .containsEntry("action", "VERIFICATION_APPROVED")
                .containsEntry("requirementsApproved", 2);
    }

    @Test
    void rejectHidesProfileAndRejectsSubmittedDocuments() {
        profile.setPublished(true);
        VerificationRequirement police = submittedRequirement("police-check");
        when(requirementRepository.findByWorkerProfileIdAndStatus(PROFILE_ID, RequirementStatus.SUBMITTED))
                .thenReturn(List.of(police));

        WorkerVerificationSummary summary = verificationService.reject(PROFILE_ID, ADMIN_ID, " Missing ID ", ClientRequestInfo.UNKNOWN);

        assertThat(summary.verificationStatus()).isEqualTo("REJECTED");
        assertThat(summary.published()).isFalse();
        assertThat(summary.verificationNotes()).isEqualTo("Missing ID");
        assertThat(police.getStatus()).isEqualTo(RequirementStatus.REJECTED);
        assertThat(police.getRejectionReason()).isEqualTo("Missing ID");
    }

    @Test
    void unknownProfileIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(workerProfileRepository.findWithUserById(unknown)).thenReturn(Optional.empty());

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> verificationService.approve(unknown, ADMIN_ID, "ok", ClientRequestInfo.UNKNOWN));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(exception.getReason()).isEqualTo("WORKER_PROFILE_NOT_FOUND");
        verify(auditLogService, never()).record(any());
    }

    @Test
    void listWithoutStatusReturnsReviewQueue() {
        when(workerProfileRepository.findAwaitingReview()).thenReturn(List.of(profile));

        List<WorkerVerificationSummary> queue = verificationService.listWorkers(null);

        assertThat(queue).extracting(WorkerVerificationSummary::email).containsExactly("worker@example.com");
    }

    @Test
    void listWithUnknownStatusIsRejected() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> verificationService.listWorkers("maybe"));

        assertThat(exception.getReason()).isEqualTo("INVALID_VERIFICATION_STATUS");
    }

    @Test
    void statsIncludeEveryStatus() {
        when(workerProfileRepository.countByVerificationStatus()).thenReturn(List.of(
                new Object[]{VerificationStatus.PENDING_REVIEW, 3L},
                new Object[]{VerificationStatus.APPROVED, 7L}
        ));

        VerificationStatsResponse stats = verificationService.stats();

        assertThat(stats.total()).isEqualTo(10L);
        assertThat(stats.byStatus())
                .containsEntry("PENDING_REVIEW", 3L)
                .containsEntry("APPROVED", 7L)
                .containsEntry("NOT_STARTED", 0L)
                .containsEntry("REJECTED", 0L)
                .hasSize(VerificationStatus.values().length);
    }

    @Test
    void publishingApprovedWorkerIsAudited() {
        profile.setVerificationStatus(VerificationStatus.APPROVED);

        WorkerVerificationSummary summary = verificationService.updatePublished(PROFILE_ID, ADMIN_ID, true, ClientRequestInfo.UNKNOWN);

        assertThat(summary.published()).isTrue();
        assertThat(profile.isPublished()).isTrue();
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.PROFILE_UPDATE);
        assertThat(captor.getValue().userId()).isEqualTo(WORKER_ID);
        assertThat(captor.getValue().metadata())
                .containsEntry("action", "PROFILE_PUBLISHED")
                .containsEntry("adminUserId", ADMIN_ID.toString());
    }

    @Test
    void publishingUnapprovedWorkerIsConflict() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> verificationService.updatePublished(PROFILE_ID, ADMIN_ID, true, ClientRequestInfo.UNKNOWN));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(exception.getReason()).isEqualTo("WORKER_NOT_APPROVED");
        assertThat(profile.isPublished()).isFalse();
        verify(auditLogService, never()).record(any());
    }

    @Test
    void unpublishingIsAllowedInAnyStatusAndRepeatsAreSilent() {
        profile.setPublished(true);

        verificationService.updatePublished(PROFILE_ID, ADMIN_ID, false, ClientRequestInfo.UNKNOWN);
        verificationService.updatePublished(PROFILE_ID, ADMIN_ID, false, ClientRequestInfo.UNKNOWN);

        assertThat(profile.isPublished()).isFalse();
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().metadata()).containsEntry("action", "PROFILE_UNPUBLISHED");
    }

    private VerificationRequirement submittedRequirement(String type) {
        VerificationRequirement requirement = TestEntities.withId(new VerificationRequirement(), UUID.randomUUID());
        requirement.setWorkerProfile(profile);
        requirement.setRequirementType(type);
        requirement.setRequirementName(type);
        requirement.submitDocument("https://files.example/" + type + ".pdf", OffsetDateTime.now(clock).minusDays(2), null);
        return requirement;
    }
}
