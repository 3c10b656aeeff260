package com.carelink.backend.modules.verification.presentation;

import java.util.List;
import java.util.UUID;

import com.carelink.backend.global.security.SecurityUtils;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.verification.application.RequirementReviewService;
import com.carelink.backend.modules.verification.application.WorkerVerificationService;
import com.carelink.backend.modules.verification.presentation.dto.ApproveWorkerRequest;
import com.carelink.backend.modules.verification.presentation.dto.RejectRequirementRequest;
import com.carelink.backend.modules.verification.presentation.dto.RejectWorkerRequest;
import com.carelink.backend.modules.verification.presentation.dto.RequirementResponse;
import com.carelink.backend.modules.verification.presentation.dto.UpdatePublishStatusRequest;
import com.carelink.backend.modules.verification.presentation.dto.UpdateRequirementExpiryRequest;
import com.carelink.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.carelink.backend.modules.verification.presentation.dto.WorkerVerificationDetailResponse;
import com.carelink.backend.modules.verification.presentation.dto.WorkerVerificationSummary;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/verification")
public class AdminVerificationController {

    private final WorkerVerificationService workerVerificationService;
    private final RequirementReviewService requirementReviewService;

    public AdminVerificationController(
            WorkerVerificationService workerVerificationService,
            RequirementReviewService requirementReviewService
    ) {
        this.workerVerificationService = workerVerificationService;
        this.requirementReviewService = requirementReviewService;
    }

    @Operation(summary = "List workers for review", description = "Without status: the pending queue, oldest first.")
    @GetMapping("/workers")
    public ResponseEntity<List<WorkerVerificationSummary>> listWorkers(
            @RequestParam(name = "status", required = false) String status
    ) {
        return ResponseEntity.ok(workerVerificationService.listWorkers(status));
    }

    @GetMapping("/stats")
    public ResponseEntity<VerificationStatsResponse> stats() {
        return ResponseEntity.ok(workerVerificationService.stats());
    }

    @GetMapping("/workers/{profileId}")
    public ResponseEntity<WorkerVerificationDetailResponse> getWorker(@PathVariable UUID profileId) {
        return ResponseEntity.ok(workerVerificationService.getWorker(profileId));
    }

    @PostMapping("/workers/{profileId}/approve")
    public ResponseEntity<WorkerVerificationSummary> approveWorker(
            @PathVariable UUID profileId,
            @Valid @RequestBody(required = false) ApproveWorkerRequest request,
            HttpServletRequest httpRequest
    ) {
        String notes = request != null ? request.notes() : null;
        return ResponseEntity.ok(workerVerificationService.approve(
                profileId, SecurityUtils.getCurrentUserId(), notes, ClientRequestInfo.from(httpRequest)));
    }

    @PostMapping("/workers/{profileId}/reject")
    public ResponseEntity<WorkerVerificationSummary> rejectWorker(
            @PathVariable UUID profileId,
            @Valid @RequestBody RejectWorkerRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(workerVerificationService.reject(
                profileId, SecurityUtils.getCurrentUserId(), request.reason(), ClientRequestInfo.from(httpRequest)));
    }

    @Operation(summary = "List or hide an approved worker in the directory")
    @PatchMapping("/workers/{profileId}/publish")
    public ResponseEntity<WorkerVerificationSummary> updatePublished(
            @PathVariable UUID profileId,
            @Valid @RequestBody UpdatePublishStatusRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(workerVerificationService.updatePublished(
                profileId, SecurityUtils.getCurrentUserId(), request.isPublished(), ClientRequestInfo.from(httpRequest)));
    }

    @PostMapping("/workers/{profileId}/requirements/{requirementId}/approve")
    public ResponseEntity<RequirementResponse> approveRequirement(
            @PathVariable UUID profileId,
            @PathVariable UUID requirementId
    ) {
        return ResponseEntity.ok(requirementReviewService.approve(profileId, requirementId, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/workers/{profileId}/requirements/{requirementId}/reject")
    public ResponseEntity<RequirementResponse> rejectRequirement(
            @PathVariable UUID profileId,
            @PathVariable UUID requirementId,
            @Valid @RequestBody RejectRequirementRequest request
    ) {
        return ResponseEntity.ok(requirementReviewService.reject(
                profileId, requirementId, SecurityUtils.getCurrentUserId(), request.rejectionReason()));
    }

    @PostMapping("/workers/{profileId}/requirements/{requirementId}/reset")
    public ResponseEntity<RequirementResponse> resetRequirement(
            @PathVariable UUID profileId,
            @PathVariable UUID requirementId
    ) {
        return ResponseEntity.ok(requirementReviewService.resetToReview(profileId, requirementId, SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/workers/{profileId}/requirements/{requirementId}/expiry")
    public ResponseEntity<RequirementResponse> updateRequirementExpiry(
            @PathVariable UUID profileId,
            @PathVariable UUID requirementId,
            @RequestBody UpdateRequirementExpiryRequest request
    ) {
        return ResponseEntity.ok(requirementReviewService.updateExpiry(profileId, requirementId, request.expiresAt()));
    }
}
