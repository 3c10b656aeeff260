package com.carelink.backend.modules.verification.presentation;

import java.util.List;
import java.util.UUID;

import com.carelink.backend.global.security.JwtAuthenticationPrincipal;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.verification.application.RequirementSubmissionService;
import com.carelink.backend.modules.verification.presentation.dto.RequirementResponse;
import com.carelink.backend.modules.verification.presentation.dto.SubmitRequirementRequest;
import com.carelink.backend.modules.verification.presentation.dto.VerificationStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/workers/me")
public class WorkerRequirementController {

    private final RequirementSubmissionService submissionService;

    public WorkerRequirementController(RequirementSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @GetMapping("/requirements")
    public ResponseEntity<List<RequirementResponse>> listRequirements(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "types", required = false) String types
    ) {
        return ResponseEntity.ok(submissionService.listRequirements(principal.userId(), types));
    }

    @Operation(summary = "Upload or replace a compliance document", description = "documentUrl points at an already uploaded file.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document stored and queued for review"),
            @ApiResponse(responseCode = "400", description = "INVALID_DOCUMENT_URL")
    })
    @PostMapping("/requirements")
    public ResponseEntity<RequirementResponse> submitRequirement(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SubmitRequirementRequest request
    ) {
        return ResponseEntity.ok(submissionService.submitRequirement(principal.userId(), request));
    }

    @DeleteMapping("/requirements/{requirementId}")
    public ResponseEntity<Void> deleteRequirement(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID requirementId
    ) {
        submissionService.deleteRequirement(principal.userId(), requirementId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Submit the profile for verification")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile is awaiting review"),
            @ApiResponse(responseCode = "400", description = "NO_SUBMITTED_REQUIREMENTS"),
            @ApiResponse(responseCode = "409", description = "VERIFICATION_ALREADY_SUBMITTED or VERIFICATION_ALREADY_APPROVED")
    })
    @PostMapping("/verification/submit")
    public ResponseEntity<VerificationStatusResponse> submitForReview(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(submissionService.submitForReview(principal.userId(), ClientRequestInfo.from(httpRequest)));
    }
}
