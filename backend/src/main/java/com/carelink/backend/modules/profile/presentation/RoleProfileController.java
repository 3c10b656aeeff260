package com.carelink.backend.modules.profile.presentation;

import com.carelink.backend.global.security.JwtAuthenticationPrincipal;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.profile.presentation.dto.ClientProfileResponse;
import com.carelink.backend.modules.profile.presentation.dto.CoordinatorProfileResponse;
import com.carelink.backend.modules.profile.presentation.dto.UpdateWorkerProfileRequest;
import com.carelink.backend.modules.profile.presentation.dto.WorkerProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RoleProfileController {

    private final ProfileService profileService;

    public RoleProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping("/workers/me/profile")
    public ResponseEntity<WorkerProfileResponse> getWorkerProfile(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(profileService.getWorkerProfile(principal.userId()));
    }

    @Operation(summary = "Update own worker profile", description = "Null fields are ignored; list fields are replaced.")
    @PatchMapping("/workers/me/profile")
    public ResponseEntity<WorkerProfileResponse> updateWorkerProfile(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdateWorkerProfileRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(profileService.updateWorkerProfile(principal.userId(), request, ClientRequestInfo.from(httpRequest)));
    }

    @GetMapping("/clients/me/profile")
    public ResponseEntity<ClientProfileResponse> getClientProfile(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(profileService.getClientProfile(principal.userId()));
    }

    @GetMapping("/coordinators/me/profile")
    public ResponseEntity<CoordinatorProfileResponse> getCoordinatorProfile(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(profileService.getCoordinatorProfile(principal.userId()));
    }
}
