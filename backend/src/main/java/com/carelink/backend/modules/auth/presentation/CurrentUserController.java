package com.carelink.backend.modules.auth.presentation;

import com.carelink.backend.global.security.SecurityUtils;
import com.carelink.backend.modules.auth.application.AuthService;
import com.carelink.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CurrentUserController {

    private final AuthService authService;

    public CurrentUserController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Signed-in user", description = "Account view with the display name taken from the role profile.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current user"),
            @ApiResponse(responseCode = "401", description = "AUTHENTICATION_REQUIRED or INVALID_ACCESS_TOKEN")
    })
    @GetMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> currentUser() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }
}
