package com.carelink.backend.modules.auth.presentation;

import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.auth.application.AuthService;
import com.carelink.backend.modules.auth.application.EmailVerificationService;
import com.carelink.backend.modules.auth.application.PasswordResetService;
import com.carelink.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.carelink.backend.modules.auth.presentation.dto.LoginRequest;
import com.carelink.backend.modules.auth.presentation.dto.LoginResponse;
import com.carelink.backend.modules.auth.presentation.dto.LogoutRequest;
import com.carelink.backend.modules.auth.presentation.dto.MessageResponse;
import com.carelink.backend.modules.auth.presentation.dto.RefreshRequest;
import com.carelink.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.carelink.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.carelink.backend.modules.auth.presentation.dto.SetupPasswordRequest;
import com.carelink.backend.modules.auth.presentation.dto.VerifyEmailRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    static final String RESET_REQUESTED_MESSAGE = "If an account exists for that email, a reset link has been sent.";
    static final String VERIFICATION_RESENT_MESSAGE = "If the account still needs verification, a new link has been sent.";

    private final AuthService authService;
    private final PasswordResetService passwordResetService;
    private final EmailVerificationService emailVerificationService;

    public AuthController(
            AuthService authService,
            PasswordResetService passwordResetService,
            EmailVerificationService emailVerificationService
    ) {
        this.authService = authService;
        this.passwordResetService = passwordResetService;
        this.emailVerificationService = emailVerificationService;
    }

    @Operation(summary = "Log in with email and password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token pair issued"),
            @ApiResponse(responseCode = "401", description = "INVALID_CREDENTIALS"),
            @ApiResponse(responseCode = "403", description = "Account not active"),
            @ApiResponse(responseCode = "423", description = "ACCOUNT_LOCKED, see Retry-After")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientRequestInfo.from(httpRequest)));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request, ClientRequestInfo.from(httpRequest)));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request, HttpServletRequest httpRequest) {
        authService.logout(request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Request a password reset link", description = "Always answers 202 so account existence is not revealed.")
    @PostMapping("/auth/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(
            @Valid @RequestBody ForgotPasswordRequest request,
            HttpServletRequest httpRequest
    ) {
        passwordResetService.requestReset(request.email(), ClientRequestInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(RESET_REQUESTED_MESSAGE));
    }

    @PostMapping("/auth/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(
            @Valid @RequestBody ResetPasswordRequest request,
            HttpServletRequest httpRequest
    ) {
        passwordResetService.resetPassword(request.token(), request.password(), ClientRequestInfo.from(httpRequest));
        return ResponseEntity.ok(new MessageResponse("Password has been reset."));
    }

    @Operation(summary = "Replace the default password of an imported worker account")
    @PostMapping("/auth/setup-password")
    public ResponseEntity<MessageResponse> setupPassword(
            @Valid @RequestBody SetupPasswordRequest request,
            HttpServletRequest httpRequest
    ) {
        passwordResetService.setupPassword(request.email(), request.password(), ClientRequestInfo.from(httpRequest));
        return ResponseEntity.ok(new MessageResponse("Password has been set."));
    }

    @PostMapping("/auth/verify-email")
    public ResponseEntity<MessageResponse> verifyEmail(
            @Valid @RequestBody VerifyEmailRequest request,
            HttpServletRequest httpRequest
    ) {
        emailVerificationService.verify(request.email(), request.token(), ClientRequestInfo.from(httpRequest));
        return ResponseEntity.ok(new MessageResponse("Email verified."));
    }

    @PostMapping("/auth/verify-email/resend")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody ResendVerificationRequest request) {
        emailVerificationService.resend(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(VERIFICATION_RESENT_MESSAGE));
    }
}
