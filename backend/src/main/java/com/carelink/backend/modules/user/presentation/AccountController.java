package com.carelink.backend.modules.user.presentation;

import java.util.List;
import java.util.UUID;

import com.carelink.backend.global.security.JwtAuthenticationPrincipal;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.user.application.AccountService;
import com.carelink.backend.modules.user.application.LinkedAccountService;
import com.carelink.backend.modules.user.presentation.dto.LinkAccountRequest;
import com.carelink.backend.modules.user.presentation.dto.LinkedAccountResponse;
import com.carelink.backend.modules.user.presentation.dto.UpdateEmailRequest;
import com.carelink.backend.modules.user.presentation.dto.UpdateMobileRequest;
import com.carelink.backend.modules.user.presentation.dto.UpdatePasswordRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/account")
public class AccountController {

    private final AccountService accountService;
    private final LinkedAccountService linkedAccountService;

    public AccountController(AccountService accountService, LinkedAccountService linkedAccountService) {
        this.accountService = accountService;
        this.linkedAccountService = linkedAccountService;
    }

    @Operation(summary = "Change login email", description = "The new address must be verified again.")
    @PatchMapping("/email")
    public ResponseEntity<Void> updateEmail(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdateEmailRequest request,
            HttpServletRequest httpRequest
    ) {
        accountService.updateEmail(principal.userId(), request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Change password", description = "Signs out every other device.")
    @PatchMapping("/password")
    public ResponseEntity<Void> updatePassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdatePasswordRequest request,
            HttpServletRequest httpRequest
    ) {
        accountService.updatePassword(principal.userId(), request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/mobile")
    public ResponseEntity<Void> updateMobile(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdateMobileRequest request,
            HttpServletRequest httpRequest
    ) {
        accountService.updateMobile(principal.userId(), request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/linked-accounts")
    public ResponseEntity<List<LinkedAccountResponse>> linkedAccounts(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(linkedAccountService.list(principal.userId()));
    }

    @PostMapping("/linked-accounts")
    public ResponseEntity<LinkedAccountResponse> linkAccount(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody LinkAccountRequest request,
            HttpServletRequest httpRequest
    ) {
        LinkedAccountResponse response = linkedAccountService.link(principal.userId(), request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/linked-accounts/{accountId}")
    public ResponseEntity<Void> unlinkAccount(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID accountId,
            HttpServletRequest httpRequest
    ) {
        linkedAccountService.unlink(principal.userId(), accountId, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
