package com.carelink.backend.modules.user.application;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.user.domain.Account;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.infrastructure.persistence.AccountRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.presentation.dto.LinkAccountRequest;
import com.carelink.backend.modules.user.presentation.dto.LinkedAccountResponse;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * External OAuth identities attached to a CareLink login.
 */
@Service
@Transactional
public class LinkedAccountService {

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final AuditLogService auditLogService;

    public LinkedAccountService(
            AccountRepository accountRepository,
            UserRepository userRepository,
            AuditLogService auditLogService
    ) {
        this.accountRepository = accountRepository;
        this.userRepository = userRepository;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<LinkedAccountResponse> list(UUID userId) {
        return accountRepository.findByUserIdOrderByProviderAsc(userId).stream()
                .map(LinkedAccountResponse::from)
                .toList();
    }

    public LinkedAccountResponse link(UUID userId, LinkAccountRequest request, ClientRequestInfo client) {
        String provider = request.provider().trim().toLowerCase(Locale.ROOT);
        String providerAccountId = request.providerAccountId().trim();
        if (accountRepository.existsByProviderAndProviderAccountId(provider, providerAccountId)) {
            throw alreadyLinked(provider);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));

        Account account = new Account();
        account.setUser(user);
        account.setProvider(provider);
        account.setProviderAccountId(providerAccountId);
        account.setType(request.type().trim());
        account.setAccessToken(request.accessToken());
        account.setRefreshToken(request.refreshToken());
        account.setExpiresAt(request.expiresAt());
        account.setTokenType(request.tokenType());
        account.setScope(request.scope());
        account.setIdToken(request.idToken());
        Account saved;
        try {
            saved = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            // concurrent link of the same identity
            throw alreadyLinked(provider);
        }

        auditLogService.record(AuditLogCommand.of(AuditAction.ACCOUNT_LINKED, userId, client,
                Map.of("provider", provider)));
        return LinkedAccountResponse.from(saved);
    }

    public void unlink(UUID userId, UUID accountId, ClientRequestInfo client) {
        Account account = accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> ProblemException.notFound("LINKED_ACCOUNT_NOT_FOUND",
                        "Linked account not found"));
        accountRepository.delete(account);

        auditLogService.record(AuditLogCommand.of(AuditAction.ACCOUNT_UNLINKED, userId, client,
                Map.of("provider", account.getProvider())));
    }

    private static ProblemException alreadyLinked(String provider) {
        return ProblemException.conflict("ACCOUNT_ALREADY_LINKED", "This " + provider + " account is already linked");
    }
}
