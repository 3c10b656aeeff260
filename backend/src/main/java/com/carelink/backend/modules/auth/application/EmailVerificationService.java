package com.carelink.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.mail.MailNotifier;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.VerificationToken;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.VerificationTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class EmailVerificationService {

    private static final Logger log = LoggerFactory.getLogger(EmailVerificationService.class);

    static final Duration TOKEN_TTL = Duration.ofHours(24);

    private final VerificationTokenRepository verificationTokenRepository;
    private final UserRepository userRepository;
    private final MailNotifier mailNotifier;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public EmailVerificationService(
            VerificationTokenRepository verificationTokenRepository,
            UserRepository userRepository,
            MailNotifier mailNotifier,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.verificationTokenRepository = verificationTokenRepository;
        this.userRepository = userRepository;
        this.mailNotifier = mailNotifier;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Replaces any outstanding token for the address and returns the raw value to be mailed.
     */
    public String issueToken(String email) {
        String identifier = AuthService.normalizeEmail(email);
        verificationTokenRepository.deleteAllByIdentifier(identifier);

        String token = SecureTokens.randomHex();
        OffsetDateTime expires = OffsetDateTime.now(clock).plus(TOKEN_TTL);
        verificationTokenRepository.save(new VerificationToken(identifier, SecureTokens.sha256Hex(token), expires));
        return token;
    }

    public void sendVerification(User user) {
        String token = issueToken(user.getEmail());
        if (!mailNotifier.sendEmailVerification(user.getEmail(), token)) {
            log.warn("Verification email for user {} could not be delivered", user.getId());
        }
    }

    public void verify(String rawEmail, String token, ClientRequestInfo client) {
        String identifier = AuthService.normalizeEmail(rawEmail);
        OffsetDateTime now = OffsetDateTime.now(clock);

        VerificationToken stored = verificationTokenRepository.findByIdentifierAndToken(identifier, SecureTokens.sha256Hex(token))
                .orElseThrow(this::invalidToken);

        if (stored.isExpiredAt(now)) {
            verificationTokenRepository.delete(stored);
            throw invalidToken();
        }

        User user = userRepository.findByEmailIgnoreCase(identifier).orElseThrow(this::invalidToken);
        if (!user.isEmailVerified()) {
            user.setEmailVerifiedAt(now);
        }
        if (user.getStatus() == AccountStatus.PENDING_VERIFICATION) {
            user.setStatus(AccountStatus.ACTIVE);
        }
        userRepository.save(user);
        verificationTokenRepository.delete(stored);

        auditLogService.record(AuditLogCommand.of(AuditAction.EMAIL_VERIFIED, user.getId(), client, Map.of("email", identifier)));
    }

    /**
     * Sends a fresh link to an existing, unverified account. Silent otherwise.
     */
    public void resend(String rawEmail) {
        userRepository.findByEmailIgnoreCase(AuthService.normalizeEmail(rawEmail))
                .filter(user -> !user.isEmailVerified())
                .ifPresent(this::sendVerification);
    }

    private ProblemException invalidToken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_VERIFICATION_TOKEN",
                "Verification link is invalid or has expired");
    }
}
