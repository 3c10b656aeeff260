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
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.PasswordPolicy;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Forgotten-password links and the one-time setup of imported worker accounts.
 * Only the SHA-256 digest of a reset token is stored; the raw token exists solely in the emailed link.
 */
@Service
@Transactional
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    static final Duration RESET_TOKEN_TTL = Duration.ofHours(1);
    static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final MailNotifier mailNotifier;
    private final ProfileService profileService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String defaultWorkerPassword;

    public PasswordResetService(
            UserRepository userRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            MailNotifier mailNotifier,
            ProfileService profileService,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${auth.default-worker-password:WelcomeRemonta}") String defaultWorkerPassword
    ) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.mailNotifier = mailNotifier;
        this.profileService = profileService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.defaultWorkerPassword = defaultWorkerPassword;
    }

    /**
     * Issues a reset link when the address belongs to an account. Callers answer identically either way.
     */
    public void requestReset(String rawEmail, ClientRequestInfo client) {
        String email = AuthService.normalizeEmail(rawEmail);
        User user = userRepository.findByEmailIgnoreCase(email).orElse(null);
        if (user == null) {
            log.debug("Password reset requested for unknown address");
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = SecureTokens.randomHex();
        user.assignResetPasswordToken(SecureTokens.sha256Hex(token), now.plus(RESET_TOKEN_TTL));
        userRepository.save(user);

        boolean delivered = mailNotifier.sendPasswordResetLink(user.getEmail(), profileService.findFirstName(user), token);
        if (!delivered) {
            log.warn("Password reset email for user {} could not be delivered", user.getId());
        }

        auditLogService.record(AuditLogCommand.of(AuditAction.PASSWORD_RESET_REQUEST, user.getId(), client,
                Map.of("emailDelivered", delivered)));
    }

    public void resetPassword(String token, String newPassword, ClientRequestInfo client) {
        PasswordPolicy.requireStrong(newPassword);

        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = userRepository.findByValidResetToken(SecureTokens.sha256Hex(token), now)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_RESET_TOKEN",
                        "Reset link is invalid or has expired"));

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.clearResetPasswordToken();
        user.clearLockout();
        userRepository.save(user);

        int revoked = userSessionRepository.revokeAllForUser(user.getId(), now, REASON_PASSWORD_RESET);
        log.info("Password reset for user {}, revoked {} session(s)", user.getId(), revoked);

        auditLogService.record(AuditLogCommand.of(AuditAction.PASSWORD_RESET_SUCCESS, user.getId(), client,
                Map.of("resetMethod", "email_link")));
    }

    /**
     * Replaces the shared default password of an imported worker account.
     */
    public void setupPassword(String rawEmail, String newPassword, ClientRequestInfo client) {
        PasswordPolicy.requireStrong(newPassword);

        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = userRepository.findByEmailIgnoreCase(AuthService.normalizeEmail(rawEmail))
                .filter(candidate -> candidate.getRole() == UserRole.WORKER)
                .filter(candidate -> candidate.getStatus() == AccountStatus.ACTIVE)
                .filter(candidate -> !candidate.isLockedAt(now))
                .filter(candidate -> candidate.getPasswordHash() != null
                        && passwordEncoder.matches(defaultWorkerPassword, candidate.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "PASSWORD_SETUP_NOT_ALLOWED",
                        "Password setup is not available for this account"));

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.clearLockout();
        userRepository.save(user);

        auditLogService.record(AuditLogCommand.of(AuditAction.PASSWORD_RESET_SUCCESS, user.getId(), client,
                Map.of("setupType", "initial_password_setup")));
    }
}
