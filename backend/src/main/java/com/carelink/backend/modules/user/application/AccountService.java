package com.carelink.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.auth.application.EmailVerificationService;
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.user.domain.PasswordPolicy;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;
import com.carelink.backend.modules.user.presentation.dto.UpdateEmailRequest;
import com.carelink.backend.modules.user.presentation.dto.UpdateMobileRequest;
import com.carelink.backend.modules.user.presentation.dto.UpdatePasswordRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String REASON_PASSWORD_CHANGE = "PASSWORD_CHANGE";

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final EmailVerificationService emailVerificationService;
    private final ProfileService profileService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AccountService(
            UserRepository userRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            EmailVerificationService emailVerificationService,
            ProfileService profileService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.emailVerificationService = emailVerificationService;
        this.profileService = profileService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Moves the login to a new address. The new address starts unverified and receives a fresh link.
     */
    public void updateEmail(UUID userId, UpdateEmailRequest request, ClientRequestInfo client) {
        User user = loadUser(userId);
        String newEmail = RegistrationService.normalizeEmail(request.email());
        String previous = user.getEmail();
        if (newEmail.equals(previous)) {
            return;
        }

        userRepository.findByEmailIgnoreCase(newEmail)
                .filter(other -> !other.getId().equals(userId))
                .ifPresent(other -> {
                    throw RegistrationService.emailTaken();
                });

        user.setEmail(newEmail);
        user.setEmailVerifiedAt(null);
        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw RegistrationService.emailTaken();
        }

        emailVerificationService.sendVerification(user);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", previous);
        metadata.put("to", newEmail);
        auditLogService.record(AuditLogCommand.of(AuditAction.EMAIL_CHANGE, userId, client, metadata));
    }

    public void updatePassword(UUID userId, UpdatePasswordRequest request, ClientRequestInfo client) {
        User user = loadUser(userId);
        if (user.getPasswordHash() == null || !passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_CURRENT_PASSWORD", "Current password is incorrect");
        }
        if (!request.password().equals(request.confirmPassword())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "PASSWORD_CONFIRMATION_MISMATCH", "Passwords do not match");
        }
        PasswordPolicy.requireStrong(request.password());

        user.setPasswordHash(passwordEncoder.encode(request.password()));
        userRepository.save(user);

        int revoked = userSessionRepository.revokeAllForUser(userId, OffsetDateTime.now(clock), REASON_PASSWORD_CHANGE);
        log.info("Password changed for user {}, revoked {} session(s)", userId, revoked);

        auditLogService.record(AuditLogCommand.of(AuditAction.PASSWORD_CHANGE, userId, client, Map.of()));
    }

    public void updateMobile(UUID userId, UpdateMobileRequest request, ClientRequestInfo client) {
        User user = loadUser(userId);
        String mobile = RegistrationService.requireMobile(request.mobile());
        profileService.updateMobile(user, mobile);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("section", "mobile");
        auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, userId, client, metadata));
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }
}
