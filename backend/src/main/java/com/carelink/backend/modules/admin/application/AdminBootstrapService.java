package com.carelink.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.PasswordPolicy;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first ADMIN account from {@code app.admin.bootstrap.*} on startup.
 * Does nothing when the properties are unset or the address is already registered.
 */
@Service
public class AdminBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String email;
    private final String password;

    public AdminBootstrapService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${app.admin.bootstrap.email:}") String email,
            @Value("${app.admin.bootstrap.password:}") String password
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.email = email;
        this.password = password;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        createAdminIfMissing();
    }

    /**
     * @return {@code true} when an account was created
     */
    @Transactional
    public boolean createAdminIfMissing() {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            return false;
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            log.info("Bootstrap admin {} already exists, skipping", normalizedEmail);
            return false;
        }
        if (!PasswordPolicy.isStrong(password)) {
            throw new IllegalStateException("app.admin.bootstrap.password does not meet the password policy: "
                    + String.join("; ", PasswordPolicy.violations(password)));
        }

        User admin = new User();
        admin.setEmail(normalizedEmail);
        admin.setPasswordHash(passwordEncoder.encode(password));
        admin.setRole(UserRole.ADMIN);
        admin.setStatus(AccountStatus.ACTIVE);
        admin.setEmailVerifiedAt(OffsetDateTime.now(clock));
        User saved = userRepository.save(admin);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", "BOOTSTRAP");
        metadata.put("role", UserRole.ADMIN.name());
        metadata.put("createdBy", "System");
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_CHANGE, saved.getId(), metadata));

        log.info("Bootstrap admin account {} created", saved.getId());
        return true;
    }
}
