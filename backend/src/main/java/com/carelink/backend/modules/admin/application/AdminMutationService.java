package com.carelink.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.admin.presentation.dto.AdminUserResponse;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminMutationService {

    private static final Logger log = LoggerFactory.getLogger(AdminMutationService.class);

    static final String REASON_ACCOUNT_SUSPENDED = "ACCOUNT_SUSPENDED";

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AdminMutationService(
            UserRepository userRepository,
            UserSessionRepository userSessionRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public AdminUserResponse changeRole(@NonNull UUID targetUserId, @NonNull UUID adminUserId, String rawRole, ClientRequestInfo client) {
        if (targetUserId.equals(adminUserId)) {
            throw ProblemException.conflict("CANNOT_CHANGE_OWN_ROLE", "Admins cannot change their own role");
        }
        UserRole newRole = AdminReadService.parseEnum(UserRole.class, rawRole, "INVALID_ROLE");
        if (newRole == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ROLE", "role is required");
        }
        User target = findUser(targetUserId);
        UserRole previous = target.getRole();
        if (previous == newRole) {
            return toResponse(target);
        }

        target.setRole(newRole);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", previous.name());
        metadata.put("to", newRole.name());
        metadata.put("adminUserId", adminUserId.toString());
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_CHANGE, targetUserId, client, metadata));

        log.info("Role of user {} changed from {} to {} by {}", targetUserId, previous, newRole, adminUserId);
        return toResponse(target);
    }

    /**
     * Only ACTIVE and SUSPENDED can be set by hand. LOCKED and PENDING_VERIFICATION are reached through their own flows.
     */
    public AdminUserResponse updateStatus(@NonNull UUID targetUserId, @NonNull UUID adminUserId, String rawStatus,
                                          String reason, ClientRequestInfo client) {
        AccountStatus newStatus = AdminReadService.parseEnum(AccountStatus.class, rawStatus, "UNSUPPORTED_STATUS");
        if (newStatus != AccountStatus.ACTIVE && newStatus != AccountStatus.SUSPENDED) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_STATUS",
                    "Status can only be set to ACTIVE or SUSPENDED");
        }

        User target = findUser(targetUserId);
        AccountStatus previous = target.getStatus();
        if (previous == newStatus) {
            return toResponse(target);
        }
        target.setStatus(newStatus);

        if (newStatus == AccountStatus.SUSPENDED) {
            int revoked = userSessionRepository.revokeAllForUser(targetUserId, OffsetDateTime.now(clock), REASON_ACCOUNT_SUSPENDED);
            log.info("User {} suspended by {}, revoked {} session(s)", targetUserId, adminUserId, revoked);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", previous.name());
        metadata.put("to", newStatus.name());
        metadata.put("adminUserId", adminUserId.toString());
        if (reason != null && !reason.isBlank()) {
            metadata.put("reason", reason.trim());
        }
        auditLogService.record(AuditLogCommand.of(AuditAction.STATUS_CHANGE, targetUserId, client, metadata));
        return toResponse(target);
    }

    public AdminUserResponse unlock(@NonNull UUID targetUserId, @NonNull UUID adminUserId, ClientRequestInfo client) {
        User target = findUser(targetUserId);
        target.clearLockout();

        auditLogService.record(AuditLogCommand.of(AuditAction.ACCOUNT_UNLOCKED, targetUserId, client,
                Map.of("adminUserId", adminUserId.toString())));
        return toResponse(target);
    }

    private User findUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found"));
    }

    private static AdminUserResponse toResponse(User user) {
        return new AdminUserResponse(user.getId(), user.getEmail(), user.getRole().name(), user.getStatus().name());
    }
}
