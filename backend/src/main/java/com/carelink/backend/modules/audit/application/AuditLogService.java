package com.carelink.backend.modules.audit.application;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.audit.domain.AuditLog;
import com.carelink.backend.modules.audit.infrastructure.AuditLogRepository;
import com.carelink.backend.modules.audit.presentation.dto.AuditLogPageResponse;
import com.carelink.backend.modules.user.domain.User;

import jakarta.persistence.EntityManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate independentTransaction;

    public AuditLogService(
            AuditLogRepository auditLogRepository,
            EntityManager entityManager,
            PlatformTransactionManager transactionManager
    ) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.independentTransaction = new TransactionTemplate(transactionManager);
        this.independentTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Appends an entry inside the caller's transaction, so it rolls back with the business change.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        auditLogRepository.save(toEntity(command));
    }

    /**
     * Appends an entry in its own transaction and never throws. Used where the audit write must
     * survive, or must not break, the surrounding request (failed logins, lockouts).
     */
    public void recordQuietly(AuditLogCommand command) {
        try {
            independentTransaction.executeWithoutResult(status -> auditLogRepository.save(toEntity(command)));
        } catch (RuntimeException ex) {
            log.warn("[AUDIT] failed to record action={} user={} detail={}",
                    command.action(), command.userId(), ex.getMessage(), ex);
        }
    }

    @Transactional(readOnly = true)
    public AuditLogPageResponse search(UUID userId, AuditAction action, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<AuditLog> result = auditLogRepository.findAll(AuditLogRepository.matching(userId, action),
                PageRequest.of(safePage, safeSize, Sort.by(Sort.Direction.DESC, "createdAt")));

        List<AuditLogPageResponse.Entry> items = result.getContent().stream()
                .map(entry -> new AuditLogPageResponse.Entry(
                        entry.getId(),
                        entry.getUser() != null ? entry.getUser().getId() : null,
                        entry.getUser() != null ? entry.getUser().getEmail() : null,
                        entry.getAction().name(),
                        entry.getIpAddress(),
                        entry.getUserAgent(),
                        entry.getMetadata() != null ? entry.getMetadata() : Map.of(),
                        entry.getCreatedAt()
                ))
                .toList();

        return new AuditLogPageResponse(items, result.getNumber(), result.getSize(), result.getTotalElements(), result.getTotalPages());
    }

    private AuditLog toEntity(AuditLogCommand command) {
        Objects.requireNonNull(command.action(), "action is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setAction(command.action());
        if (command.userId() != null) {
            auditLog.setUser(entityManager.getReference(User.class, command.userId()));
        }
        auditLog.setIpAddress(command.ipAddress());
        auditLog.setUserAgent(command.userAgent());
        if (command.metadata() != null && !command.metadata().isEmpty()) {
            auditLog.setMetadata(new HashMap<>(command.metadata()));
        }
        return auditLog;
    }

    public record AuditLogCommand(
            AuditAction action,
            UUID userId,
            String ipAddress,
            String userAgent,
            Map<String, Object> metadata
    ) {

        public static AuditLogCommand of(AuditAction action, UUID userId, ClientRequestInfo client, Map<String, Object> metadata) {
            ClientRequestInfo safeClient = client != null ? client : ClientRequestInfo.UNKNOWN;
            return new AuditLogCommand(action, userId, safeClient.ipAddress(), safeClient.userAgent(), metadata);
        }

        public static AuditLogCommand of(AuditAction action, UUID userId, Map<String, Object> metadata) {
            return new AuditLogCommand(action, userId, null, null, metadata);
        }
    }
}
