package com.carelink.backend.modules.audit.presentation;

import java.util.Locale;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.audit.presentation.dto.AuditLogPageResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/audit-logs")
public class AdminAuditLogController {

    private final AuditLogService auditLogService;

    public AdminAuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Operation(summary = "Search audit log", description = "Newest entries first, optionally filtered by user and action.")
    @GetMapping
    public ResponseEntity<AuditLogPageResponse> search(
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(auditLogService.search(userId, parseAction(action), page, size));
    }

    private AuditAction parseAction(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AuditAction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_AUDIT_ACTION", "Unknown audit action: " + raw);
        }
    }
}
