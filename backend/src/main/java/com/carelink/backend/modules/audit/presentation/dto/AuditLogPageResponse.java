package com.carelink.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AuditLogPageResponse(
        List<Entry> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {

    public record Entry(
            UUID id,
            UUID userId,
            String userEmail,
            String action,
            String ipAddress,
            String userAgent,
            Map<String, Object> metadata,
            OffsetDateTime createdAt
    ) {
    }
}
