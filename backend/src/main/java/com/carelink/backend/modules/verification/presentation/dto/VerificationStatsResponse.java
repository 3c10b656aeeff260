package com.carelink.backend.modules.verification.presentation.dto;

import java.util.Map;

public record VerificationStatsResponse(Map<String, Long> byStatus, long total) {
}
