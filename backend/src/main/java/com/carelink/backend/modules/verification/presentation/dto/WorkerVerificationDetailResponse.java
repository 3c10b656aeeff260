package com.carelink.backend.modules.verification.presentation.dto;

import java.util.List;

public record WorkerVerificationDetailResponse(WorkerVerificationSummary worker, List<RequirementResponse> requirements) {
}
