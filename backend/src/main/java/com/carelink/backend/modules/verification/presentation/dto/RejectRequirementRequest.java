package com.carelink.backend.modules.verification.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RejectRequirementRequest(
        @NotBlank(message = "rejectionReason is required") @Size(max = 2000) String rejectionReason
) {
}
