package com.carelink.backend.modules.verification.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RejectWorkerRequest(@NotBlank(message = "reason is required") @Size(max = 2000) String reason) {
}
