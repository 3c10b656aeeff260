package com.carelink.backend.modules.verification.presentation.dto;

import jakarta.validation.constraints.Size;

public record ApproveWorkerRequest(@Size(max = 2000) String notes) {
}
