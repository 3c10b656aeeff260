package com.carelink.backend.modules.admin.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateUserStatusRequest(
        @Schema(allowableValues = {"ACTIVE", "SUSPENDED"})
        @NotBlank(message = "status is required") String status,
        @Schema(description = "Stored in the STATUS_CHANGE audit entry")
        @Size(max = 500) String reason
) {
}
