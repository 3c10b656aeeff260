package com.carelink.backend.modules.verification.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdatePublishStatusRequest(@NotNull(message = "isPublished is required") Boolean isPublished) {
}
