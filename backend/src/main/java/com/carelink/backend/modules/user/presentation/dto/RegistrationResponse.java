package com.carelink.backend.modules.user.presentation.dto;

import java.util.UUID;

public record RegistrationResponse(UUID userId, String email, String role, String status) {
}
