package com.carelink.backend.modules.admin.presentation.dto;

import java.util.UUID;

public record AdminUserResponse(UUID id, String email, String role, String status) {
}
