package com.carelink.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
