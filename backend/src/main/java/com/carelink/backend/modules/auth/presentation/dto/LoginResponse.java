package com.carelink.backend.modules.auth.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Returned by login and refresh: a fresh token pair and the signed-in user.")
public record LoginResponse(TokenPairResponse tokens, UserProfileResponse user) {
}
