package com.realtyhub.backend.global.security;

import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.UserRole;

public record JwtAuthenticationPrincipal(UUID userId, String email, UserRole role) {
}
