package com.realtyhub.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RegisterResponse(UUID userId, UUID requestId, String message) {
}
