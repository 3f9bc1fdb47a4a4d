package com.realtyhub.backend.modules.lead.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record LeadAssignRequest(@NotNull UUID assigneeId) {
}
