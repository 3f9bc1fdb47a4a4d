package com.realtyhub.backend.modules.lead.presentation.dto;

import com.realtyhub.backend.modules.lead.domain.LeadStatus;

import jakarta.validation.constraints.NotNull;

public record LeadStatusRequest(@NotNull LeadStatus status) {
}
