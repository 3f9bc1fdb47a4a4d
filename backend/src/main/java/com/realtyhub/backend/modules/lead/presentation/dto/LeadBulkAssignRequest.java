package com.realtyhub.backend.modules.lead.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LeadBulkAssignRequest(
        @NotEmpty @Size(max = 100) List<@NotNull UUID> leadIds,
        @NotNull UUID assigneeId
) {
}
