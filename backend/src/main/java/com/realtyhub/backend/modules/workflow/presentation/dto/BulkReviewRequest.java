package com.realtyhub.backend.modules.workflow.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Batch review payload. {@code reason} is required only for bulk rejection.
 */
public record BulkReviewRequest(
        @NotEmpty @Size(max = 100) List<@NotNull UUID> ids,
        String reason,
        String notes
) {
}
