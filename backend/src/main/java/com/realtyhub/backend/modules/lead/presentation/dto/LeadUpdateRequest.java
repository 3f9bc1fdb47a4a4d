package com.realtyhub.backend.modules.lead.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.lead.domain.LeadPriority;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left untouched. Conversion probability is clamped to 0..100.
 */
public record LeadUpdateRequest(
        @Size(max = 100) String name,
        @Email @Size(max = 255) String email,
        @Size(max = 1000) String message,
        LeadPriority priority,
        @Size(max = 2000) String notes,
        List<@NotBlank @Size(max = 50) String> tags,
        List<@NotNull UUID> propertyInterests,
        @Valid BudgetPayload budget,
        @Valid PreferredLocationPayload preferredLocation,
        Integer conversionProbability
) {
}
