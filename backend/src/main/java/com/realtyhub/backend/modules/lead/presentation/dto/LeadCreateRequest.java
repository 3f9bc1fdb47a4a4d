package com.realtyhub.backend.modules.lead.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LeadCreateRequest(
        @Size(max = 100) String name,
        @NotBlank @Size(max = 30) String phoneNumber,
        @Email @Size(max = 255) String email,
        @Size(max = 1000) String message,
        LeadSource source,
        LeadPriority priority,
        List<@NotBlank @Size(max = 50) String> tags,
        List<@NotNull UUID> propertyInterests,
        @Valid BudgetPayload budget,
        @Valid PreferredLocationPayload preferredLocation
) {
}
