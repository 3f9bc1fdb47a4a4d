package com.realtyhub.backend.modules.lead.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;

public record LeadResponse(
        UUID id,
        String name,
        String phoneNumber,
        String email,
        String message,
        LeadSource source,
        LeadStatus status,
        LeadPriority priority,
        AssigneeSummary assignee,
        UUID assignedBy,
        OffsetDateTime assignedAt,
        OffsetDateTime lastContactedAt,
        String notes,
        List<String> tags,
        List<UUID> propertyInterests,
        BudgetPayload budget,
        PreferredLocationPayload preferredLocation,
        int leadScore,
        int conversionProbability,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public record AssigneeSummary(UUID id, String firstName, String lastName, String email) {

        static AssigneeSummary from(AppUser user) {
            return user == null ? null
                    : new AssigneeSummary(user.getId(), user.getFirstName(), user.getLastName(), user.getEmail());
        }
    }

    public static LeadResponse from(Lead lead) {
        return new LeadResponse(
                lead.getId(),
                lead.getName(),
                lead.getPhoneNumber(),
                lead.getEmail(),
                lead.getMessage(),
                lead.getSource(),
                lead.getStatus(),
                lead.getPriority(),
                AssigneeSummary.from(lead.getAssignee()),
                lead.getAssignedBy(),
                lead.getAssignedAt(),
                lead.getLastContactedAt(),
                lead.getNotes(),
                List.copyOf(lead.getTags()),
                List.copyOf(lead.getPropertyInterests()),
                BudgetPayload.from(lead.getBudget()),
                PreferredLocationPayload.from(lead.getPreferredLocation()),
                lead.getLeadScore(),
                lead.getConversionProbability(),
                lead.getCreatedAt(),
                lead.getUpdatedAt()
        );
    }
}
