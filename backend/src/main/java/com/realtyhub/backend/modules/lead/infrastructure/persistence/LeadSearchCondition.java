package com.realtyhub.backend.modules.lead.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;

public record LeadSearchCondition(
        LeadStatus status,
        LeadPriority priority,
        LeadSource source,
        UUID assigneeId,
        boolean unassignedOnly,
        Integer minScore,
        Integer maxScore,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        String keyword
) {

    public static LeadSearchCondition unassigned() {
        return new LeadSearchCondition(null, null, null, null, true, null, null, null, null, null);
    }

    public static LeadSearchCondition assignedTo(UUID assigneeId) {
        return new LeadSearchCondition(null, null, null, assigneeId, false, null, null, null, null, null);
    }

    /**
     * Restricts the condition to leads assigned to the given user.
     */
    public LeadSearchCondition restrictedTo(UUID assigneeId) {
        return new LeadSearchCondition(status, priority, source, assigneeId, false,
                minScore, maxScore, createdFrom, createdTo, keyword);
    }

    public String searchPattern() {
        if (keyword == null || keyword.isBlank()) {
            return null;
        }
        return "%" + keyword.trim().toLowerCase() + "%";
    }
}
