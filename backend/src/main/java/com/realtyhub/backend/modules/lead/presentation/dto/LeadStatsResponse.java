package com.realtyhub.backend.modules.lead.presentation.dto;

import java.util.Map;

import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;

/**
 * @param conversionRate percentage of all leads in CONVERTED, rounded; 0 when there are no leads
 */
public record LeadStatsResponse(
        long total,
        Map<LeadStatus, Long> byStatus,
        long unassigned,
        Map<LeadSource, Long> bySource,
        Map<LeadPriority, Long> byPriority,
        long averageLeadScore,
        long conversionRate
) {
}
