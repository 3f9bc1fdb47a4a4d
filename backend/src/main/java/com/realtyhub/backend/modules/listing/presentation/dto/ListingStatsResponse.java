package com.realtyhub.backend.modules.listing.presentation.dto;

import java.util.Map;

import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

public record ListingStatsResponse(
        long total,
        Map<MarketStatus, Long> byStatus,
        Map<PropertyType, Long> byType,
        Map<ReviewStatus, Long> byApprovalStatus,
        long averagePrice
) {
}
