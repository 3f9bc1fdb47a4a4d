package com.realtyhub.backend.modules.listing.infrastructure.persistence;

import java.math.BigDecimal;
import java.util.UUID;

import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.listing.domain.ListingPurpose;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

public record ListingSearchCondition(
        Actor viewer,
        ReviewStatus approvalStatus,
        UUID agentId,
        String keyword,
        PropertyType propertyType,
        ListingPurpose purpose,
        MarketStatus marketStatus,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        Integer minBedrooms,
        Integer minBathrooms,
        String city,
        String state
) {

    public ListingSearchCondition {
        viewer = viewer == null ? Actor.anonymous() : viewer;
    }

    public static ListingSearchCondition visibleTo(Actor viewer) {
        return new ListingSearchCondition(viewer, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public ListingSearchCondition withAgent(UUID agent) {
        return new ListingSearchCondition(viewer, approvalStatus, agent, keyword, propertyType, purpose,
                marketStatus, minPrice, maxPrice, minBedrooms, minBathrooms, city, state);
    }
}
