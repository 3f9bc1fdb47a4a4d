package com.realtyhub.backend.modules.listing.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.domain.ListingPurpose;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

public record ListingResponse(
        UUID id,
        String title,
        String description,
        BigDecimal price,
        String location,
        PropertyType propertyType,
        ListingPurpose purpose,
        int bedrooms,
        int bathrooms,
        BigDecimal area,
        long pricePerSqFt,
        List<String> images,
        List<String> amenities,
        MarketStatus status,
        OwnerContactPayload ownerContact,
        AgentSummary agent,
        ReviewStatus approvalStatus,
        UUID approvedBy,
        OffsetDateTime approvedAt,
        String rejectionReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public record AgentSummary(UUID id, String firstName, String lastName, String email, String phoneNumber) {

        static AgentSummary from(AppUser agent) {
            if (agent == null) {
                return null;
            }
            return new AgentSummary(agent.getId(), agent.getFirstName(), agent.getLastName(),
                    agent.getEmail(), agent.getPhoneNumber());
        }
    }

    /**
     * @param includeOwnerContact false strips the owner's contact details
     */
    public static ListingResponse from(Listing listing, boolean includeOwnerContact) {
        return new ListingResponse(
                listing.getId(),
                listing.getTitle(),
                listing.getDescription(),
                listing.getPrice(),
                listing.getLocation(),
                listing.getPropertyType(),
                listing.getPurpose(),
                listing.getBedrooms(),
                listing.getBathrooms(),
                listing.getArea(),
                listing.getPricePerSqFt(),
                List.copyOf(listing.getImages()),
                List.copyOf(listing.getAmenities()),
                listing.getMarketStatus(),
                includeOwnerContact ? OwnerContactPayload.from(listing.getOwnerContact()) : null,
                AgentSummary.from(listing.getAgent()),
                listing.getApprovalStatus(),
                listing.getApprovedBy(),
                listing.getApprovedAt(),
                listing.getRejectionReason(),
                listing.getCreatedAt(),
                listing.getUpdatedAt()
        );
    }
}
