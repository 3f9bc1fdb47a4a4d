package com.realtyhub.backend.modules.listing.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.realtyhub.backend.modules.listing.domain.ListingPurpose;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} leaves a field unchanged. Approval fields are not editable.
 */
public record ListingUpdateRequest(
        @Size(min = 1, max = 200) String title,
        @Size(min = 1, max = 2000) String description,
        @DecimalMin("0") BigDecimal price,
        @Size(min = 1, max = 200) String location,
        PropertyType propertyType,
        ListingPurpose purpose,
        @Min(0) @Max(20) Integer bedrooms,
        @Min(0) @Max(20) Integer bathrooms,
        @DecimalMin("0") BigDecimal area,
        List<@NotBlank @Size(max = 100) String> amenities,
        MarketStatus status,
        @Valid OwnerContactPayload ownerContact
) {
}
