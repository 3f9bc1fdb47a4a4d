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
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ListingCreateRequest(
        @NotBlank @Size(max = 200) String title,
        @NotBlank @Size(max = 2000) String description,
        @NotNull @DecimalMin("0") BigDecimal price,
        @NotBlank @Size(max = 200) String location,
        @NotNull PropertyType propertyType,
        @NotNull ListingPurpose purpose,
        @NotNull @Min(0) @Max(20) Integer bedrooms,
        @NotNull @Min(0) @Max(20) Integer bathrooms,
        @NotNull @DecimalMin("0") BigDecimal area,
        List<@NotBlank @Size(max = 500) String> images,
        List<@NotBlank @Size(max = 100) String> amenities,
        MarketStatus status,
        @Valid OwnerContactPayload ownerContact
) {
}
