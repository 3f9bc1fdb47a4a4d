package com.realtyhub.backend.modules.auth.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; {@code null} fields are left unchanged.
 */
public record UpdateProfileRequest(
        @Size(min = 1, max = 50) String firstName,
        @Size(min = 1, max = 50) String lastName,
        @Size(max = 30) String phoneNumber,
        @Size(max = 1000) String description,
        @Size(max = 100) String position,
        @Min(1) @Max(5) Integer rating,
        @Size(max = 500) String profileImage,
        @Valid AddressPayload address
) {
}
