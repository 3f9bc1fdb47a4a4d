package com.realtyhub.backend.modules.lead.presentation.dto;

import com.realtyhub.backend.modules.lead.domain.PreferredLocation;

import jakarta.validation.constraints.Size;

public record PreferredLocationPayload(
        @Size(max = 100) String city,
        @Size(max = 100) String state,
        @Size(max = 20) String zipCode
) {

    public static PreferredLocationPayload from(PreferredLocation location) {
        return location == null ? null
                : new PreferredLocationPayload(location.getCity(), location.getState(), location.getZipCode());
    }

    public PreferredLocation toPreferredLocation() {
        return new PreferredLocation(city, state, zipCode);
    }
}
