package com.realtyhub.backend.modules.auth.presentation.dto;

import com.realtyhub.backend.modules.auth.domain.Address;

import jakarta.validation.constraints.Size;

public record AddressPayload(
        @Size(max = 200) String street,
        @Size(max = 100) String city,
        @Size(max = 100) String state,
        @Size(max = 20) String zipCode,
        @Size(max = 100) String country
) {

    public static AddressPayload from(Address address) {
        if (address == null) {
            return null;
        }
        return new AddressPayload(address.getStreet(), address.getCity(), address.getState(),
                address.getZipCode(), address.getCountry());
    }

    public Address toAddress() {
        return new Address(street, city, state, zipCode, country);
    }
}
