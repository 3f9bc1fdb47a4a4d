package com.realtyhub.backend.modules.listing.presentation.dto;

import com.realtyhub.backend.modules.listing.domain.OwnerContact;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record OwnerContactPayload(
        @Size(max = 100) String name,
        @Email @Size(max = 255) String email,
        @Size(max = 30) String phone,
        @Size(max = 300) String address
) {

    public static OwnerContactPayload from(OwnerContact contact) {
        if (contact == null) {
            return null;
        }
        return new OwnerContactPayload(contact.getName(), contact.getEmail(), contact.getPhone(), contact.getAddress());
    }

    public OwnerContact toOwnerContact() {
        return new OwnerContact(name, email, phone, address);
    }
}
