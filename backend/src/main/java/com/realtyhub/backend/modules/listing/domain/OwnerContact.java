package com.realtyhub.backend.modules.listing.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class OwnerContact {

    @Column(name = "owner_name", length = 100)
    private String name;

    @Column(name = "owner_email", length = 255)
    private String email;

    @Column(name = "owner_phone", length = 30)
    private String phone;

    @Column(name = "owner_address", length = 300)
    private String address;

    protected OwnerContact() {
    }

    public OwnerContact(String name, String email, String phone, String address) {
        this.name = name;
        this.email = email;
        this.phone = phone;
        this.address = address;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getAddress() {
        return address;
    }
}
