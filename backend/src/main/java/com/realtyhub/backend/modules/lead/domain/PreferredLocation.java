package com.realtyhub.backend.modules.lead.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class PreferredLocation {

    @Column(name = "preferred_city", length = 100)
    private String city;

    @Column(name = "preferred_state", length = 100)
    private String state;

    @Column(name = "preferred_zip_code", length = 20)
    private String zipCode;

    protected PreferredLocation() {
    }

    public PreferredLocation(String city, String state, String zipCode) {
        this.city = city;
        this.state = state;
        this.zipCode = zipCode;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getZipCode() {
        return zipCode;
    }
}
