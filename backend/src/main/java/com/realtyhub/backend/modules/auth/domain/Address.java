package com.realtyhub.backend.modules.auth.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class Address {

    public static final String DEFAULT_COUNTRY = "USA";

    @Column(name = "address_street", length = 200)
    private String street;

    @Column(name = "address_city", length = 100)
    private String city;

    @Column(name = "address_state", length = 100)
    private String state;

    @Column(name = "address_zip_code", length = 20)
    private String zipCode;

    @Column(name = "address_country", length = 100)
    private String country = DEFAULT_COUNTRY;

    protected Address() {
    }

    public Address(String street, String city, String state, String zipCode, String country) {
        this.street = street;
        this.city = city;
        this.state = state;
        this.zipCode = zipCode;
        this.country = (country == null || country.isBlank()) ? DEFAULT_COUNTRY : country;
    }

    public String getStreet() {
        return street;
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

    public String getCountry() {
        return country;
    }
}
