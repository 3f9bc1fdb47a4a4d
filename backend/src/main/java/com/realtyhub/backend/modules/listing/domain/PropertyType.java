package com.realtyhub.backend.modules.listing.domain;

public enum PropertyType {
    APARTMENT,
    HOUSE,
    HOTEL,
    TOWNHOUSE,
    COMMERCIAL
}
