package com.realtyhub.backend.modules.listing.domain;

public enum ListingPurpose {
    SALE,
    RENT
}
