package com.realtyhub.backend.modules.listing.domain;

/**
 * Commercial state of a listing. Independent of its approval status.
 */
public enum MarketStatus {
    AVAILABLE,
    SOLD,
    RENTED,
    PENDING_SALE
}
