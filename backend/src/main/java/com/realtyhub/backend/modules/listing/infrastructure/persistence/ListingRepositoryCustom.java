package com.realtyhub.backend.modules.listing.infrastructure.persistence;

import com.realtyhub.backend.modules.listing.domain.Listing;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface ListingRepositoryCustom {

    Page<Listing> search(ListingSearchCondition condition, Pageable pageable);
}
