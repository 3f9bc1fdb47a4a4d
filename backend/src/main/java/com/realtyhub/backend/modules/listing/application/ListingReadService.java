package com.realtyhub.backend.modules.listing.application;

import java.util.EnumMap;
import java.util.Set;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageQuery;
import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingSearchCondition;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingVisibility;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingStatsResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ListingReadService {

    static final Set<String> SORTABLE = Set.of("createdAt", "price", "title");
    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "createdAt");

    private final ListingRepository listingRepository;
    private final RealtyhubProperties properties;

    public ListingReadService(ListingRepository listingRepository, RealtyhubProperties properties) {
        this.listingRepository = listingRepository;
        this.properties = properties;
    }

    public PageResponse<ListingResponse> search(ListingSearchCondition condition, Integer page, Integer size, String sort) {
        PageQuery query = PageQuery.of(page, size, sort, SORTABLE, DEFAULT_SORT, properties.pagination());
        Actor viewer = condition.viewer();
        return PageResponse.from(
                listingRepository.search(condition, query.toPageable()),
                listing -> ListingResponse.from(listing, ListingAccessPolicy.canSeeOwnerContact(listing, viewer))
        );
    }

    public PageResponse<ListingResponse> listByAgent(UUID agentId, Actor viewer, Integer page, Integer size, String sort) {
        return search(ListingSearchCondition.visibleTo(viewer).withAgent(agentId), page, size, sort);
    }

    /**
     * Listings the viewer is not allowed to see are reported as missing.
     */
    public ListingResponse getById(UUID listingId, Actor viewer) {
        Listing listing = listingRepository.findById(listingId)
                .filter(found -> ListingVisibility.isVisible(found, viewer))
                .orElseThrow(ListingAccessPolicy::notFound);
        return ListingResponse.from(listing, ListingAccessPolicy.canSeeOwnerContact(listing, viewer));
    }

    public ListingStatsResponse stats() {
        EnumMap<MarketStatus, Long> byStatus = new EnumMap<>(MarketStatus.class);
        for (MarketStatus status : MarketStatus.values()) {
            byStatus.put(status, 0L);
        }
        long total = 0;
        for (Object[] row : listingRepository.countByMarketStatus()) {
            long count = ((Number) row[1]).longValue();
            byStatus.put((MarketStatus) row[0], count);
            total += count;
        }

        EnumMap<PropertyType, Long> byType = new EnumMap<>(PropertyType.class);
        for (Object[] row : listingRepository.countByPropertyType()) {
            byType.put((PropertyType) row[0], ((Number) row[1]).longValue());
        }

        EnumMap<ReviewStatus, Long> byApproval = new EnumMap<>(ReviewStatus.class);
        for (Object[] row : listingRepository.countByApprovalStatus()) {
            byApproval.put((ReviewStatus) row[0], ((Number) row[1]).longValue());
        }

        Double average = listingRepository.averagePrice();
        return new ListingStatsResponse(total, byStatus, byType, byApproval, average == null ? 0L : Math.round(average));
    }
}
