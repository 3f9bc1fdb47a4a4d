package com.realtyhub.backend.modules.listing.application;

import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingSearchCondition;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.workflow.BulkResult;
import com.realtyhub.backend.modules.workflow.ReviewDecision;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.stereotype.Service;

/**
 * Super admin approval queue for listings.
 */
@Service
public class ListingApprovalService {

    private final ListingReviewWorkflow reviewWorkflow;
    private final ListingReadService listingReadService;

    public ListingApprovalService(ListingReviewWorkflow reviewWorkflow, ListingReadService listingReadService) {
        this.reviewWorkflow = reviewWorkflow;
        this.listingReadService = listingReadService;
    }

    public PageResponse<ListingResponse> pendingQueue(Actor reviewer, String keyword, Integer page, Integer size, String sort) {
        ListingSearchCondition condition = new ListingSearchCondition(reviewer, ReviewStatus.PENDING, null, keyword,
                null, null, null, null, null, null, null, null, null);
        return listingReadService.search(condition, page, size, sort);
    }

    public ListingResponse approve(UUID listingId, UUID reviewerId) {
        return ListingResponse.from(reviewWorkflow.review(listingId, ReviewDecision.approve(null), reviewerId), true);
    }

    public ListingResponse reject(UUID listingId, UUID reviewerId, String reason) {
        return ListingResponse.from(reviewWorkflow.review(listingId, ReviewDecision.reject(reason, null), reviewerId), true);
    }

    public BulkResult<Listing> bulkApprove(List<UUID> listingIds, UUID reviewerId) {
        return reviewWorkflow.reviewAll(listingIds, ReviewDecision.approve(null), reviewerId);
    }

    public BulkResult<Listing> bulkReject(List<UUID> listingIds, UUID reviewerId, String reason) {
        return reviewWorkflow.reviewAll(listingIds, ReviewDecision.reject(reason, null), reviewerId);
    }
}
