package com.realtyhub.backend.modules.listing.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.workflow.ReviewDecision;
import com.realtyhub.backend.modules.workflow.ReviewWorkflow;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

@Component
public class ListingReviewWorkflow extends ReviewWorkflow<Listing> {

    private final ListingRepository listingRepository;

    public ListingReviewWorkflow(
            ListingRepository listingRepository,
            TransactionOperations transactionOperations,
            AuditLogService auditLogService,
            RealtyhubProperties properties,
            Clock clock
    ) {
        super(transactionOperations, auditLogService, properties.review(), clock);
        this.listingRepository = listingRepository;
    }

    @Override
    protected String resourceType() {
        return "LISTING";
    }

    @Override
    protected int transitionIfPending(UUID targetId, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
        return listingRepository.transitionIfPending(targetId, decision.outcome(), reviewerId, now, decision.storedReason());
    }

    @Override
    protected boolean exists(UUID targetId) {
        return listingRepository.existsById(targetId);
    }

    @Override
    protected Listing load(UUID targetId) {
        Listing listing = listingRepository.findById(targetId).orElseThrow(() -> notFound(targetId));
        // response mapping happens after the transaction closes
        listing.getAgent().getEmail();
        listing.getImages().size();
        listing.getAmenities().size();
        return listing;
    }

    @Override
    protected ProblemException notFound(UUID targetId) {
        return ListingAccessPolicy.notFound();
    }
}
