package com.realtyhub.backend.modules.listing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.listing.application.ListingReviewWorkflow;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.realtyhub.backend.modules.workflow.BulkResult;
import com.realtyhub.backend.modules.workflow.ReviewDecision;
import com.realtyhub.backend.modules.workflow.ReviewStatus;
import com.realtyhub.backend.support.TestEntities;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class ListingReviewWorkflowTest {

    private static final UUID REVIEWER = UUID.fromString("00000000-0000-0000-0000-0000000000f2");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private ListingRepository listingRepository;

    @Mock
    private AuditLogService auditLogService;

    private ListingReviewWorkflow workflow;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        workflow = new ListingReviewWorkflow(listingRepository, TransactionOperations.withoutTransaction(),
                auditLogService, TestProperties.defaults(), clock);
    }

    @Test
    @DisplayName("일괄 승인 중 없는 매물은 오류 목록에 남고 나머지는 승인된다")
    void bulkApprovalCollectsMissingListing() {
        Listing first = pendingListing();
        Listing third = pendingListing();
        UUID missing = UUID.randomUUID();
        for (Listing listing : List.of(first, third)) {
            when(listingRepository.transitionIfPending(listing.getId(), ReviewStatus.APPROVED, REVIEWER, NOW, null))
                    .thenReturn(1);
            when(listingRepository.findById(listing.getId())).thenReturn(Optional.of(listing));
        }
        when(listingRepository.transitionIfPending(missing, ReviewStatus.APPROVED, REVIEWER, NOW, null))
                .thenReturn(0);
        when(listingRepository.existsById(missing)).thenReturn(false);

        BulkResult<Listing> result = workflow.reviewAll(
                List.of(first.getId(), missing, third.getId()), ReviewDecision.approve(null), REVIEWER);

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.succeeded()).containsExactly(first, third);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.id()).isEqualTo(missing);
            assertThat(error.code()).isEqualTo("listing.not_found");
        });
    }

    private static Listing pendingListing() {
        return TestEntities.listing(UUID.randomUUID(),
                TestEntities.user(UUID.randomUUID(), UserRole.USER), ReviewStatus.PENDING);
    }
}
