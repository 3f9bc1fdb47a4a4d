package com.realtyhub.backend.modules.listing.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ListingRepository extends JpaRepository<Listing, UUID>, ListingRepositoryCustom {

    /**
     * Compare-and-swap approval transition. Approval clears any earlier rejection reason.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Listing l
               set l.approvalStatus = :status,
                   l.approvedBy = :reviewerId,
                   l.approvedAt = :reviewedAt,
                   l.rejectionReason = :reason,
                   l.updatedAt = :reviewedAt
             where l.id = :id
               and l.approvalStatus = com.realtyhub.backend.modules.workflow.ReviewStatus.PENDING
            """)
    int transitionIfPending(
            @Param("id") UUID id,
            @Param("status") ReviewStatus status,
            @Param("reviewerId") UUID reviewerId,
            @Param("reviewedAt") OffsetDateTime reviewedAt,
            @Param("reason") String reason
    );

    @Query("select l.marketStatus, count(l) from Listing l group by l.marketStatus")
    List<Object[]> countByMarketStatus();

    @Query("select l.propertyType, count(l) from Listing l group by l.propertyType")
    List<Object[]> countByPropertyType();

    @Query("select l.approvalStatus, count(l) from Listing l group by l.approvalStatus")
    List<Object[]> countByApprovalStatus();

    @Query("select avg(l.price) from Listing l")
    Double averagePrice();
}
