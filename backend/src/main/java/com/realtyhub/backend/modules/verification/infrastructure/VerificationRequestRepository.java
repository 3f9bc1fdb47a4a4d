package com.realtyhub.backend.modules.verification.infrastructure;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.realtyhub.backend.modules.verification.domain.VerificationRequest;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VerificationRequestRepository extends JpaRepository<VerificationRequest, UUID> {

    /**
     * Compare-and-swap review transition; returns 0 when the request is missing or no longer pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update VerificationRequest vr
               set vr.status = :status,
                   vr.reviewedBy = :reviewerId,
                   vr.reviewedAt = :reviewedAt,
                   vr.reviewNotes = :notes,
                   vr.rejectionReason = :reason,
                   vr.updatedAt = :reviewedAt
             where vr.id = :id
               and vr.status = com.realtyhub.backend.modules.workflow.ReviewStatus.PENDING
            """)
    int transitionIfPending(
            @Param("id") UUID id,
            @Param("status") ReviewStatus status,
            @Param("reviewerId") UUID reviewerId,
            @Param("reviewedAt") OffsetDateTime reviewedAt,
            @Param("notes") String notes,
            @Param("reason") String reason
    );

    @Query("select vr from VerificationRequest vr where vr.user.id = :userId")
    Optional<VerificationRequest> findByUserId(@Param("userId") UUID userId);

    @Query("""
            select vr
              from VerificationRequest vr
             where (:status is null or vr.status = :status)
               and (:requestedFrom is null or vr.requestedAt >= :requestedFrom)
               and (:requestedTo is null or vr.requestedAt < :requestedTo)
               and (
                     :searchPattern is null
                  or lower(vr.applicant.firstName) like :searchPattern
                  or lower(vr.applicant.lastName) like :searchPattern
                  or lower(vr.applicant.email) like :searchPattern
                  or lower(vr.applicant.position) like :searchPattern
               )
            """)
    Page<VerificationRequest> search(
            @Param("status") ReviewStatus status,
            @Param("requestedFrom") OffsetDateTime requestedFrom,
            @Param("requestedTo") OffsetDateTime requestedTo,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    Page<VerificationRequest> findByStatus(ReviewStatus status, Pageable pageable);

    @Query("select vr.status, count(vr) from VerificationRequest vr group by vr.status")
    List<Object[]> countByStatus();

    long countByStatusAndRequestedAtGreaterThanEqual(ReviewStatus status, OffsetDateTime since);

    long countByStatusAndReviewedAtGreaterThanEqual(ReviewStatus status, OffsetDateTime since);

    @Query(value = """
            select cast(avg(extract(epoch from (reviewed_at - requested_at))) as double precision)
              from verification_request
             where status <> 'PENDING'
               and reviewed_at is not null
            """, nativeQuery = true)
    Double averageProcessingSeconds();
}
