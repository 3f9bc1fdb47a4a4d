package com.realtyhub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where lower(u.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from AppUser u
             where (:role is null or u.role = :role)
               and (:active is null or u.active = :active)
               and (
                     :searchPattern is null
                  or lower(u.firstName) like :searchPattern
                  or lower(u.lastName) like :searchPattern
                  or lower(u.email) like :searchPattern
               )
            """)
    Page<AppUser> search(
            @Param("role") UserRole role,
            @Param("active") Boolean active,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    List<AppUser> findByRoleOrderByCreatedAtAsc(UserRole role);

    /**
     * Mirrors a verification outcome onto the identity. Runs inside the review transaction.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.verificationStatus = :status,
                   u.verified = :verified,
                   u.verifiedBy = :reviewerId,
                   u.verifiedAt = :reviewedAt,
                   u.rejectionReason = :reason,
                   u.updatedAt = :reviewedAt
             where u.id = :userId
            """)
    int applyVerificationOutcome(
            @Param("userId") UUID userId,
            @Param("status") ReviewStatus status,
            @Param("verified") boolean verified,
            @Param("reviewerId") UUID reviewerId,
            @Param("reviewedAt") OffsetDateTime reviewedAt,
            @Param("reason") String reason
    );
}
