package com.realtyhub.backend.modules.listing.infrastructure.persistence;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.listing.domain.Listing;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

/**
 * Which approval buckets a viewer may see, expressed once both as a JPQL predicate (for searches,
 * so counts and pages agree) and as an in-memory check (for single-record reads).
 *
 * <ul>
 *   <li>super admin: PENDING and APPROVED, or exactly the requested bucket</li>
 *   <li>everyone else: APPROVED, plus their own PENDING and REJECTED listings</li>
 * </ul>
 */
public final class ListingVisibility {

    static final List<ReviewStatus> SUPER_ADMIN_DEFAULT = List.of(ReviewStatus.PENDING, ReviewStatus.APPROVED);
    static final List<ReviewStatus> OWN_UNPUBLISHED = List.of(ReviewStatus.PENDING, ReviewStatus.REJECTED);

    private ListingVisibility() {
    }

    public record Predicate(String jpql, Map<String, Object> params) {
    }

    /**
     * @param alias     JPQL alias of the listing entity
     * @param requested optional approval bucket filter
     */
    public static Predicate predicateFor(Actor viewer, ReviewStatus requested, String alias) {
        if (viewer.isAtLeast(UserRole.SUPER_ADMIN)) {
            if (requested != null) {
                return new Predicate(alias + ".approvalStatus = :visRequested", Map.of("visRequested", requested));
            }
            return new Predicate(alias + ".approvalStatus in (:visDefault)", Map.of("visDefault", SUPER_ADMIN_DEFAULT));
        }

        String base;
        Map<String, Object> params;
        if (viewer.isAnonymous()) {
            base = alias + ".approvalStatus = :visApproved";
            params = Map.of("visApproved", ReviewStatus.APPROVED);
        } else {
            base = "(" + alias + ".approvalStatus = :visApproved or (" + alias + ".agentId = :visViewer and "
                    + alias + ".approvalStatus in (:visOwn)))";
            params = Map.of(
                    "visApproved", ReviewStatus.APPROVED,
                    "visViewer", viewer.userId(),
                    "visOwn", OWN_UNPUBLISHED
            );
        }
        if (requested == null) {
            return new Predicate(base, params);
        }
        Map<String, Object> withRequested = new HashMap<>(params);
        withRequested.put("visRequested", requested);
        return new Predicate(base + " and " + alias + ".approvalStatus = :visRequested", Map.copyOf(withRequested));
    }

    public static boolean isVisible(Listing listing, Actor viewer) {
        ReviewStatus status = listing.getApprovalStatus();
        if (viewer.isAtLeast(UserRole.SUPER_ADMIN)) {
            return true;
        }
        if (status == ReviewStatus.APPROVED) {
            return true;
        }
        return viewer.is(listing.getAgentId()) && OWN_UNPUBLISHED.contains(status);
    }
}
