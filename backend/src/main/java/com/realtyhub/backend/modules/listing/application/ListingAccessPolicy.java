package com.realtyhub.backend.modules.listing.application;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.listing.domain.Listing;

/**
 * Who may change a listing. Editing is narrower than deleting: an ADMIN who is not the agent may
 * delete a listing or manage its images but may not edit its fields.
 */
final class ListingAccessPolicy {

    private ListingAccessPolicy() {
    }

    static boolean canEdit(Listing listing, Actor actor) {
        return actor.is(listing.getAgentId()) || actor.role() == UserRole.SUPER_ADMIN;
    }

    static boolean canDelete(Listing listing, Actor actor) {
        return actor.is(listing.getAgentId()) || actor.isAtLeast(UserRole.ADMIN);
    }

    static boolean canManageImages(Listing listing, Actor actor) {
        return canDelete(listing, actor);
    }

    static boolean canSeeOwnerContact(Listing listing, Actor actor) {
        return actor.is(listing.getAgentId()) || actor.isAtLeast(UserRole.ADMIN);
    }

    static ProblemException forbidden() {
        return ProblemException.forbidden("listing.forbidden", "이 매물에 대한 권한이 없습니다.");
    }

    static ProblemException notFound() {
        return ProblemException.notFound("listing.not_found", "매물을 찾을 수 없습니다.");
    }
}
