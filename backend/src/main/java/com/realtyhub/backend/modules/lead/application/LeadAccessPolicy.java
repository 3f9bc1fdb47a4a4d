package com.realtyhub.backend.modules.lead.application;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.lead.domain.Lead;

/**
 * The current assignee or any admin may work a lead.
 */
final class LeadAccessPolicy {

    private LeadAccessPolicy() {
    }

    static boolean canManage(Lead lead, Actor actor) {
        return actor.is(lead.getAssigneeId()) || actor.isAtLeast(UserRole.ADMIN);
    }

    static ProblemException forbidden() {
        return ProblemException.forbidden("lead.forbidden", "이 리드에 대한 권한이 없습니다.");
    }

    static ProblemException notFound() {
        return ProblemException.notFound("lead.not_found", "리드를 찾을 수 없습니다.");
    }
}
