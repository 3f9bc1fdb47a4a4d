package com.realtyhub.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.verification.domain.VerificationRequest;
import com.realtyhub.backend.modules.verification.infrastructure.VerificationRequestRepository;
import com.realtyhub.backend.modules.workflow.ReviewDecision;
import com.realtyhub.backend.modules.workflow.ReviewWorkflow;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Review of account verification requests. The request transition and the mirrored identity
 * update commit together; the identity is never updated for a request that lost the race.
 */
@Component
public class VerificationReviewWorkflow extends ReviewWorkflow<VerificationRequest> {

    private final VerificationRequestRepository requestRepository;
    private final AppUserRepository appUserRepository;

    public VerificationReviewWorkflow(
            VerificationRequestRepository requestRepository,
            AppUserRepository appUserRepository,
            TransactionOperations transactionOperations,
            AuditLogService auditLogService,
            RealtyhubProperties properties,
            Clock clock
    ) {
        super(transactionOperations, auditLogService, properties.review(), clock);
        this.requestRepository = requestRepository;
        this.appUserRepository = appUserRepository;
    }

    @Override
    protected String resourceType() {
        return "VERIFICATION_REQUEST";
    }

    @Override
    protected int transitionIfPending(UUID targetId, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
        return requestRepository.transitionIfPending(
                targetId, decision.outcome(), reviewerId, now, decision.notes(), decision.storedReason());
    }

    @Override
    protected boolean exists(UUID targetId) {
        return requestRepository.existsById(targetId);
    }

    @Override
    protected VerificationRequest load(UUID targetId) {
        return requestRepository.findById(targetId).orElseThrow(() -> notFound(targetId));
    }

    @Override
    protected ProblemException notFound(UUID targetId) {
        return ProblemException.notFound("verification.not_found", "승인 요청을 찾을 수 없습니다.");
    }

    @Override
    protected void afterTransition(VerificationRequest request, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
        appUserRepository.applyVerificationOutcome(
                request.getUserId(),
                decision.outcome(),
                decision.isApproval(),
                reviewerId,
                now,
                decision.storedReason()
        );
    }
}
