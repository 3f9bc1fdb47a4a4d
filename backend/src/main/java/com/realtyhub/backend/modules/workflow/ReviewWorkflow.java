package com.realtyhub.backend.modules.workflow;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Template for records that move exactly once from {@link ReviewStatus#PENDING} to a terminal status.
 *
 * <p>The transition is a single conditional update ({@code ... where status = PENDING}); its affected
 * row count decides the winner when two reviewers race, so no read-then-write window exists.
 * A zero count is reported as not-found when the record is absent, otherwise as already processed.
 * Side effects in {@link #afterTransition} and the audit row share the transition's transaction.
 *
 * @param <T> reviewed entity type
 */
public abstract class ReviewWorkflow<T> {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final TransactionOperations transactionOperations;
    private final AuditLogService auditLogService;
    private final RealtyhubProperties.Review limits;
    private final Clock clock;

    protected ReviewWorkflow(
            TransactionOperations transactionOperations,
            AuditLogService auditLogService,
            RealtyhubProperties.Review limits,
            Clock clock
    ) {
        this.transactionOperations = transactionOperations;
        this.auditLogService = auditLogService;
        this.limits = limits;
        this.clock = clock;
    }

    public T review(UUID targetId, ReviewDecision decision, UUID reviewerId) {
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(reviewerId, "reviewerId is required");
        validate(decision);
        try {
            T reviewed = transactionOperations.execute(status -> applyTransition(targetId, decision, reviewerId));
            log.info("{} {} succeeded: id={}, reviewer={}", resourceType(), decision.verdict(), targetId, reviewerId);
            return reviewed;
        } catch (ProblemException ex) {
            log.warn("{} {} failed: id={}, reviewer={}, code={}",
                    resourceType(), decision.verdict(), targetId, reviewerId, ex.getCode());
            throw ex;
        }
    }

    /**
     * Reviews each id in input order, each in its own transaction. An invalid decision (e.g. missing
     * rejection reason) fails the whole call before any item is touched.
     */
    public BulkResult<T> reviewAll(List<UUID> targetIds, ReviewDecision decision, UUID reviewerId) {
        Objects.requireNonNull(targetIds, "targetIds is required");
        validate(decision);
        BulkResult<T> result = BulkOperations.forEach(targetIds, id -> review(id, decision, reviewerId));
        log.info("{} bulk {} finished: reviewer={}, succeeded={}, failed={}",
                resourceType(), decision.verdict(), reviewerId, result.successCount(), result.failureCount());
        return result;
    }

    private T applyTransition(UUID targetId, ReviewDecision decision, UUID reviewerId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = transitionIfPending(targetId, decision, reviewerId, now);
        if (updated == 0) {
            if (!exists(targetId)) {
                throw notFound(targetId);
            }
            throw ProblemException.conflict("review.already_processed", "이미 처리된 요청입니다.");
        }
        T reviewed = load(targetId);
        afterTransition(reviewed, decision, reviewerId, now);
        auditLogService.record(AuditLogCommand.of(
                resourceType() + "_" + decision.outcome().name(),
                resourceType(),
                targetId,
                reviewerId,
                auditDetail(decision)
        ));
        return reviewed;
    }

    void validate(ReviewDecision decision) {
        Objects.requireNonNull(decision, "decision is required");
        if (!decision.isApproval() && (decision.reason() == null || decision.reason().isBlank())) {
            throw ProblemException.badRequest("review.reason_required", "반려 사유를 입력해야 합니다.");
        }
        if (decision.reason() != null && decision.reason().trim().length() > limits.reasonMaxLength()) {
            throw ProblemException.badRequest("review.reason_too_long",
                    "반려 사유는 " + limits.reasonMaxLength() + "자를 넘을 수 없습니다.");
        }
        if (decision.notes() != null && decision.notes().length() > limits.notesMaxLength()) {
            throw ProblemException.badRequest("review.notes_too_long",
                    "검토 메모는 " + limits.notesMaxLength() + "자를 넘을 수 없습니다.");
        }
    }

    private Map<String, Object> auditDetail(ReviewDecision decision) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("outcome", decision.outcome().name());
        if (decision.storedReason() != null) {
            detail.put("reason", decision.storedReason());
        }
        if (decision.notes() != null) {
            detail.put("notes", decision.notes());
        }
        return detail;
    }

    /**
     * Short upper-case name used in logs and as audit resource type, e.g. {@code VERIFICATION_REQUEST}.
     */
    protected abstract String resourceType();

    /**
     * Moves the record to {@code decision.outcome()} only if it is still pending.
     *
     * @return number of rows changed (0 or 1)
     */
    protected abstract int transitionIfPending(UUID targetId, ReviewDecision decision, UUID reviewerId, OffsetDateTime now);

    protected abstract boolean exists(UUID targetId);

    protected abstract T load(UUID targetId);

    protected abstract ProblemException notFound(UUID targetId);

    protected void afterTransition(T reviewed, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
    }
}
