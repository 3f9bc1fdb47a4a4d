package com.realtyhub.backend.modules.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class ReviewWorkflowTest {

    private static final UUID REVIEWER = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    @Mock
    private AuditLogService auditLogService;

    private InMemoryWorkflow workflow;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
        workflow = new InMemoryWorkflow(auditLogService, clock);
    }

    @Test
    @DisplayName("대기 중인 요청을 승인하면 APPROVED로 바뀌고 감사 로그가 남는다")
    void approvePendingRecord() {
        UUID id = workflow.addPending();

        Reviewable reviewed = workflow.review(id, ReviewDecision.approve("looks good"), REVIEWER);

        assertThat(reviewed.status()).isEqualTo(ReviewStatus.APPROVED);
        assertThat(reviewed.reviewedBy()).isEqualTo(REVIEWER);
        assertThat(reviewed.reviewedAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T09:00:00Z"));
        assertThat(reviewed.reason()).isNull();
        assertThat(workflow.afterTransitionCalls.get()).isEqualTo(1);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo("RECORD_APPROVED");
        assertThat(captor.getValue().resourceKey()).isEqualTo(id.toString());
        assertThat(captor.getValue().actorUserId()).isEqualTo(REVIEWER);
    }

    @Test
    @DisplayName("반려 사유는 앞뒤 공백을 제거해 저장한다")
    void rejectStoresTrimmedReason() {
        UUID id = workflow.addPending();

        Reviewable reviewed = workflow.review(id, ReviewDecision.reject("  incomplete documents ", null), REVIEWER);

        assertThat(reviewed.status()).isEqualTo(ReviewStatus.REJECTED);
        assertThat(reviewed.reason()).isEqualTo("incomplete documents");
    }

    @Test
    @DisplayName("이미 처리된 요청을 다시 검토하면 409를 반환하고 부수효과가 없다")
    void secondReviewConflicts() {
        UUID id = workflow.addPending();
        workflow.review(id, ReviewDecision.approve(null), REVIEWER);

        assertThatThrownBy(() -> workflow.review(id, ReviewDecision.reject("too late", null), REVIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("review.already_processed");
                });
        assertThat(workflow.records.get(id).status()).isEqualTo(ReviewStatus.APPROVED);
        assertThat(workflow.afterTransitionCalls.get()).isEqualTo(1);
        verify(auditLogService, times(1)).record(any());
    }

    @Test
    @DisplayName("존재하지 않는 요청은 404를 반환한다")
    void missingRecordIsNotFound() {
        assertThatThrownBy(() -> workflow.review(UUID.randomUUID(), ReviewDecision.approve(null), REVIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("record.not_found");
                });
    }

    @Test
    @DisplayName("반려 사유가 비어 있으면 상태를 바꾸지 않고 400을 반환한다")
    void rejectWithoutReasonFails() {
        UUID id = workflow.addPending();

        assertThatThrownBy(() -> workflow.review(id, ReviewDecision.reject("   ", null), REVIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("review.reason_required");
                });
        assertThat(workflow.records.get(id).status()).isEqualTo(ReviewStatus.PENDING);
        assertThat(workflow.transitionCalls.get()).isZero();
    }

    @Test
    @DisplayName("반려 사유가 최대 길이를 넘으면 400을 반환한다")
    void rejectWithTooLongReasonFails() {
        UUID id = workflow.addPending();
        String reason = "x".repeat(501);

        assertThatThrownBy(() -> workflow.review(id, ReviewDecision.reject(reason, null), REVIEWER))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("review.reason_too_long"));
    }

    @Test
    @DisplayName("일괄 승인은 실패한 항목만 오류로 모으고 나머지는 처리한다")
    void bulkReviewCollectsPerItemErrors() {
        UUID first = workflow.addPending();
        UUID processed = workflow.addPending();
        UUID third = workflow.addPending();
        workflow.review(processed, ReviewDecision.approve(null), REVIEWER);

        BulkResult<Reviewable> result = workflow.reviewAll(List.of(first, processed, third), ReviewDecision.approve(null), REVIEWER);

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.succeeded()).extracting(Reviewable::id).containsExactly(first, third);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.id()).isEqualTo(processed);
            assertThat(error.code()).isEqualTo("review.already_processed");
        });
    }

    @Test
    @DisplayName("일괄 승인 대상에 없는 id가 섞여 있으면 그 항목만 찾을 수 없음 오류로 남는다")
    void bulkReviewReportsMissingId() {
        UUID first = workflow.addPending();
        UUID missing = UUID.randomUUID();
        UUID third = workflow.addPending();

        BulkResult<Reviewable> result = workflow.reviewAll(List.of(first, missing, third), ReviewDecision.approve(null), REVIEWER);

        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.succeeded()).extracting(Reviewable::id).containsExactly(first, third);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.id()).isEqualTo(missing);
            assertThat(error.code()).isEqualTo("record.not_found");
        });
    }

    @Test
    @DisplayName("일괄 반려에 사유가 없으면 어떤 항목도 처리하지 않는다")
    void bulkRejectWithoutReasonTouchesNothing() {
        UUID id = workflow.addPending();

        assertThatThrownBy(() -> workflow.reviewAll(List.of(id), ReviewDecision.reject(null, null), REVIEWER))
                .isInstanceOf(ProblemException.class);
        assertThat(workflow.transitionCalls.get()).isZero();
        verify(auditLogService, never()).record(any());
    }

    @Test
    @DisplayName("동시에 두 검토자가 처리하면 정확히 한 명만 성공한다")
    void concurrentReviewsHaveSingleWinner() throws Exception {
        UUID id = workflow.addPending();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Callable<String> approve = () -> attempt(start, id, ReviewDecision.approve(null));
            Callable<String> reject = () -> attempt(start, id, ReviewDecision.reject("duplicate", null));
            Future<String> first = executor.submit(approve);
            Future<String> second = executor.submit(reject);
            start.countDown();

            List<String> outcomes = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));

            assertThat(outcomes).containsOnlyOnce("ok");
            assertThat(outcomes).contains("review.already_processed");
            assertThat(workflow.afterTransitionCalls.get()).isEqualTo(1);
            assertThat(workflow.records.get(id).status()).isNotEqualTo(ReviewStatus.PENDING);
        } finally {
            executor.shutdownNow();
        }
    }

    private String attempt(CountDownLatch start, UUID id, ReviewDecision decision) throws InterruptedException {
        start.await();
        try {
            workflow.review(id, decision, REVIEWER);
            return "ok";
        } catch (ProblemException ex) {
            return ex.getCode();
        }
    }

    record Reviewable(UUID id, ReviewStatus status, UUID reviewedBy, OffsetDateTime reviewedAt, String reason) {
    }

    /**
     * Stores records in a map; {@link ConcurrentHashMap#replace(Object, Object, Object)} plays the role of
     * the conditional update.
     */
    static class InMemoryWorkflow extends ReviewWorkflow<Reviewable> {

        final Map<UUID, Reviewable> records = new ConcurrentHashMap<>();
        final AtomicInteger transitionCalls = new AtomicInteger();
        final AtomicInteger afterTransitionCalls = new AtomicInteger();

        InMemoryWorkflow(AuditLogService auditLogService, Clock clock) {
            super(TransactionOperations.withoutTransaction(), auditLogService,
                    TestProperties.defaults().review(), clock);
        }

        UUID addPending() {
            UUID id = UUID.randomUUID();
            records.put(id, new Reviewable(id, ReviewStatus.PENDING, null, null, null));
            return id;
        }

        @Override
        protected String resourceType() {
            return "RECORD";
        }

        @Override
        protected int transitionIfPending(UUID targetId, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
            transitionCalls.incrementAndGet();
            Reviewable current = records.get(targetId);
            if (current == null || current.status() != ReviewStatus.PENDING) {
                return 0;
            }
            Reviewable next = new Reviewable(targetId, decision.outcome(), reviewerId, now, decision.storedReason());
            return records.replace(targetId, current, next) ? 1 : 0;
        }

        @Override
        protected boolean exists(UUID targetId) {
            return records.containsKey(targetId);
        }

        @Override
        protected Reviewable load(UUID targetId) {
            return records.get(targetId);
        }

        @Override
        protected ProblemException notFound(UUID targetId) {
            return ProblemException.notFound("record.not_found", "not found");
        }

        @Override
        protected void afterTransition(Reviewable reviewed, ReviewDecision decision, UUID reviewerId, OffsetDateTime now) {
            afterTransitionCalls.incrementAndGet();
        }
    }
}
