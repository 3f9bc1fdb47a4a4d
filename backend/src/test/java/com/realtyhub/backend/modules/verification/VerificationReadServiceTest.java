package com.realtyhub.backend.modules.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import com.realtyhub.backend.modules.verification.application.VerificationReadService;
import com.realtyhub.backend.modules.verification.infrastructure.VerificationRequestRepository;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VerificationReadServiceTest {

    @Mock
    private VerificationRequestRepository requestRepository;

    @Test
    @DisplayName("오늘 통계는 설정된 시간대의 자정부터 집계하고 평균 처리 시간은 시간 단위로 반올림한다")
    void statsUseConfiguredZoneMidnight() {
        // 16:30 UTC is already 01:30 the next day in Seoul
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T16:30:00Z"), ZoneOffset.UTC);
        VerificationReadService service = new VerificationReadService(requestRepository,
                TestProperties.with(ZoneId.of("Asia/Seoul"), false), clock);
        OffsetDateTime seoulMidnight = OffsetDateTime.parse("2025-03-02T00:00:00+09:00");

        when(requestRepository.countByStatus()).thenReturn(List.of(
                new Object[]{ReviewStatus.PENDING, 3L},
                new Object[]{ReviewStatus.APPROVED, 5L},
                new Object[]{ReviewStatus.REJECTED, 2L}
        ));
        when(requestRepository.countByStatusAndRequestedAtGreaterThanEqual(ReviewStatus.PENDING, seoulMidnight)).thenReturn(1L);
        when(requestRepository.countByStatusAndReviewedAtGreaterThanEqual(ReviewStatus.APPROVED, seoulMidnight)).thenReturn(2L);
        when(requestRepository.countByStatusAndReviewedAtGreaterThanEqual(ReviewStatus.REJECTED, seoulMidnight)).thenReturn(0L);
        when(requestRepository.averageProcessingSeconds()).thenReturn(5400.0);

        VerificationStatsResponse stats = service.stats();

        assertThat(stats.total()).isEqualTo(10);
        assertThat(stats.pending()).isEqualTo(3);
        assertThat(stats.approved()).isEqualTo(5);
        assertThat(stats.rejected()).isEqualTo(2);
        assertThat(stats.pendingToday()).isEqualTo(1);
        assertThat(stats.approvedToday()).isEqualTo(2);
        assertThat(stats.rejectedToday()).isZero();
        assertThat(stats.averageProcessingHours()).isEqualTo(2);
    }

    @Test
    @DisplayName("처리된 요청이 없으면 평균 처리 시간은 0이다")
    void emptyStats() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
        VerificationReadService service = new VerificationReadService(requestRepository, TestProperties.defaults(), clock);
        when(requestRepository.countByStatus()).thenReturn(List.of());
        when(requestRepository.averageProcessingSeconds()).thenReturn(null);

        VerificationStatsResponse stats = service.stats();

        assertThat(stats.total()).isZero();
        assertThat(stats.averageProcessingHours()).isZero();
    }
}
