package com.realtyhub.backend.modules.verification.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageQuery;
import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.verification.infrastructure.VerificationRequestRepository;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationRequestResponse;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class VerificationReadService {

    private static final Set<String> SORTABLE = Set.of("requestedAt", "reviewedAt");
    private static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "requestedAt");
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final VerificationRequestRepository requestRepository;
    private final RealtyhubProperties properties;
    private final Clock clock;

    public VerificationReadService(
            VerificationRequestRepository requestRepository,
            RealtyhubProperties properties,
            Clock clock
    ) {
        this.requestRepository = requestRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public PageResponse<VerificationRequestResponse> list(
            ReviewStatus status,
            String search,
            LocalDate dateFrom,
            LocalDate dateTo,
            Integer page,
            Integer size,
            String sort
    ) {
        PageQuery query = PageQuery.of(page, size, sort, SORTABLE, DEFAULT_SORT, properties.pagination());
        ZoneId zone = properties.timeZone();
        OffsetDateTime from = dateFrom == null ? null : dateFrom.atStartOfDay(zone).toOffsetDateTime();
        OffsetDateTime to = dateTo == null ? null : dateTo.plusDays(1).atStartOfDay(zone).toOffsetDateTime();
        return PageResponse.from(
                requestRepository.search(status, from, to, toSearchPattern(search), query.toPageable()),
                VerificationRequestResponse::from
        );
    }

    public PageResponse<VerificationRequestResponse> listPending(Integer page, Integer size) {
        PageQuery query = PageQuery.of(page, size, null, SORTABLE, DEFAULT_SORT, properties.pagination());
        return PageResponse.from(
                requestRepository.findByStatus(ReviewStatus.PENDING, query.toPageable()),
                VerificationRequestResponse::from
        );
    }

    public VerificationRequestResponse getById(UUID requestId) {
        return requestRepository.findById(requestId)
                .map(VerificationRequestResponse::from)
                .orElseThrow(() -> ProblemException.notFound("verification.not_found", "승인 요청을 찾을 수 없습니다."));
    }

    public VerificationRequestResponse getByUserId(UUID userId) {
        return requestRepository.findByUserId(userId)
                .map(VerificationRequestResponse::from)
                .orElseThrow(() -> ProblemException.notFound("verification.not_found", "승인 요청을 찾을 수 없습니다."));
    }

    /**
     * "Today" starts at local midnight in {@code realtyhub.time-zone}.
     */
    public VerificationStatsResponse stats() {
        Map<ReviewStatus, Long> counts = new EnumMap<>(ReviewStatus.class);
        for (Object[] row : requestRepository.countByStatus()) {
            counts.put((ReviewStatus) row[0], ((Number) row[1]).longValue());
        }
        long pending = counts.getOrDefault(ReviewStatus.PENDING, 0L);
        long approved = counts.getOrDefault(ReviewStatus.APPROVED, 0L);
        long rejected = counts.getOrDefault(ReviewStatus.REJECTED, 0L);

        ZoneId zone = properties.timeZone();
        OffsetDateTime startOfToday = LocalDate.now(clock.withZone(zone)).atStartOfDay(zone).toOffsetDateTime();

        Double averageSeconds = requestRepository.averageProcessingSeconds();
        long averageHours = averageSeconds == null ? 0L : Math.round(averageSeconds / SECONDS_PER_HOUR);

        return new VerificationStatsResponse(
                pending + approved + rejected,
                pending,
                approved,
                rejected,
                requestRepository.countByStatusAndRequestedAtGreaterThanEqual(ReviewStatus.PENDING, startOfToday),
                requestRepository.countByStatusAndReviewedAtGreaterThanEqual(ReviewStatus.APPROVED, startOfToday),
                requestRepository.countByStatusAndReviewedAtGreaterThanEqual(ReviewStatus.REJECTED, startOfToday),
                averageHours
        );
    }

    private static String toSearchPattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        return "%" + search.trim().toLowerCase() + "%";
    }
}
