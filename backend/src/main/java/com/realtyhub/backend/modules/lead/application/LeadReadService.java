package com.realtyhub.backend.modules.lead.application;

import java.util.EnumMap;
import java.util.Set;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageQuery;
import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;
import com.realtyhub.backend.modules.lead.infrastructure.persistence.LeadRepository;
import com.realtyhub.backend.modules.lead.infrastructure.persistence.LeadSearchCondition;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadResponse;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadStatsResponse;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class LeadReadService {

    static final Set<String> SORTABLE = Set.of("createdAt", "leadScore", "priority", "status", "lastContactedAt");
    static final Sort DEFAULT_SORT = Sort.by(Sort.Direction.DESC, "createdAt");

    private final LeadRepository leadRepository;
    private final RealtyhubProperties properties;

    public LeadReadService(LeadRepository leadRepository, RealtyhubProperties properties) {
        this.leadRepository = leadRepository;
        this.properties = properties;
    }

    /**
     * Admins see every lead matching the condition; everyone else only their own assigned leads.
     */
    public PageResponse<LeadResponse> list(LeadSearchCondition condition, Actor viewer, Integer page, Integer size, String sort) {
        LeadSearchCondition effective = viewer.isAtLeast(UserRole.ADMIN)
                ? condition
                : condition.restrictedTo(viewer.userId());
        return search(effective, page, size, sort);
    }

    public LeadResponse getById(UUID leadId, Actor viewer) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(LeadAccessPolicy::notFound);
        if (!LeadAccessPolicy.canManage(lead, viewer)) {
            throw LeadAccessPolicy.forbidden();
        }
        return LeadResponse.from(lead);
    }

    public PageResponse<LeadResponse> listByAssignee(UUID assigneeId, Actor viewer, Integer page, Integer size, String sort) {
        if (!viewer.is(assigneeId) && !viewer.isAtLeast(UserRole.ADMIN)) {
            throw LeadAccessPolicy.forbidden();
        }
        return search(LeadSearchCondition.assignedTo(assigneeId), page, size, sort);
    }

    public PageResponse<LeadResponse> listUnassigned(Integer page, Integer size, String sort) {
        return search(LeadSearchCondition.unassigned(), page, size, sort);
    }

    public LeadStatsResponse stats() {
        EnumMap<LeadStatus, Long> byStatus = new EnumMap<>(LeadStatus.class);
        for (LeadStatus status : LeadStatus.values()) {
            byStatus.put(status, 0L);
        }
        long total = 0;
        for (Object[] row : leadRepository.countByStatus()) {
            long count = ((Number) row[1]).longValue();
            byStatus.put((LeadStatus) row[0], count);
            total += count;
        }

        EnumMap<LeadSource, Long> bySource = new EnumMap<>(LeadSource.class);
        for (Object[] row : leadRepository.countBySource()) {
            bySource.put((LeadSource) row[0], ((Number) row[1]).longValue());
        }

        EnumMap<LeadPriority, Long> byPriority = new EnumMap<>(LeadPriority.class);
        for (Object[] row : leadRepository.countByPriority()) {
            byPriority.put((LeadPriority) row[0], ((Number) row[1]).longValue());
        }

        Double averageScore = leadRepository.averageLeadScore();
        return new LeadStatsResponse(
                total,
                byStatus,
                leadRepository.countUnassigned(),
                bySource,
                byPriority,
                averageScore == null ? 0L : Math.round(averageScore),
                conversionRate(byStatus.get(LeadStatus.CONVERTED), total)
        );
    }

    static long conversionRate(long converted, long total) {
        if (total == 0) {
            return 0;
        }
        return Math.round(100.0 * converted / total);
    }

    private PageResponse<LeadResponse> search(LeadSearchCondition condition, Integer page, Integer size, String sort) {
        PageQuery query = PageQuery.of(page, size, sort, SORTABLE, DEFAULT_SORT, properties.pagination());
        return PageResponse.from(leadRepository.search(condition, query.toPageable()), LeadResponse::from);
    }
}
