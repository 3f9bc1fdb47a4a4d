package com.realtyhub.backend.modules.lead.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadRepository extends JpaRepository<Lead, UUID> {

    @EntityGraph(attributePaths = "assignee")
    @Query("""
            select l
              from Lead l
             where (:status is null or l.status = :status)
               and (:priority is null or l.priority = :priority)
               and (:source is null or l.source = :source)
               and (:assigneeId is null or l.assigneeId = :assigneeId)
               and (:unassignedOnly = false or l.assigneeId is null)
               and (:minScore is null or l.leadScore >= :minScore)
               and (:maxScore is null or l.leadScore <= :maxScore)
               and (:createdFrom is null or l.createdAt >= :createdFrom)
               and (:createdTo is null or l.createdAt < :createdTo)
               and (
                     :searchPattern is null
                  or lower(l.name) like :searchPattern
                  or l.phoneNumber like :searchPattern
                  or lower(l.email) like :searchPattern
                  or lower(l.message) like :searchPattern
               )
            """)
    Page<Lead> search(
            @Param("status") LeadStatus status,
            @Param("priority") LeadPriority priority,
            @Param("source") LeadSource source,
            @Param("assigneeId") UUID assigneeId,
            @Param("unassignedOnly") boolean unassignedOnly,
            @Param("minScore") Integer minScore,
            @Param("maxScore") Integer maxScore,
            @Param("createdFrom") OffsetDateTime createdFrom,
            @Param("createdTo") OffsetDateTime createdTo,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    default Page<Lead> search(LeadSearchCondition condition, Pageable pageable) {
        return search(
                condition.status(),
                condition.priority(),
                condition.source(),
                condition.assigneeId(),
                condition.unassignedOnly(),
                condition.minScore(),
                condition.maxScore(),
                condition.createdFrom(),
                condition.createdTo(),
                condition.searchPattern(),
                pageable
        );
    }

    @Query("select l.status, count(l) from Lead l group by l.status")
    List<Object[]> countByStatus();

    @Query("select l.source, count(l) from Lead l group by l.source")
    List<Object[]> countBySource();

    @Query("select l.priority, count(l) from Lead l group by l.priority")
    List<Object[]> countByPriority();

    @Query("select count(l) from Lead l where l.assigneeId is null")
    long countUnassigned();

    @Query("select avg(l.leadScore) from Lead l")
    Double averageLeadScore();
}
