package com.realtyhub.backend.modules.lead.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.Actor;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;
import com.realtyhub.backend.modules.lead.infrastructure.persistence.LeadRepository;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadCreateRequest;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadResponse;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadUpdateRequest;
import com.realtyhub.backend.modules.workflow.BulkOperations;
import com.realtyhub.backend.modules.workflow.BulkResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LeadService {

    private static final Logger log = LoggerFactory.getLogger(LeadService.class);
    private static final String RESOURCE_TYPE = "LEAD";

    private final LeadRepository leadRepository;
    private final AppUserRepository appUserRepository;
    private final LeadScoringPolicy scoringPolicy;
    private final AuditLogService auditLogService;
    private final RealtyhubProperties properties;
    private final Clock clock;

    public LeadService(
            LeadRepository leadRepository,
            AppUserRepository appUserRepository,
            LeadScoringPolicy scoringPolicy,
            AuditLogService auditLogService,
            RealtyhubProperties properties,
            Clock clock
    ) {
        this.leadRepository = leadRepository;
        this.appUserRepository = appUserRepository;
        this.scoringPolicy = scoringPolicy;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Public inbound submission. The score is computed once here and stored with the lead.
     */
    public LeadResponse create(LeadCreateRequest request, Actor actor) {
        Lead lead = new Lead();
        lead.setName(trimToNull(request.name()));
        lead.setPhoneNumber(PhoneNumbers.normalize(request.phoneNumber()));
        lead.setEmail(request.email());
        lead.setMessage(request.message());
        lead.setSource(request.source() != null ? request.source() : LeadSource.LANDING_PAGE);
        lead.setPriority(request.priority() != null ? request.priority() : LeadPriority.MEDIUM);
        if (request.tags() != null) {
            lead.replaceTags(request.tags());
        }
        if (request.propertyInterests() != null) {
            lead.replacePropertyInterests(request.propertyInterests());
        }
        if (request.budget() != null) {
            lead.setBudget(request.budget().toBudgetRange());
        }
        if (request.preferredLocation() != null) {
            lead.setPreferredLocation(request.preferredLocation().toPreferredLocation());
        }
        lead.setLeadScore(scoringPolicy.score(lead));

        Lead saved = leadRepository.save(lead);
        auditLogService.record(AuditLogCommand.of("LEAD_CREATE", RESOURCE_TYPE, saved.getId(), actor.userId(),
                Map.of("source", saved.getSource().name(), "leadScore", saved.getLeadScore())));
        log.info("Lead created: leadId={}, source={}, score={}", saved.getId(), saved.getSource(), saved.getLeadScore());
        return LeadResponse.from(saved);
    }

    public LeadResponse update(UUID leadId, LeadUpdateRequest request, Actor actor) {
        Lead lead = findManageable(leadId, actor);

        Map<String, Object> changed = new LinkedHashMap<>();
        if (request.name() != null) {
            lead.setName(trimToNull(request.name()));
            changed.put("name", true);
        }
        if (request.email() != null) {
            lead.setEmail(request.email());
            changed.put("email", true);
        }
        if (request.message() != null) {
            lead.setMessage(request.message());
            changed.put("message", true);
        }
        if (request.priority() != null) {
            lead.setPriority(request.priority());
            changed.put("priority", request.priority().name());
        }
        if (request.notes() != null) {
            lead.setNotes(request.notes());
            changed.put("notes", true);
        }
        if (request.tags() != null) {
            lead.replaceTags(request.tags());
            changed.put("tags", request.tags().size());
        }
        if (request.propertyInterests() != null) {
            lead.replacePropertyInterests(request.propertyInterests());
            changed.put("propertyInterests", request.propertyInterests().size());
        }
        if (request.budget() != null) {
            lead.setBudget(request.budget().toBudgetRange());
            changed.put("budget", true);
        }
        if (request.preferredLocation() != null) {
            lead.setPreferredLocation(request.preferredLocation().toPreferredLocation());
            changed.put("preferredLocation", true);
        }
        if (request.conversionProbability() != null) {
            lead.setConversionProbability(request.conversionProbability());
            changed.put("conversionProbability", lead.getConversionProbability());
        }
        if (properties.lead().rescoreOnUpdate()) {
            int previous = lead.getLeadScore();
            lead.setLeadScore(scoringPolicy.score(lead));
            if (previous != lead.getLeadScore()) {
                changed.put("leadScore", lead.getLeadScore());
            }
        }

        Lead saved = leadRepository.save(lead);
        auditLogService.record(AuditLogCommand.of("LEAD_UPDATE", RESOURCE_TYPE, leadId, actor.userId(), changed));
        log.info("Lead updated: leadId={}, actor={}, fields={}", leadId, actor.userId(), changed.keySet());
        return LeadResponse.from(saved);
    }

    public LeadResponse updateStatus(UUID leadId, LeadStatus status, Actor actor) {
        Lead lead = findManageable(leadId, actor);
        LeadStatus previous = lead.getStatus();
        lead.changeStatus(status, OffsetDateTime.now(clock));

        Lead saved = leadRepository.save(lead);
        auditLogService.record(AuditLogCommand.of("LEAD_STATUS_CHANGE", RESOURCE_TYPE, leadId, actor.userId(),
                Map.of("from", previous.name(), "to", status.name())));
        log.info("Lead status changed: leadId={}, {} -> {}, actor={}", leadId, previous, status, actor.userId());
        return LeadResponse.from(saved);
    }

    /**
     * Any existing user may be the assignee. The route restricts who may call this.
     */
    public LeadResponse assign(UUID leadId, UUID assigneeId, UUID assignerId) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(LeadAccessPolicy::notFound);
        AppUser assignee = findAssignee(assigneeId);
        return LeadResponse.from(assignTo(lead, assignee, assignerId));
    }

    public LeadResponse unassign(UUID leadId, Actor actor) {
        Lead lead = findManageable(leadId, actor);
        UUID previousAssignee = lead.getAssigneeId();
        lead.unassign();

        Lead saved = leadRepository.save(lead);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("previousAssignee", previousAssignee);
        auditLogService.record(AuditLogCommand.of("LEAD_UNASSIGN", RESOURCE_TYPE, leadId, actor.userId(), detail));
        log.info("Lead unassigned: leadId={}, previousAssignee={}, actor={}", leadId, previousAssignee, actor.userId());
        return LeadResponse.from(saved);
    }

    /**
     * Assigns each lead independently. A missing assignee fails the whole call; a missing lead is
     * reported in the result and the rest still proceed.
     */
    public BulkResult<LeadResponse> bulkAssign(List<UUID> leadIds, UUID assigneeId, UUID assignerId) {
        AppUser assignee = findAssignee(assigneeId);
        BulkResult<LeadResponse> result = BulkOperations.forEach(leadIds, leadId -> {
            Lead lead = leadRepository.findById(leadId).orElseThrow(LeadAccessPolicy::notFound);
            return LeadResponse.from(assignTo(lead, assignee, assignerId));
        });
        log.info("Bulk lead assignment: assignee={}, assigner={}, succeeded={}, failed={}",
                assigneeId, assignerId, result.successCount(), result.failureCount());
        return result;
    }

    private Lead assignTo(Lead lead, AppUser assignee, UUID assignerId) {
        lead.assignTo(assignee, assignerId, OffsetDateTime.now(clock));
        Lead saved = leadRepository.save(lead);
        auditLogService.record(AuditLogCommand.of("LEAD_ASSIGN", RESOURCE_TYPE, saved.getId(), assignerId,
                Map.of("assignee", assignee.getId().toString())));
        log.info("Lead assigned: leadId={}, assignee={}, assigner={}", saved.getId(), assignee.getId(), assignerId);
        return saved;
    }

    private AppUser findAssignee(UUID assigneeId) {
        return appUserRepository.findById(assigneeId)
                .orElseThrow(() -> ProblemException.notFound("lead.assignee_not_found", "담당자로 지정할 사용자를 찾을 수 없습니다."));
    }

    private Lead findManageable(UUID leadId, Actor actor) {
        Lead lead = leadRepository.findById(leadId).orElseThrow(LeadAccessPolicy::notFound);
        if (!LeadAccessPolicy.canManage(lead, actor)) {
            log.warn("Lead access denied: leadId={}, actor={}", leadId, actor.userId());
            throw LeadAccessPolicy.forbidden();
        }
        return lead;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
