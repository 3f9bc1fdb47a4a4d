package com.realtyhub.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.realtyhub.backend.global.web.RequestIdFilter;
import com.realtyhub.backend.modules.audit.domain.AuditLog;
import com.realtyhub.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    /**
     * Joins the caller's transaction so the audit row commits or rolls back with the change it describes.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setCorrelationId(command.correlationId() != null
                ? command.correlationId()
                : RequestIdFilter.currentRequestId());
        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String correlationId,
            Map<String, Object> detail
    ) {

        public static AuditLogCommand of(String actionType, String resourceType, Object resourceKey,
                                         UUID actorUserId, Map<String, Object> detail) {
            return new AuditLogCommand(actionType, resourceType, String.valueOf(resourceKey), actorUserId, null, detail);
        }
    }
}
