package com.realtyhub.backend.modules.lead.presentation;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;
import java.util.function.Function;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.security.SecurityUtils;
import com.realtyhub.backend.modules.lead.application.LeadReadService;
import com.realtyhub.backend.modules.lead.application.LeadService;
import com.realtyhub.backend.modules.lead.domain.LeadPriority;
import com.realtyhub.backend.modules.lead.domain.LeadSource;
import com.realtyhub.backend.modules.lead.domain.LeadStatus;
import com.realtyhub.backend.modules.lead.infrastructure.persistence.LeadSearchCondition;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadAssignRequest;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadBulkAssignRequest;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadCreateRequest;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadResponse;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadStatsResponse;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadStatusRequest;
import com.realtyhub.backend.modules.lead.presentation.dto.LeadUpdateRequest;
import com.realtyhub.backend.modules.workflow.presentation.dto.BulkResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/leads")
public class LeadController {

    private final LeadService leadService;
    private final LeadReadService leadReadService;
    private final ZoneId zoneId;

    public LeadController(LeadService leadService, LeadReadService leadReadService, RealtyhubProperties properties) {
        this.leadService = leadService;
        this.leadReadService = leadReadService;
        this.zoneId = properties.timeZone();
    }

    @Operation(summary = "문의 접수", description = "로그인 없이 접수할 수 있으며 접수 시점에 리드 점수가 계산된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "접수 완료"),
            @ApiResponse(responseCode = "400", description = "전화번호 형식 오류")
    })
    @PostMapping
    public ResponseEntity<LeadResponse> create(@Valid @RequestBody LeadCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(leadService.create(request, SecurityUtils.currentActorOrAnonymous()));
    }

    @Operation(summary = "리드 목록 조회", description = "관리자가 아니면 본인에게 배정된 리드만 조회된다.")
    @GetMapping
    public ResponseEntity<PageResponse<LeadResponse>> list(
            @RequestParam(name = "status", required = false) LeadStatus status,
            @RequestParam(name = "priority", required = false) LeadPriority priority,
            @RequestParam(name = "source", required = false) LeadSource source,
            @RequestParam(name = "assigneeId", required = false) UUID assigneeId,
            @RequestParam(name = "unassigned", defaultValue = "false") boolean unassignedOnly,
            @RequestParam(name = "minScore", required = false) Integer minScore,
            @RequestParam(name = "maxScore", required = false) Integer maxScore,
            @RequestParam(name = "dateFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "dateTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        LeadSearchCondition condition = new LeadSearchCondition(
                status,
                priority,
                source,
                assigneeId,
                unassignedOnly,
                minScore,
                maxScore,
                startOfDay(dateFrom),
                dateTo == null ? null : startOfDay(dateTo.plusDays(1)),
                search
        );
        return ResponseEntity.ok(leadReadService.list(condition, SecurityUtils.currentActor(), page, size, sort));
    }

    @Operation(summary = "리드 통계")
    @GetMapping("/stats")
    public ResponseEntity<LeadStatsResponse> stats() {
        return ResponseEntity.ok(leadReadService.stats());
    }

    @GetMapping("/unassigned")
    public ResponseEntity<PageResponse<LeadResponse>> unassigned(
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(leadReadService.listUnassigned(page, size, sort));
    }

    @GetMapping("/assignee/{assigneeId}")
    public ResponseEntity<PageResponse<LeadResponse>> byAssignee(
            @PathVariable("assigneeId") UUID assigneeId,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(leadReadService.listByAssignee(assigneeId, SecurityUtils.currentActor(), page, size, sort));
    }

    @GetMapping("/{leadId}")
    public ResponseEntity<LeadResponse> get(@PathVariable("leadId") UUID leadId) {
        return ResponseEntity.ok(leadReadService.getById(leadId, SecurityUtils.currentActor()));
    }

    @Operation(summary = "리드 수정", description = "담당자 또는 관리자만 수정할 수 있다.")
    @PutMapping("/{leadId}")
    public ResponseEntity<LeadResponse> update(
            @PathVariable("leadId") UUID leadId,
            @Valid @RequestBody LeadUpdateRequest request
    ) {
        return ResponseEntity.ok(leadService.update(leadId, request, SecurityUtils.currentActor()));
    }

    @Operation(summary = "리드 상태 변경", description = "CONTACTED로 변경하면 최근 연락 시각이 갱신된다.")
    @PutMapping("/{leadId}/status")
    public ResponseEntity<LeadResponse> updateStatus(
            @PathVariable("leadId") UUID leadId,
            @Valid @RequestBody LeadStatusRequest request
    ) {
        return ResponseEntity.ok(leadService.updateStatus(leadId, request.status(), SecurityUtils.currentActor()));
    }

    @Operation(summary = "리드 담당자 배정")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "배정 완료"),
            @ApiResponse(responseCode = "404", description = "리드 또는 담당자 없음")
    })
    @PutMapping("/{leadId}/assign")
    public ResponseEntity<LeadResponse> assign(
            @PathVariable("leadId") UUID leadId,
            @Valid @RequestBody LeadAssignRequest request
    ) {
        return ResponseEntity.ok(leadService.assign(leadId, request.assigneeId(), SecurityUtils.getCurrentUserId()));
    }

    @PutMapping("/{leadId}/unassign")
    public ResponseEntity<LeadResponse> unassign(@PathVariable("leadId") UUID leadId) {
        return ResponseEntity.ok(leadService.unassign(leadId, SecurityUtils.currentActor()));
    }

    @Operation(summary = "리드 일괄 배정", description = "실패한 항목은 건너뛰고 결과에 사유를 담는다.")
    @PostMapping("/bulk-assign")
    public ResponseEntity<BulkResponse<LeadResponse>> bulkAssign(@Valid @RequestBody LeadBulkAssignRequest request) {
        return ResponseEntity.ok(BulkResponse.from(
                leadService.bulkAssign(request.leadIds(), request.assigneeId(), SecurityUtils.getCurrentUserId()),
                Function.identity()));
    }

    private OffsetDateTime startOfDay(LocalDate date) {
        return date == null ? null : date.atStartOfDay(zoneId).toOffsetDateTime();
    }
}
