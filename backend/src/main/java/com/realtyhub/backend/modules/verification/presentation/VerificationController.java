package com.realtyhub.backend.modules.verification.presentation;

import java.time.LocalDate;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.security.SecurityUtils;
import com.realtyhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.realtyhub.backend.modules.verification.application.VerificationReadService;
import com.realtyhub.backend.modules.verification.application.VerificationService;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationRequestResponse;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationStatsResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;
import com.realtyhub.backend.modules.workflow.presentation.dto.ApproveRequest;
import com.realtyhub.backend.modules.workflow.presentation.dto.BulkResponse;
import com.realtyhub.backend.modules.workflow.presentation.dto.BulkReviewRequest;
import com.realtyhub.backend.modules.workflow.presentation.dto.RejectRequest;

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
@RequestMapping("/verifications")
public class VerificationController {

    private final VerificationService verificationService;
    private final VerificationReadService verificationReadService;

    public VerificationController(
            VerificationService verificationService,
            VerificationReadService verificationReadService
    ) {
        this.verificationService = verificationService;
        this.verificationReadService = verificationReadService;
    }

    @Operation(summary = "가입 승인 요청 제출", description = "대기 상태의 계정과 승인 요청을 함께 생성한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "요청 생성"),
            @ApiResponse(responseCode = "409", description = "이미 등록된 이메일")
    })
    @PostMapping("/request")
    public ResponseEntity<VerificationRequestResponse> submit(@Valid @RequestBody RegisterRequest request) {
        VerificationRequestResponse response = verificationService.createRequest(request.toCandidateProfile());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "승인 요청 목록 조회")
    @GetMapping
    public ResponseEntity<PageResponse<VerificationRequestResponse>> list(
            @RequestParam(name = "status", required = false) ReviewStatus status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "dateFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "dateTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(verificationReadService.list(status, search, dateFrom, dateTo, page, size, sort));
    }

    @Operation(summary = "대기 중인 승인 요청 조회")
    @GetMapping("/pending")
    public ResponseEntity<PageResponse<VerificationRequestResponse>> pending(
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(verificationReadService.listPending(page, size));
    }

    @Operation(summary = "승인 요청 통계")
    @GetMapping("/stats")
    public ResponseEntity<VerificationStatsResponse> stats() {
        return ResponseEntity.ok(verificationReadService.stats());
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<VerificationRequestResponse> get(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(verificationReadService.getById(requestId));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<VerificationRequestResponse> getByUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(verificationReadService.getByUserId(userId));
    }

    @Operation(summary = "승인 요청 승인", description = "요청과 사용자 계정을 함께 승인 상태로 전환한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "승인 완료"),
            @ApiResponse(responseCode = "404", description = "요청 없음"),
            @ApiResponse(responseCode = "409", description = "이미 처리된 요청")
    })
    @PutMapping("/{requestId}/approve")
    public ResponseEntity<VerificationRequestResponse> approve(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) ApproveRequest request
    ) {
        String notes = request != null ? request.notes() : null;
        return ResponseEntity.ok(verificationService.approve(requestId, SecurityUtils.getCurrentUserId(), notes));
    }

    @Operation(summary = "승인 요청 반려")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "반려 완료"),
            @ApiResponse(responseCode = "400", description = "반려 사유 누락"),
            @ApiResponse(responseCode = "404", description = "요청 없음"),
            @ApiResponse(responseCode = "409", description = "이미 처리된 요청")
    })
    @PutMapping("/{requestId}/reject")
    public ResponseEntity<VerificationRequestResponse> reject(
            @PathVariable("requestId") UUID requestId,
            @RequestBody RejectRequest request
    ) {
        return ResponseEntity.ok(verificationService.reject(
                requestId, SecurityUtils.getCurrentUserId(), request.reason(), request.notes()));
    }

    @Operation(summary = "승인 요청 일괄 승인", description = "항목별 실패는 errors 에 모아 반환한다.")
    @PostMapping("/bulk-approve")
    public ResponseEntity<BulkResponse<VerificationRequestResponse>> bulkApprove(@Valid @RequestBody BulkReviewRequest request) {
        return ResponseEntity.ok(BulkResponse.from(
                verificationService.bulkApprove(request.ids(), SecurityUtils.getCurrentUserId(), request.notes()),
                VerificationRequestResponse::from));
    }

    @Operation(summary = "승인 요청 일괄 반려")
    @PostMapping("/bulk-reject")
    public ResponseEntity<BulkResponse<VerificationRequestResponse>> bulkReject(@Valid @RequestBody BulkReviewRequest request) {
        return ResponseEntity.ok(BulkResponse.from(
                verificationService.bulkReject(request.ids(), SecurityUtils.getCurrentUserId(), request.reason(), request.notes()),
                VerificationRequestResponse::from));
    }
}
