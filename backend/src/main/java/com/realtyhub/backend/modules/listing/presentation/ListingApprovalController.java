package com.realtyhub.backend.modules.listing.presentation;

import java.util.UUID;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.security.SecurityUtils;
import com.realtyhub.backend.modules.listing.application.ListingApprovalService;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.workflow.presentation.dto.BulkResponse;
import com.realtyhub.backend.modules.workflow.presentation.dto.BulkReviewRequest;
import com.realtyhub.backend.modules.workflow.presentation.dto.RejectRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ListingApprovalController {

    private final ListingApprovalService listingApprovalService;

    public ListingApprovalController(ListingApprovalService listingApprovalService) {
        this.listingApprovalService = listingApprovalService;
    }

    @Operation(summary = "승인 대기 매물 조회")
    @GetMapping("/listings/approval/pending")
    public ResponseEntity<PageResponse<ListingResponse>> pending(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(listingApprovalService.pendingQueue(SecurityUtils.currentActor(), search, page, size, sort));
    }

    @Operation(summary = "매물 승인", description = "승인 시 이전 반려 사유는 지워진다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "승인 완료"),
            @ApiResponse(responseCode = "404", description = "매물 없음"),
            @ApiResponse(responseCode = "409", description = "이미 처리된 매물")
    })
    @PutMapping("/listings/{listingId}/approve")
    public ResponseEntity<ListingResponse> approve(@PathVariable("listingId") UUID listingId) {
        return ResponseEntity.ok(listingApprovalService.approve(listingId, SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "매물 반려")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "반려 완료"),
            @ApiResponse(responseCode = "400", description = "반려 사유 누락"),
            @ApiResponse(responseCode = "404", description = "매물 없음"),
            @ApiResponse(responseCode = "409", description = "이미 처리된 매물")
    })
    @PutMapping("/listings/{listingId}/reject")
    public ResponseEntity<ListingResponse> reject(
            @PathVariable("listingId") UUID listingId,
            @RequestBody RejectRequest request
    ) {
        return ResponseEntity.ok(listingApprovalService.reject(listingId, SecurityUtils.getCurrentUserId(), request.reason()));
    }

    @PostMapping("/listings/approval/bulk-approve")
    public ResponseEntity<BulkResponse<ListingResponse>> bulkApprove(@Valid @RequestBody BulkReviewRequest request) {
        return ResponseEntity.ok(BulkResponse.from(
                listingApprovalService.bulkApprove(request.ids(), SecurityUtils.getCurrentUserId()),
                listing -> ListingResponse.from(listing, true)));
    }

    @PostMapping("/listings/approval/bulk-reject")
    public ResponseEntity<BulkResponse<ListingResponse>> bulkReject(@Valid @RequestBody BulkReviewRequest request) {
        return ResponseEntity.ok(BulkResponse.from(
                listingApprovalService.bulkReject(request.ids(), SecurityUtils.getCurrentUserId(), request.reason()),
                listing -> ListingResponse.from(listing, true)));
    }
}
