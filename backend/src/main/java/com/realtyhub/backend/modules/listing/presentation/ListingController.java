package com.realtyhub.backend.modules.listing.presentation;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.global.security.SecurityUtils;
import com.realtyhub.backend.modules.listing.application.ImageUpload;
import com.realtyhub.backend.modules.listing.application.ListingImageService;
import com.realtyhub.backend.modules.listing.application.ListingReadService;
import com.realtyhub.backend.modules.listing.application.ListingService;
import com.realtyhub.backend.modules.listing.domain.ListingPurpose;
import com.realtyhub.backend.modules.listing.domain.MarketStatus;
import com.realtyhub.backend.modules.listing.domain.PropertyType;
import com.realtyhub.backend.modules.listing.infrastructure.persistence.ListingSearchCondition;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingCreateRequest;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingResponse;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingStatsResponse;
import com.realtyhub.backend.modules.listing.presentation.dto.ListingUpdateRequest;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/listings")
public class ListingController {

    private final ListingService listingService;
    private final ListingReadService listingReadService;
    private final ListingImageService listingImageService;

    public ListingController(
            ListingService listingService,
            ListingReadService listingReadService,
            ListingImageService listingImageService
    ) {
        this.listingService = listingService;
        this.listingReadService = listingReadService;
        this.listingImageService = listingImageService;
    }

    @Operation(summary = "매물 검색", description = "로그인 여부와 권한에 따라 보이는 승인 상태가 달라진다.")
    @GetMapping
    public ResponseEntity<PageResponse<ListingResponse>> search(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "type", required = false) PropertyType type,
            @RequestParam(name = "purpose", required = false) ListingPurpose purpose,
            @RequestParam(name = "status", required = false) MarketStatus status,
            @RequestParam(name = "approvalStatus", required = false) ReviewStatus approvalStatus,
            @RequestParam(name = "minPrice", required = false) BigDecimal minPrice,
            @RequestParam(name = "maxPrice", required = false) BigDecimal maxPrice,
            @RequestParam(name = "minBedrooms", required = false) Integer minBedrooms,
            @RequestParam(name = "minBathrooms", required = false) Integer minBathrooms,
            @RequestParam(name = "city", required = false) String city,
            @RequestParam(name = "state", required = false) String state,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        ListingSearchCondition condition = new ListingSearchCondition(
                SecurityUtils.currentActorOrAnonymous(),
                approvalStatus,
                null,
                search,
                type,
                purpose,
                status,
                minPrice,
                maxPrice,
                minBedrooms,
                minBathrooms,
                city,
                state
        );
        return ResponseEntity.ok(listingReadService.search(condition, page, size, sort));
    }

    @Operation(summary = "매물 통계", description = "관리자 이상만 조회할 수 있다.")
    @GetMapping("/stats")
    public ResponseEntity<ListingStatsResponse> stats() {
        return ResponseEntity.ok(listingReadService.stats());
    }

    @GetMapping("/{listingId}")
    public ResponseEntity<ListingResponse> get(@PathVariable("listingId") UUID listingId) {
        return ResponseEntity.ok(listingReadService.getById(listingId, SecurityUtils.currentActorOrAnonymous()));
    }

    @GetMapping("/agent/{agentId}")
    public ResponseEntity<PageResponse<ListingResponse>> byAgent(
            @PathVariable("agentId") UUID agentId,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(listingReadService.listByAgent(agentId, SecurityUtils.currentActor(), page, size, sort));
    }

    @Operation(summary = "매물 등록", description = "최고 관리자가 등록한 매물은 즉시 승인된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 완료"),
            @ApiResponse(responseCode = "422", description = "입력값 오류")
    })
    @PostMapping
    public ResponseEntity<ListingResponse> create(@Valid @RequestBody ListingCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(listingService.create(request, SecurityUtils.currentActor()));
    }

    @Operation(summary = "매물 수정", description = "담당 에이전트와 최고 관리자만 수정할 수 있다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "수정 완료"),
            @ApiResponse(responseCode = "403", description = "수정 권한 없음"),
            @ApiResponse(responseCode = "404", description = "매물 없음")
    })
    @PutMapping("/{listingId}")
    public ResponseEntity<ListingResponse> update(
            @PathVariable("listingId") UUID listingId,
            @Valid @RequestBody ListingUpdateRequest request
    ) {
        return ResponseEntity.ok(listingService.update(listingId, request, SecurityUtils.currentActor()));
    }

    @Operation(summary = "매물 삭제", description = "담당 에이전트와 관리자 이상이 삭제할 수 있다.")
    @DeleteMapping("/{listingId}")
    public ResponseEntity<Void> delete(@PathVariable("listingId") UUID listingId) {
        listingService.delete(listingId, SecurityUtils.currentActor());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "매물 이미지 업로드")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "업로드 완료"),
            @ApiResponse(responseCode = "400", description = "허용되지 않는 형식, 크기 또는 개수 초과"),
            @ApiResponse(responseCode = "502", description = "파일 저장소 오류")
    })
    @PostMapping(path = "/{listingId}/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ListingResponse> uploadImages(
            @PathVariable("listingId") UUID listingId,
            @RequestParam("images") List<MultipartFile> images
    ) {
        return ResponseEntity.ok(listingImageService.attachImages(listingId, toUploads(images), SecurityUtils.currentActor()));
    }

    @DeleteMapping("/{listingId}/images")
    public ResponseEntity<ListingResponse> removeImage(
            @PathVariable("listingId") UUID listingId,
            @RequestParam("url") String imageUrl
    ) {
        return ResponseEntity.ok(listingImageService.removeImage(listingId, imageUrl, SecurityUtils.currentActor()));
    }

    private static List<ImageUpload> toUploads(List<MultipartFile> files) {
        List<ImageUpload> uploads = new ArrayList<>();
        for (MultipartFile file : files) {
            try {
                uploads.add(new ImageUpload(file.getOriginalFilename(), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "storage.unreadable_file",
                        "업로드한 파일을 읽을 수 없습니다.", e);
            }
        }
        return uploads;
    }
}
