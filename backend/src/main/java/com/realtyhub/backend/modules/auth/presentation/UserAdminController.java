package com.realtyhub.backend.modules.auth.presentation;

import java.util.UUID;

import com.realtyhub.backend.global.common.PageResponse;
import com.realtyhub.backend.modules.auth.application.UserDirectoryService;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/users")
public class UserAdminController {

    private final UserDirectoryService userDirectoryService;

    public UserAdminController(UserDirectoryService userDirectoryService) {
        this.userDirectoryService = userDirectoryService;
    }

    @Operation(summary = "사용자 목록 조회", description = "관리자 이상이 이름/이메일 검색과 페이지 조회를 한다.")
    @GetMapping
    public ResponseEntity<PageResponse<UserProfileResponse>> listUsers(
            @RequestParam(name = "role", required = false) UserRole role,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "1") Integer page,
            @RequestParam(name = "size", required = false) Integer size,
            @RequestParam(name = "sort", required = false) String sort
    ) {
        return ResponseEntity.ok(userDirectoryService.listUsers(role, active, search, page, size, sort));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userDirectoryService.getUser(userId));
    }
}
