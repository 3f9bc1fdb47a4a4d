package com.realtyhub.backend.modules.auth.presentation;

import java.util.List;

import com.realtyhub.backend.modules.auth.application.SuperAdminService;
import com.realtyhub.backend.modules.auth.presentation.dto.CreateSuperAdminRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/super-admins")
public class SuperAdminController {

    private final SuperAdminService superAdminService;

    public SuperAdminController(SuperAdminService superAdminService) {
        this.superAdminService = superAdminService;
    }

    @Operation(summary = "최고 관리자 생성", description = "부트스트랩 설정이 켜진 환경에서만 허용된다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "생성 완료"),
            @ApiResponse(responseCode = "403", description = "부트스트랩 비활성화"),
            @ApiResponse(responseCode = "409", description = "이미 등록된 이메일")
    })
    @PostMapping
    public ResponseEntity<UserProfileResponse> create(@Valid @RequestBody CreateSuperAdminRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(superAdminService.createSuperAdmin(request));
    }

    @GetMapping
    public ResponseEntity<List<UserProfileResponse>> list() {
        return ResponseEntity.ok(superAdminService.listSuperAdmins());
    }
}
