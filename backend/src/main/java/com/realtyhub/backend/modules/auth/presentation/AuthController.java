package com.realtyhub.backend.modules.auth.presentation;

import com.realtyhub.backend.global.security.SecurityUtils;
import com.realtyhub.backend.modules.auth.application.AuthService;
import com.realtyhub.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.realtyhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.RegisterResponse;
import com.realtyhub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.realtyhub.backend.modules.verification.application.VerificationService;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationRequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    static final String REGISTRATION_MESSAGE = "registration submitted, awaiting approval";

    private final AuthService authService;
    private final VerificationService verificationService;

    public AuthController(AuthService authService, VerificationService verificationService) {
        this.authService = authService;
        this.verificationService = verificationService;
    }

    @Operation(summary = "회원가입", description = "계정을 대기 상태로 만들고 승인 요청을 제출한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가입 요청 접수"),
            @ApiResponse(responseCode = "409", description = "이미 등록된 이메일")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        VerificationRequestResponse created = verificationService.createRequest(request.toCandidateProfile());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterResponse(created.userId(), created.id(), REGISTRATION_MESSAGE));
    }

    @Operation(summary = "로그인")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그인 성공"),
            @ApiResponse(responseCode = "401", description = "이메일 또는 비밀번호 불일치"),
            @ApiResponse(responseCode = "403", description = "비활성 계정 또는 미승인 계정")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> profile() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @PutMapping("/profile")
    public ResponseEntity<UserProfileResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(authService.updateProfile(SecurityUtils.getCurrentUserId(), request));
    }

    @PutMapping("/change-password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "계정 비활성화", description = "본인 계정을 비활성화한다. 되돌릴 수 없다.")
    @PutMapping("/deactivate")
    public ResponseEntity<Void> deactivate() {
        authService.deactivate(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
