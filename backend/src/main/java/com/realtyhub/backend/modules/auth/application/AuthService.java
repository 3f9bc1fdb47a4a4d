package com.realtyhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.realtyhub.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.realtyhub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        if (!user.canLogIn()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_NOT_VERIFIED");
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        AccessTokenResponse token = jwtTokenService.issueAccessToken(user);
        log.info("User logged in: userId={}, role={}", user.getId(), user.getRole());
        return new LoginResponse(token, UserProfileResponse.from(user));
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return UserProfileResponse.from(findUser(userId));
    }

    /**
     * Owner edit of non-status profile fields. Email, role and verification state are not editable here.
     */
    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        AppUser user = findUser(userId);
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(request.phoneNumber().trim());
        }
        if (request.description() != null) {
            user.setDescription(request.description());
        }
        if (request.position() != null) {
            user.setPosition(request.position().trim());
        }
        if (request.rating() != null) {
            user.setRating(request.rating());
        }
        if (request.profileImage() != null) {
            user.setProfileImage(request.profileImage());
        }
        if (request.address() != null) {
            user.setAddress(request.address().toAddress());
        }
        appUserRepository.save(user);
        log.info("Profile updated: userId={}", userId);
        return UserProfileResponse.from(user);
    }

    public void changePassword(UUID userId, ChangePasswordRequest request) {
        AppUser user = findUser(userId);
        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw ProblemException.badRequest("auth.invalid_password", "현재 비밀번호가 일치하지 않습니다.");
        }
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        appUserRepository.save(user);
        auditLogService.record(AuditLogCommand.of("USER_PASSWORD_CHANGE", "USER", userId, userId, Map.of()));
        log.info("Password changed: userId={}", userId);
    }

    /**
     * Self-service deactivation. One-way: there is no self-service reactivation.
     */
    public void deactivate(UUID userId) {
        AppUser user = findUser(userId);
        if (user.getRole() == UserRole.SUPER_ADMIN) {
            throw ProblemException.forbidden("auth.super_admin_deactivation", "최고 관리자 계정은 비활성화할 수 없습니다.");
        }
        if (!user.isActive()) {
            return;
        }
        user.setActive(false);
        appUserRepository.save(user);
        auditLogService.record(AuditLogCommand.of("USER_DEACTIVATE", "USER", userId, userId, Map.of()));
        log.info("Account deactivated: userId={}", userId);
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("auth.user_not_found", "사용자를 찾을 수 없습니다."));
    }
}
