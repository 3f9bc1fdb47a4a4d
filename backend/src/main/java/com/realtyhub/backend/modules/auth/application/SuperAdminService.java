package com.realtyhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.auth.presentation.dto.CreateSuperAdminRequest;
import com.realtyhub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bootstrap of super admin accounts. Creation is only possible while
 * {@code realtyhub.super-admin.bootstrap-enabled} is on; production keeps it off.
 */
@Service
@Transactional
public class SuperAdminService {

    private static final Logger log = LoggerFactory.getLogger(SuperAdminService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final RealtyhubProperties properties;
    private final Clock clock;

    public SuperAdminService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            RealtyhubProperties properties,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    public UserProfileResponse createSuperAdmin(CreateSuperAdminRequest request) {
        if (!properties.superAdmin().bootstrapEnabled()) {
            throw ProblemException.forbidden("auth.bootstrap_disabled", "최고 관리자 생성이 비활성화되어 있습니다.");
        }
        String email = request.email().trim().toLowerCase();
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("auth.duplicate_email", "이미 등록된 이메일입니다.");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setRole(UserRole.SUPER_ADMIN);
        user.setActive(true);
        user.setVerified(true);
        user.setVerificationStatus(ReviewStatus.APPROVED);
        user.setVerifiedAt(OffsetDateTime.now(clock));
        AppUser saved = appUserRepository.save(user);

        auditLogService.record(AuditLogCommand.of("SUPER_ADMIN_CREATE", "USER", saved.getId(), null,
                Map.of("email", saved.getEmail())));
        log.warn("Super admin account bootstrapped: userId={}", saved.getId());
        return UserProfileResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<UserProfileResponse> listSuperAdmins() {
        return appUserRepository.findByRoleOrderByCreatedAtAsc(UserRole.SUPER_ADMIN).stream()
                .map(UserProfileResponse::from)
                .toList();
    }
}
