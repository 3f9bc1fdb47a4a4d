package com.realtyhub.backend.modules.verification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.verification.domain.ApplicantSnapshot;
import com.realtyhub.backend.modules.verification.domain.VerificationRequest;
import com.realtyhub.backend.modules.verification.infrastructure.VerificationRequestRepository;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationRequestResponse;
import com.realtyhub.backend.modules.workflow.BulkResult;
import com.realtyhub.backend.modules.workflow.ReviewDecision;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registration and review of account verification requests.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final AppUserRepository appUserRepository;
    private final VerificationRequestRepository requestRepository;
    private final VerificationReviewWorkflow reviewWorkflow;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public VerificationService(
            AppUserRepository appUserRepository,
            VerificationRequestRepository requestRepository,
            VerificationReviewWorkflow reviewWorkflow,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.requestRepository = requestRepository;
        this.reviewWorkflow = reviewWorkflow;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Creates a pending account and its verification request in one transaction. The e-mail is
     * checked case-insensitively before anything is written; the unique index on {@code lower(email)}
     * catches registrations racing past that check.
     */
    @Transactional
    public VerificationRequestResponse createRequest(CandidateProfile candidate) {
        String email = candidate.email().trim().toLowerCase();
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            log.warn("Registration rejected, e-mail already registered: {}", email);
            throw duplicateEmail();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(candidate.password()));
        user.setFirstName(candidate.firstName().trim());
        user.setLastName(candidate.lastName().trim());
        user.setPhoneNumber(candidate.phoneNumber());
        user.setDescription(candidate.description());
        user.setPosition(candidate.position());
        user.setRating(candidate.rating());
        user.setProfileImage(candidate.profileImage());
        user.setRole(UserRole.USER);
        user.setActive(true);
        user.setVerified(false);
        user.setVerificationStatus(ReviewStatus.PENDING);
        try {
            user = appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Registration lost a race on e-mail {}", email);
            throw duplicateEmail();
        }

        VerificationRequest request = new VerificationRequest();
        request.setUser(user);
        request.setRequestedAt(now);
        request.setStatus(ReviewStatus.PENDING);
        request.setApplicant(new ApplicantSnapshot(
                user.getFirstName(),
                user.getLastName(),
                email,
                candidate.phoneNumber(),
                candidate.description(),
                candidate.position(),
                candidate.rating(),
                candidate.profileImage()
        ));
        VerificationRequest saved = requestRepository.save(request);

        auditLogService.record(AuditLogCommand.of("VERIFICATION_REQUEST_CREATE", "VERIFICATION_REQUEST",
                saved.getId(), user.getId(), Map.of("email", email)));
        log.info("Verification request created: requestId={}, userId={}", saved.getId(), user.getId());
        return VerificationRequestResponse.from(saved);
    }

    public VerificationRequestResponse approve(UUID requestId, UUID reviewerId, String notes) {
        return VerificationRequestResponse.from(
                reviewWorkflow.review(requestId, ReviewDecision.approve(notes), reviewerId));
    }

    public VerificationRequestResponse reject(UUID requestId, UUID reviewerId, String reason, String notes) {
        return VerificationRequestResponse.from(
                reviewWorkflow.review(requestId, ReviewDecision.reject(reason, notes), reviewerId));
    }

    public BulkResult<VerificationRequest> bulkApprove(List<UUID> requestIds, UUID reviewerId, String notes) {
        return reviewWorkflow.reviewAll(requestIds, ReviewDecision.approve(notes), reviewerId);
    }

    public BulkResult<VerificationRequest> bulkReject(List<UUID> requestIds, UUID reviewerId, String reason, String notes) {
        return reviewWorkflow.reviewAll(requestIds, ReviewDecision.reject(reason, notes), reviewerId);
    }

    private static ProblemException duplicateEmail() {
        return ProblemException.conflict("auth.duplicate_email", "이미 등록된 이메일입니다.");
    }
}
