package com.realtyhub.backend.modules.verification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.audit.application.AuditLogService;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.realtyhub.backend.modules.verification.application.CandidateProfile;
import com.realtyhub.backend.modules.verification.application.VerificationReviewWorkflow;
import com.realtyhub.backend.modules.verification.application.VerificationService;
import com.realtyhub.backend.modules.verification.domain.VerificationRequest;
import com.realtyhub.backend.modules.verification.infrastructure.VerificationRequestRepository;
import com.realtyhub.backend.modules.verification.presentation.dto.VerificationRequestResponse;
import com.realtyhub.backend.modules.workflow.ReviewStatus;
import com.realtyhub.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class VerificationServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private VerificationRequestRepository requestRepository;

    @Mock
    private VerificationReviewWorkflow reviewWorkflow;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private AuditLogService auditLogService;

    private VerificationService verificationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T09:00:00Z"), ZoneOffset.UTC);
        verificationService = new VerificationService(appUserRepository, requestRepository, reviewWorkflow,
                passwordEncoder, auditLogService, clock);
    }

    @Test
    @DisplayName("가입 신청 시 미인증 계정과 승인 대기 요청이 함께 생성된다")
    void createRequestCreatesPendingAccountAndRequest() {
        UUID userId = UUID.randomUUID();
        when(appUserRepository.existsByEmailIgnoreCase("agent@example.com")).thenReturn(false);
        when(passwordEncoder.encode("Secret123!")).thenReturn("encoded");
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.<AppUser>getArgument(0), userId));
        when(requestRepository.save(any(VerificationRequest.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.<VerificationRequest>getArgument(0), UUID.randomUUID()));

        VerificationRequestResponse response = verificationService.createRequest(candidate("  Agent@Example.com "));

        ArgumentCaptor<AppUser> userCaptor = ArgumentCaptor.forClass(AppUser.class);
        verify(appUserRepository).saveAndFlush(userCaptor.capture());
        AppUser saved = userCaptor.getValue();
        assertThat(saved.getEmail()).isEqualTo("agent@example.com");
        assertThat(saved.getPasswordHash()).isEqualTo("encoded");
        assertThat(saved.getRole()).isEqualTo(UserRole.USER);
        assertThat(saved.isVerified()).isFalse();
        assertThat(saved.getVerificationStatus()).isEqualTo(ReviewStatus.PENDING);

        assertThat(response.userId()).isEqualTo(userId);
        assertThat(response.status()).isEqualTo(ReviewStatus.PENDING);
        assertThat(response.requestedAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T09:00:00Z"));
        assertThat(response.applicant().email()).isEqualTo("agent@example.com");
        assertThat(response.applicant().position()).isEqualTo("Senior Agent");
    }

    @Test
    @DisplayName("대소문자만 다른 이메일도 중복으로 거절한다")
    void duplicateEmailIgnoringCase() {
        when(appUserRepository.existsByEmailIgnoreCase("agent@example.com")).thenReturn(true);

        assertThatThrownBy(() -> verificationService.createRequest(candidate("AGENT@example.com")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("auth.duplicate_email");
                });
        verify(appUserRepository, never()).saveAndFlush(any());
        verify(requestRepository, never()).save(any());
    }

    @Test
    @DisplayName("동시 가입으로 유니크 제약에 걸리면 중복 이메일로 응답한다")
    void uniqueIndexViolationIsDuplicateEmail() {
        when(appUserRepository.existsByEmailIgnoreCase("agent@example.com")).thenReturn(false);
        when(passwordEncoder.encode("Secret123!")).thenReturn("encoded");
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("ux_app_user_email_lower"));

        assertThatThrownBy(() -> verificationService.createRequest(candidate("agent@example.com")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("auth.duplicate_email"));
        verify(requestRepository, never()).save(any());
    }

    private static CandidateProfile candidate(String email) {
        return new CandidateProfile(email, "Secret123!", "Jane", "Doe", "5551234567",
                "Downtown specialist", "Senior Agent", 4, null);
    }
}
