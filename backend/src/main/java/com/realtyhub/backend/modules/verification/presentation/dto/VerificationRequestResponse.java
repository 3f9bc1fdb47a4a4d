package com.realtyhub.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.realtyhub.backend.modules.verification.domain.ApplicantSnapshot;
import com.realtyhub.backend.modules.verification.domain.VerificationRequest;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

public record VerificationRequestResponse(
        UUID id,
        UUID userId,
        ReviewStatus status,
        OffsetDateTime requestedAt,
        UUID reviewedBy,
        OffsetDateTime reviewedAt,
        String reviewNotes,
        String rejectionReason,
        Applicant applicant
) {

    public record Applicant(
            String firstName,
            String lastName,
            String email,
            String phoneNumber,
            String description,
            String position,
            Integer rating,
            String profileImage
    ) {
    }

    public static VerificationRequestResponse from(VerificationRequest request) {
        ApplicantSnapshot snapshot = request.getApplicant();
        Applicant applicant = snapshot == null ? null : new Applicant(
                snapshot.getFirstName(),
                snapshot.getLastName(),
                snapshot.getEmail(),
                snapshot.getPhoneNumber(),
                snapshot.getDescription(),
                snapshot.getPosition(),
                snapshot.getRating(),
                snapshot.getProfileImage()
        );
        return new VerificationRequestResponse(
                request.getId(),
                request.getUserId(),
                request.getStatus(),
                request.getRequestedAt(),
                request.getReviewedBy(),
                request.getReviewedAt(),
                request.getReviewNotes(),
                request.getRejectionReason(),
                applicant
        );
    }
}
