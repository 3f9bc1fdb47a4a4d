package com.realtyhub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.workflow.ReviewStatus;

public record UserProfileResponse(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        UserRole role,
        boolean active,
        boolean verified,
        ReviewStatus verificationStatus,
        String rejectionReason,
        String phoneNumber,
        String description,
        String position,
        Integer rating,
        String profileImage,
        AddressPayload address,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.isActive(),
                user.isVerified(),
                user.getVerificationStatus(),
                user.getRejectionReason(),
                user.getPhoneNumber(),
                user.getDescription(),
                user.getPosition(),
                user.getRating(),
                user.getProfileImage(),
                AddressPayload.from(user.getAddress()),
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
