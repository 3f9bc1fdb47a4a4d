package com.realtyhub.backend.modules.verification.application;

/**
 * Registration data for a new, not yet verified account.
 */
public record CandidateProfile(
        String email,
        String password,
        String firstName,
        String lastName,
        String phoneNumber,
        String description,
        String position,
        Integer rating,
        String profileImage
) {
}
