package com.realtyhub.backend.modules.auth.presentation.dto;

import com.realtyhub.backend.modules.verification.application.CandidateProfile;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 6, max = 100) String password,
        @NotBlank @Size(max = 50) String firstName,
        @NotBlank @Size(max = 50) String lastName,
        @Size(max = 30) String phoneNumber,
        @Size(max = 1000) String description,
        @Size(max = 100) String position,
        @Min(1) @Max(5) Integer rating,
        @Size(max = 500) String profileImage
) {

    public CandidateProfile toCandidateProfile() {
        return new CandidateProfile(email, password, firstName, lastName, phoneNumber, description,
                position, rating, profileImage);
    }
}
