package com.realtyhub.backend.modules.verification.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Applicant details as submitted, kept unchanged even if the profile is edited later.
 */
@Embeddable
public class ApplicantSnapshot {

    @Column(name = "applicant_first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "applicant_last_name", nullable = false, length = 50)
    private String lastName;

    @Column(name = "applicant_email", nullable = false, length = 255)
    private String email;

    @Column(name = "applicant_phone_number", length = 30)
    private String phoneNumber;

    @Column(name = "applicant_description", length = 1000)
    private String description;

    @Column(name = "applicant_position", length = 100)
    private String position;

    @Column(name = "applicant_rating")
    private Integer rating;

    @Column(name = "applicant_profile_image", length = 500)
    private String profileImage;

    protected ApplicantSnapshot() {
    }

    public ApplicantSnapshot(String firstName, String lastName, String email, String phoneNumber,
                             String description, String position, Integer rating, String profileImage) {
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.phoneNumber = phoneNumber;
        this.description = description;
        this.position = position;
        this.rating = rating;
        this.profileImage = profileImage;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getDescription() {
        return description;
    }

    public String getPosition() {
        return position;
    }

    public Integer getRating() {
        return rating;
    }

    public String getProfileImage() {
        return profileImage;
    }
}
