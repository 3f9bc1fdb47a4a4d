package com.realtyhub.backend.modules.lead.domain;

public enum LeadSource {
    LANDING_PAGE,
    CONTACT_FORM,
    REFERRAL,
    OTHER
}
