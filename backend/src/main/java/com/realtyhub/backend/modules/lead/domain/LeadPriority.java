package com.realtyhub.backend.modules.lead.domain;

public enum LeadPriority {
    LOW,
    MEDIUM,
    HIGH
}
