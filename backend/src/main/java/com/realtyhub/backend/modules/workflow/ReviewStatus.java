package com.realtyhub.backend.modules.workflow;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
