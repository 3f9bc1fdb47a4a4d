package com.realtyhub.backend.modules.verification.presentation.dto;

public record VerificationStatsResponse(
        long total,
        long pending,
        long approved,
        long rejected,
        long pendingToday,
        long approvedToday,
        long rejectedToday,
        long averageProcessingHours
) {
}
