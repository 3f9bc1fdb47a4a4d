package com.realtyhub.backend.modules.workflow;

/**
 * Reviewer's verdict. {@code reason} is mandatory for rejections and ignored for approvals.
 */
public record ReviewDecision(Verdict verdict, String reason, String notes) {

    public enum Verdict {
        APPROVE(ReviewStatus.APPROVED),
        REJECT(ReviewStatus.REJECTED);

        private final ReviewStatus outcome;

        Verdict(ReviewStatus outcome) {
            this.outcome = outcome;
        }

        public ReviewStatus outcome() {
            return outcome;
        }
    }

    public static ReviewDecision approve(String notes) {
        return new ReviewDecision(Verdict.APPROVE, null, notes);
    }

    public static ReviewDecision reject(String reason, String notes) {
        return new ReviewDecision(Verdict.REJECT, reason, notes);
    }

    public boolean isApproval() {
        return verdict == Verdict.APPROVE;
    }

    public ReviewStatus outcome() {
        return verdict.outcome();
    }

    /**
     * Value to store in the rejection-reason column: the trimmed reason on rejection, {@code null} on approval.
     */
    public String storedReason() {
        return isApproval() || reason == null ? null : reason.trim();
    }
}
