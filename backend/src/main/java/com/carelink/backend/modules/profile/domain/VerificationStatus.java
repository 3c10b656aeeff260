package com.carelink.backend.modules.profile.domain;

/**
 * Review lifecycle of a worker profile: NOT_STARTED, IN_PROGRESS, PENDING_REVIEW, then APPROVED or REJECTED.
 */
public enum VerificationStatus {
    NOT_STARTED,
    IN_PROGRESS,
    PENDING_REVIEW,
    APPROVED,
    REJECTED;

    public boolean canSubmitForReview() {
        return this == NOT_STARTED || this == IN_PROGRESS || this == REJECTED;
    }
}
