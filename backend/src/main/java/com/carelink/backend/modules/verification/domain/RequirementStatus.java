package com.carelink.backend.modules.verification.domain;

public enum RequirementStatus {
    PENDING,
    SUBMITTED,
    APPROVED,
    REJECTED,
    EXPIRED
}
