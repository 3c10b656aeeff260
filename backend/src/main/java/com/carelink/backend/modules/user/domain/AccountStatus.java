package com.carelink.backend.modules.user.domain;

public enum AccountStatus {
    ACTIVE,
    SUSPENDED,
    LOCKED,
    PENDING_VERIFICATION;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
