package com.carelink.backend.modules.audit.domain;

public enum AuditAction {
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGOUT,
    ACCOUNT_LOCKED,
    ACCOUNT_UNLOCKED,
    PASSWORD_CHANGE,
    PASSWORD_RESET_REQUEST,
    PASSWORD_RESET_SUCCESS,
    EMAIL_CHANGE,
    EMAIL_VERIFIED,
    ROLE_CHANGE,
    STATUS_CHANGE,
    REGISTRATION,
    PROFILE_UPDATE,
    ACCOUNT_LINKED,
    ACCOUNT_UNLINKED
}
