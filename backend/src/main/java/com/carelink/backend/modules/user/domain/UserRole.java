package com.carelink.backend.modules.user.domain;

public enum UserRole {
    WORKER,
    CLIENT,
    COORDINATOR,
    ADMIN
}
