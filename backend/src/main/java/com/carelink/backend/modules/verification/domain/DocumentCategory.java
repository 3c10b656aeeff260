package com.carelink.backend.modules.verification.domain;

/**
 * Identity document grouping used by the 100-point style identity check.
 */
public enum DocumentCategory {
    PRIMARY,
    SECONDARY,
    WORKING_RIGHTS
}
