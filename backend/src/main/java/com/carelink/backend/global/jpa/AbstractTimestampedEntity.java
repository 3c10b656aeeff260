package com.carelink.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.LastModifiedDate;

/**
 * Mutable rows: users, profiles, sessions and requirements. Adds {@code updated_at}, refreshed on every flush.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity extends AbstractCreatedEntity {

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
