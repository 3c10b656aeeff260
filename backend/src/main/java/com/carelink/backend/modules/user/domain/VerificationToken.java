package com.carelink.backend.modules.user.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

/**
 * One-time token bound to an identifier (an email address). It has no foreign key to {@link User}.
 */
@Entity
@Table(name = "verification_token")
@IdClass(VerificationTokenId.class)
public class VerificationToken {

    @Id
    @Column(name = "identifier", nullable = false, length = 320)
    private String identifier;

    @Id
    @Column(name = "token", nullable = false, unique = true, length = 128)
    private String token;

    @Column(name = "expires", nullable = false)
    private OffsetDateTime expires;

    protected VerificationToken() {
    }

    public VerificationToken(String identifier, String token, OffsetDateTime expires) {
        this.identifier = identifier;
        this.token = token;
        this.expires = expires;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getToken() {
        return token;
    }

    public OffsetDateTime getExpires() {
        return expires;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expires.isAfter(now);
    }
}
