package com.carelink.backend.modules.user.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.carelink.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Login identity shared by every role. Role specific data lives in the profile tables.
 */
@Entity
@Table(name = "app_user")
public class User extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AccountStatus status = AccountStatus.ACTIVE;

    @Column(name = "email_verified_at")
    private OffsetDateTime emailVerifiedAt;

    @Column(name = "reset_password_token", unique = true, length = 128)
    private String resetPasswordToken;

    @Column(name = "reset_password_expires")
    private OffsetDateTime resetPasswordExpires;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "account_locked_until")
    private OffsetDateTime accountLockedUntil;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "last_login_ip", length = 64)
    private String lastLoginIp;

    @OneToMany(mappedBy = "user", fetch = FetchType.LAZY)
    private List<Account> accounts = new ArrayList<>();

    @OneToMany(mappedBy = "user", fetch = FetchType.LAZY)
    private List<UserSession> sessions = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public AccountStatus getStatus() {
        return status;
    }

    public void setStatus(AccountStatus status) {
        this.status = status;
    }

    public OffsetDateTime getEmailVerifiedAt() {
        return emailVerifiedAt;
    }

    public void setEmailVerifiedAt(OffsetDateTime emailVerifiedAt) {
        this.emailVerifiedAt = emailVerifiedAt;
    }

    public boolean isEmailVerified() {
        return emailVerifiedAt != null;
    }

    public String getResetPasswordToken() {
        return resetPasswordToken;
    }

    public OffsetDateTime getResetPasswordExpires() {
        return resetPasswordExpires;
    }

    public void assignResetPasswordToken(String token, OffsetDateTime expires) {
        this.resetPasswordToken = token;
        this.resetPasswordExpires = expires;
    }

    public void clearResetPasswordToken() {
        this.resetPasswordToken = null;
        this.resetPasswordExpires = null;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public OffsetDateTime getAccountLockedUntil() {
        return accountLockedUntil;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public String getLastLoginIp() {
        return lastLoginIp;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public List<UserSession> getSessions() {
        return sessions;
    }

    public boolean isLockedAt(OffsetDateTime now) {
        return accountLockedUntil != null && accountLockedUntil.isAfter(now);
    }

    /**
     * Counts a failed password attempt and locks the account once {@code maxAttempts} is reached.
     *
     * @return {@code true} when this attempt triggered the lock
     */
    public boolean registerFailedLogin(OffsetDateTime now, int maxAttempts, Duration lockDuration) {
        failedLoginAttempts++;
        if (failedLoginAttempts >= maxAttempts) {
            accountLockedUntil = now.plus(lockDuration);
            return true;
        }
        return false;
    }

    public void registerSuccessfulLogin(OffsetDateTime now, String ipAddress) {
        failedLoginAttempts = 0;
        accountLockedUntil = null;
        lastLoginAt = now;
        lastLoginIp = ipAddress;
    }

    public void clearLockout() {
        failedLoginAttempts = 0;
        accountLockedUntil = null;
        if (status == AccountStatus.LOCKED) {
            status = AccountStatus.ACTIVE;
        }
    }
}
