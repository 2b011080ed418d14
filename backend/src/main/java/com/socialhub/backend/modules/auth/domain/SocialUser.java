package com.socialhub.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.socialhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Platform account. Never hard-deleted here; moderation only flips its status columns.
 */
@Entity
@Table(name = "users")
public class SocialUser extends AbstractTimestampedEntity {

    @Column(name = "username", nullable = false, unique = true, length = 32)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @Column(name = "timeout_until")
    private OffsetDateTime timeoutUntil;

    @Column(name = "banned", nullable = false)
    private boolean banned;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "password_reset_token")
    private String passwordResetToken;

    @Column(name = "reset_token_expiry")
    private OffsetDateTime resetTokenExpiry;

    @Column(name = "activation_token")
    private String activationToken;

    @Column(name = "activation_token_expiry")
    private OffsetDateTime activationTokenExpiry;

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
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

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public int getRoleLevel() {
        return role.getLevel();
    }

    public OffsetDateTime getTimeoutUntil() {
        return timeoutUntil;
    }

    public void setTimeoutUntil(OffsetDateTime timeoutUntil) {
        this.timeoutUntil = timeoutUntil;
    }

    public boolean isBanned() {
        return banned;
    }

    public void setBanned(boolean banned) {
        this.banned = banned;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isTimedOut(OffsetDateTime now) {
        return timeoutUntil != null && timeoutUntil.isAfter(now);
    }

    public String getPasswordResetToken() {
        return passwordResetToken;
    }

    public OffsetDateTime getResetTokenExpiry() {
        return resetTokenExpiry;
    }

    public void assignPasswordResetToken(String token, OffsetDateTime expiry) {
        this.passwordResetToken = token;
        this.resetTokenExpiry = expiry;
    }

    public void clearPasswordResetToken() {
        this.passwordResetToken = null;
        this.resetTokenExpiry = null;
    }

    public String getActivationToken() {
        return activationToken;
    }

    public OffsetDateTime getActivationTokenExpiry() {
        return activationTokenExpiry;
    }

    public void assignActivationToken(String token, OffsetDateTime expiry) {
        this.activationToken = token;
        this.activationTokenExpiry = expiry;
    }

    public void clearActivationToken() {
        this.activationToken = null;
        this.activationTokenExpiry = null;
    }
}
