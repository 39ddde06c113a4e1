package com.medtracker.auth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Account entity. Email is stored normalized (trimmed, lower-case).
 */
@Entity
@Table(name = "accounts", indexes = {
        @Index(name = "idx_account_email", columnList = "email", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account extends BaseEntity {

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "failed_attempts", nullable = false)
    @Builder.Default
    private Integer failedAttempts = 0;

    @Column(name = "lock_until")
    private Instant lockUntil;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "is_verified", nullable = false)
    @Builder.Default
    private Boolean verified = false;

    public boolean isLockedAt(Instant now) {
        return lockUntil != null && lockUntil.isAfter(now);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }
}
