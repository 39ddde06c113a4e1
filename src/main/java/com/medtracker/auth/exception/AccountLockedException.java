package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Exception thrown when account is locked.
 */
public class AccountLockedException extends AuthenticationException {

    private final Instant lockedUntil;
    private final Duration remaining;

    public AccountLockedException(String message, Instant lockedUntil, Duration remaining) {
        super(message, "ACCOUNT_LOCKED", HttpStatus.LOCKED);
        this.lockedUntil = lockedUntil;
        this.remaining = remaining;
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
