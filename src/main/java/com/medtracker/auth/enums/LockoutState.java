package com.medtracker.auth.enums;

/**
 * Account lockout state, derived from the lock expiry on every check.
 */
public enum LockoutState {
    UNLOCKED,
    LOCKED
}
