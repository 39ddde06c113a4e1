package com.medtracker.auth.enums;

/**
 * Outcome of resolving a session reference.
 */
public enum SessionLookupStatus {
    ABSENT,
    REVOKED,
    EXPIRED,
    ACTIVE
}
