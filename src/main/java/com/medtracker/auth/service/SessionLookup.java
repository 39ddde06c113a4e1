package com.medtracker.auth.service;

import com.medtracker.auth.entity.UserSession;
import com.medtracker.auth.enums.SessionLookupStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Result of {@link SessionService#resolve}. A session is attached for every
 * status except {@code ABSENT}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionLookup {

    private final SessionLookupStatus status;
    private final UserSession session;

    public static SessionLookup absent() {
        return new SessionLookup(SessionLookupStatus.ABSENT, null);
    }

    public static SessionLookup of(SessionLookupStatus status, UserSession session) {
        return new SessionLookup(status, session);
    }

    public boolean isActive() {
        return status == SessionLookupStatus.ACTIVE;
    }

    public Optional<UserSession> activeSession() {
        return isActive() ? Optional.of(session) : Optional.empty();
    }
}
