package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * No usable caller identity. Rendered in the legacy {@code {"detail": ...}} shape.
 */
public class SessionRequiredException extends AuthenticationException {

    private final boolean clearCookie;

    public SessionRequiredException(String reason) {
        this(reason, false);
    }

    public SessionRequiredException(String reason, boolean clearCookie) {
        super(reason, reason, HttpStatus.UNAUTHORIZED);
        this.clearCookie = clearCookie;
    }

    public boolean isClearCookie() {
        return clearCookie;
    }
}
