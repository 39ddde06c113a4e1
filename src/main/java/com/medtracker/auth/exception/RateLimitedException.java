package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a rate limiter key is over its budget.
 */
public class RateLimitedException extends AuthenticationException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super("Too many attempts", "TOO_MANY_ATTEMPTS", HttpStatus.TOO_MANY_REQUESTS);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
