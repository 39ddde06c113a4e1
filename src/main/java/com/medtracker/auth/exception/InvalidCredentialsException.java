package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Wrong password, unknown account and malformed email all surface as this
 * exception so callers cannot tell them apart.
 */
public class InvalidCredentialsException extends AuthenticationException {

    public InvalidCredentialsException() {
        super("Invalid credentials", "INVALID_CREDENTIALS", HttpStatus.UNAUTHORIZED);
    }
}
