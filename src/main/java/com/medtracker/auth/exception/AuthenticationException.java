package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for authentication flow failures. Each subtype maps to
 * exactly one HTTP status and error code.
 */
public class AuthenticationException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    public AuthenticationException(String message) {
        this(message, "AUTH_ERROR", HttpStatus.UNAUTHORIZED);
    }

    public AuthenticationException(String message, String errorCode, HttpStatus status) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    public AuthenticationException(String message, String errorCode, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
