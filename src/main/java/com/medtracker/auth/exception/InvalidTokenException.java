package com.medtracker.auth.exception;

/**
 * Exception thrown for tokens with a bad signature, issuer, audience or body.
 */
public class InvalidTokenException extends RuntimeException {

    private final String errorCode;

    public InvalidTokenException(String message) {
        this(message, "INVALID_TOKEN");
    }

    public InvalidTokenException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "INVALID_TOKEN";
    }

    public String getErrorCode() {
        return errorCode;
    }
}
