package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * User-correctable input problem, reported with a reason code.
 */
public class ValidationFailureException extends AuthenticationException {

    public ValidationFailureException(String reason) {
        super(reason, reason, HttpStatus.BAD_REQUEST);
    }
}
