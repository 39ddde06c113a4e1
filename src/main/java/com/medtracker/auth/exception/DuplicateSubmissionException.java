package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an identical request is already in flight.
 */
public class DuplicateSubmissionException extends AuthenticationException {

    public DuplicateSubmissionException() {
        super("Request already in progress", "DUPLICATE_SUBMISSION", HttpStatus.CONFLICT);
    }
}
