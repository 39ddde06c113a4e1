package com.medtracker.auth.exception;

import org.springframework.http.HttpStatus;

public class EmailAlreadyRegisteredException extends AuthenticationException {

    public EmailAlreadyRegisteredException() {
        super("EMAIL_IN_USE", "EMAIL_EXISTS", HttpStatus.CONFLICT);
    }

    public EmailAlreadyRegisteredException(Throwable cause) {
        super("EMAIL_IN_USE", "EMAIL_EXISTS", HttpStatus.CONFLICT, cause);
    }
}
