package com.medtracker.auth.exception;

public class TokenMalformedException extends InvalidTokenException {

    public TokenMalformedException(String message) {
        super(message, "TOKEN_MALFORMED");
    }
}
