package com.medtracker.auth.exception;

import java.time.Instant;

public class TokenExpiredException extends InvalidTokenException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt) {
        super("Token has expired", "TOKEN_EXPIRED");
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
