package com.medtracker.auth.security.token;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * Verified token contents. {@code claims} holds only the caller-supplied
 * (non-registered) claims.
 */
@Getter
@Builder
public class DecodedToken {

    private final String subject;
    private final String tokenId;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final Map<String, Object> claims;

    public Object getClaim(String name) {
        return claims.get(name);
    }
}
