package com.medtracker.auth.security.identity;

import com.medtracker.auth.enums.AuthSurface;

import java.util.Optional;

/**
 * Resolves a client-held credential to a caller identity. Implementations
 * never throw for bad credentials; they return empty.
 */
public interface CallerIdentityResolver {

    AuthSurface surface();

    Optional<CallerIdentity> resolve(String credential);
}
