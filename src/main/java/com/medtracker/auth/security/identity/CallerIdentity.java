package com.medtracker.auth.security.identity;

import com.medtracker.auth.entity.Account;
import com.medtracker.auth.entity.UserSession;
import com.medtracker.auth.enums.AuthSurface;
import lombok.Builder;
import lombok.Getter;

/**
 * An authenticated caller. {@code session} is null for token callers.
 */
@Getter
@Builder
public class CallerIdentity {

    private final Account account;
    private final UserSession session;
    private final AuthSurface surface;
}
