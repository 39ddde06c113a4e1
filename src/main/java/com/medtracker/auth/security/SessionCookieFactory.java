package com.medtracker.auth.security;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.entity.UserSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the session cookie. One cookie name is shared by every flow.
 */
@Component
@RequiredArgsConstructor
public class SessionCookieFactory {

    private final AuthProperties authProperties;
    private final Clock clock;

    public String cookieName() {
        return authProperties.getSession().getCookieName();
    }

    public ResponseCookie issue(UserSession session) {
        Duration maxAge = Duration.between(clock.instant(), session.getExpiresAt());
        return base(session.getId().toString())
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build();
    }

    public ResponseCookie clear() {
        return base("")
                .maxAge(Duration.ZERO)
                .build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        AuthProperties.Session config = authProperties.getSession();
        return ResponseCookie.from(config.getCookieName(), value)
                .httpOnly(true)
                .secure(Boolean.TRUE.equals(config.getCookieSecure()))
                .sameSite(config.getCookieSameSite())
                .path("/");
    }
}
