package com.medtracker.auth.service;

import com.medtracker.auth.entity.UserSession;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Result of a successful orchestrator flow: payload, status, and what to do
 * with the client's session cookie.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthOutcome<T> {

    public enum CookieAction {
        NONE,
        SET,
        CLEAR
    }

    private final T data;
    private final HttpStatus status;
    private final CookieAction cookieAction;
    private final UserSession session;

    public static <T> AuthOutcome<T> of(T data, HttpStatus status) {
        return new AuthOutcome<>(data, status, CookieAction.NONE, null);
    }

    public static <T> AuthOutcome<T> withSession(T data, HttpStatus status, UserSession session) {
        return new AuthOutcome<>(data, status, CookieAction.SET, session);
    }

    public static <T> AuthOutcome<T> clearingCookie(T data, HttpStatus status) {
        return new AuthOutcome<>(data, status, CookieAction.CLEAR, null);
    }
}
