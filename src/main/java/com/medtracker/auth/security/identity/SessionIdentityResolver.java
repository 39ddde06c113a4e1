package com.medtracker.auth.security.identity;

import com.medtracker.auth.entity.Account;
import com.medtracker.auth.enums.AuthSurface;
import com.medtracker.auth.service.AccountService;
import com.medtracker.auth.service.SessionLookup;
import com.medtracker.auth.service.SessionService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cookie surface: the credential is a session id.
 */
@Component
@RequiredArgsConstructor
public class SessionIdentityResolver implements CallerIdentityResolver {

    private final SessionService sessionService;
    private final AccountService accountService;

    @Override
    public AuthSurface surface() {
        return AuthSurface.SESSION;
    }

    @Override
    public Optional<CallerIdentity> resolve(String sessionId) {
        return inspect(sessionId).toIdentity();
    }

    /**
     * Session lookup plus owning account, for callers that must tell the
     * failure cases apart.
     */
    public SessionResolution inspect(String sessionId) {
        SessionLookup lookup = sessionService.resolve(sessionId);
        Account account = null;
        if (lookup.isActive()) {
            account = accountService.findById(lookup.getSession().getAccountId())
                    .filter(Account::isActive)
                    .orElse(null);
        }
        return new SessionResolution(lookup, account);
    }

    @Getter
    @RequiredArgsConstructor
    public static class SessionResolution {
        private final SessionLookup lookup;
        private final Account account;

        public boolean isAccountMissing() {
            return lookup.isActive() && account == null;
        }

        public Optional<CallerIdentity> toIdentity() {
            if (!lookup.isActive() || account == null) {
                return Optional.empty();
            }
            return Optional.of(CallerIdentity.builder()
                    .account(account)
                    .session(lookup.getSession())
                    .surface(AuthSurface.SESSION)
                    .build());
        }
    }
}
