package com.medtracker.auth.security.identity;

import com.medtracker.auth.entity.Account;
import com.medtracker.auth.enums.AuthSurface;
import com.medtracker.auth.exception.InvalidTokenException;
import com.medtracker.auth.security.token.DecodedToken;
import com.medtracker.auth.security.token.TokenCodec;
import com.medtracker.auth.service.AccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Legacy bearer surface: the credential is a JWT whose subject is the account id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenIdentityResolver implements CallerIdentityResolver {

    private final TokenCodec tokenCodec;
    private final AccountService accountService;

    @Override
    public AuthSurface surface() {
        return AuthSurface.TOKEN;
    }

    @Override
    public Optional<CallerIdentity> resolve(String token) {
        DecodedToken decoded;
        try {
            decoded = tokenCodec.decode(token);
        } catch (InvalidTokenException e) {
            log.debug("Bearer token rejected: {}", e.getErrorCode());
            return Optional.empty();
        }

        if (decoded.getSubject() == null) {
            return Optional.empty();
        }
        UUID accountId;
        try {
            accountId = UUID.fromString(decoded.getSubject());
        } catch (IllegalArgumentException e) {
            log.debug("Bearer token subject is not an account id");
            return Optional.empty();
        }

        return accountService.findById(accountId)
                .filter(Account::isActive)
                .map(account -> CallerIdentity.builder()
                        .account(account)
                        .surface(AuthSurface.TOKEN)
                        .build());
    }
}
