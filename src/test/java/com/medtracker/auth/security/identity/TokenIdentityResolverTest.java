package com.medtracker.auth.security.identity;

import com.medtracker.auth.entity.Account;
import com.medtracker.auth.enums.AuthSurface;
import com.medtracker.auth.security.token.TokenCodec;
import com.medtracker.auth.service.AccountService;
import com.medtracker.auth.testsupport.MutableClock;
import com.medtracker.auth.testsupport.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenIdentityResolverTest {

    private MutableClock clock;
    private TokenCodec codec;
    private AccountService accountService;
    private TokenIdentityResolver resolver;
    private Account account;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        codec = new TokenCodec(TestProperties.defaults(), clock);
        accountService = mock(AccountService.class);
        resolver = new TokenIdentityResolver(codec, accountService);

        account = Account.builder().email("pat@clinic.io").passwordHash("h").build();
        account.setId(UUID.randomUUID());
        when(accountService.findById(account.getId())).thenReturn(Optional.of(account));
    }

    @Test
    void valid_token_should_resolve_to_its_account() {
        Optional<CallerIdentity> identity = resolver.resolve(codec.issueForAccount(account));

        assertThat(identity).isPresent();
        assertThat(identity.get().getAccount()).isSameAs(account);
        assertThat(identity.get().getSurface()).isEqualTo(AuthSurface.TOKEN);
        assertThat(identity.get().getSession()).isNull();
    }

    @Test
    void expired_or_garbage_tokens_should_resolve_to_empty() {
        String token = codec.issueForAccount(account);
        clock.advance(Duration.ofHours(1));

        assertThat(resolver.resolve(token)).isEmpty();
        assertThat(resolver.resolve("one.two")).isEmpty();
        assertThat(resolver.resolve("one.two.three")).isEmpty();
        verify(accountService, never()).findById(any());
    }

    @Test
    void non_uuid_or_missing_subject_should_resolve_to_empty() {
        assertThat(resolver.resolve(codec.issue(Map.of("sub", "not-a-uuid"), Duration.ofMinutes(5)))).isEmpty();
        assertThat(resolver.resolve(codec.issue(Map.of("role", "x"), Duration.ofMinutes(5)))).isEmpty();
    }

    @Test
    void deactivated_account_should_resolve_to_empty() {
        account.setActive(false);

        assertThat(resolver.resolve(codec.issueForAccount(account))).isEmpty();
    }
}
