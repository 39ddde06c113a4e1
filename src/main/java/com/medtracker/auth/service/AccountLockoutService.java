package com.medtracker.auth.service;

import com.medtracker.auth.config.AuthProperties;
import com.medtracker.auth.entity.Account;
import com.medtracker.auth.enums.LockoutState;
import com.medtracker.auth.repository.AccountRepository;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Service for managing account lockouts.
 *
 * <p>Lock state is never stored: it is {@code lock_until > now}, evaluated on
 * every call. Counter updates run under a pessimistic row lock so concurrent
 * failures cannot lose increments.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockoutService {

    private final AccountRepository accountRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    public LockoutState stateOf(Account account) {
        return account.isLockedAt(clock.instant()) ? LockoutState.LOCKED : LockoutState.UNLOCKED;
    }

    public boolean isLocked(Account account) {
        return stateOf(account) == LockoutState.LOCKED;
    }

    public Duration remainingLock(Account account) {
        Instant now = clock.instant();
        if (!account.isLockedAt(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, account.getLockUntil());
    }

    /**
     * Count one failed attempt. While locked nothing changes; reaching the
     * threshold sets {@code lock_until}. An elapsed lock does not reset the count.
     */
    @Transactional
    public LockoutOutcome recordFailure(UUID accountId) {
        Account account = accountRepository.findForUpdate(accountId)
                .orElseThrow(() -> new NoSuchElementException("Account not found: " + accountId));
        Instant now = clock.instant();

        if (account.isLockedAt(now)) {
            return LockoutOutcome.of(account, false);
        }

        int attempts = account.getFailedAttempts() + 1;
        account.setFailedAttempts(attempts);

        AuthProperties.Lockout policy = authProperties.getLockout();
        boolean triggered = false;
        if (attempts >= policy.getThreshold()) {
            account.setLockUntil(now.plus(policy.getDuration()));
            triggered = true;
            log.warn("Account locked: {} after {} failed attempts, until {}",
                    accountId, attempts, account.getLockUntil());
        } else {
            log.debug("Failed attempt #{} for account: {}", attempts, accountId);
        }
        return LockoutOutcome.of(account, triggered);
    }

    @Transactional
    public void recordSuccess(UUID accountId) {
        accountRepository.findForUpdate(accountId).ifPresent(account -> {
            if (account.getFailedAttempts() != 0 || account.getLockUntil() != null) {
                log.debug("Reset failed attempts for account: {}", accountId);
            }
            account.setFailedAttempts(0);
            account.setLockUntil(null);
        });
    }

    @Getter
    @Builder
    public static class LockoutOutcome {
        private final int failedAttempts;
        private final Instant lockUntil;
        private final boolean lockTriggered;

        static LockoutOutcome of(Account account, boolean lockTriggered) {
            return LockoutOutcome.builder()
                    .failedAttempts(account.getFailedAttempts())
                    .lockUntil(account.getLockUntil())
                    .lockTriggered(lockTriggered)
                    .build();
        }
    }
}
