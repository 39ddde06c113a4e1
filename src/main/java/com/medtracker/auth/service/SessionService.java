package com.medtracker.auth.service;

import com.medtracker.auth.entity.Account;
import com.medtracker.auth.entity.UserSession;
import com.medtracker.auth.enums.SessionLookupStatus;
import com.medtracker.auth.repository.AccountRepository;
import com.medtracker.auth.repository.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing server-side sessions.
 *
 * <p>Expiry is passive: there is no sweeper, so whoever first observes an
 * elapsed session revokes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final UserSessionRepository sessionRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    @Transactional
    public UserSession create(UUID accountId, Duration ttl, boolean demo) {
        Instant now = clock.instant();
        Account account = accountRepository.getReferenceById(accountId);

        UserSession session = UserSession.builder()
                .account(account)
                .accountId(accountId)
                .createdAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plus(ttl))
                .demo(demo)
                .build();

        session = sessionRepository.save(session);
        log.info("Session created: {} for account: {} (demo={})", session.getId(), accountId, demo);
        return session;
    }

    @Transactional(readOnly = true)
    public Optional<UserSession> get(String sessionId) {
        return parseId(sessionId).flatMap(sessionRepository::findById);
    }

    /**
     * Idempotent; an already-revoked session keeps its original revocation time.
     */
    @Transactional
    public void revoke(UUID sessionId) {
        sessionRepository.findById(sessionId).ifPresent(session -> {
            if (!session.isRevoked()) {
                session.revoke(clock.instant());
                log.info("Session revoked: {}", sessionId);
            }
        });
    }

    /**
     * Look up and classify a session reference. An elapsed session is revoked
     * here; an active one has its activity timestamp refreshed (expiry is untouched).
     */
    @Transactional
    public SessionLookup resolve(String sessionId) {
        Optional<UserSession> found = get(sessionId);
        if (found.isEmpty()) {
            return SessionLookup.absent();
        }

        UserSession session = found.get();
        if (session.isRevoked()) {
            return SessionLookup.of(SessionLookupStatus.REVOKED, session);
        }

        Instant now = clock.instant();
        if (session.isExpiredAt(now)) {
            session.revoke(now);
            log.info("Session expired and revoked: {}", session.getId());
            return SessionLookup.of(SessionLookupStatus.EXPIRED, session);
        }

        session.setLastActivityAt(now);
        return SessionLookup.of(SessionLookupStatus.ACTIVE, session);
    }

    private static Optional<UUID> parseId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(sessionId.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed session reference");
            return Optional.empty();
        }
    }
}
