package com.medtracker.auth.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rejects a second in-flight request for the same key instead of queueing it.
 * Process-local.
 *
 * <pre>
 * try (GuardPermit permit = guard.acquire("login:" + email)) {
 *     if (!permit.isAcquired()) { ... }
 * }
 * </pre>
 */
@Slf4j
@Service
public class DuplicateSubmissionGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public GuardPermit acquire(String key) {
        if (inFlight.add(key)) {
            return new GuardPermit(this, key, true);
        }
        log.debug("Duplicate submission rejected for key prefix '{}'", key.split(":", 2)[0]);
        return new GuardPermit(this, key, false);
    }

    public boolean isHeld(String key) {
        return inFlight.contains(key);
    }

    public void reset() {
        inFlight.clear();
    }

    private void release(String key) {
        inFlight.remove(key);
    }

    /**
     * Result of {@link #acquire}. Closing releases the key if this permit holds
     * it; closing a rejected permit, or closing twice, does nothing.
     */
    public static final class GuardPermit implements AutoCloseable {

        private final DuplicateSubmissionGuard guard;
        private final String key;
        private final boolean acquired;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private GuardPermit(DuplicateSubmissionGuard guard, String key, boolean acquired) {
            this.guard = guard;
            this.key = key;
            this.acquired = acquired;
        }

        public boolean isAcquired() {
            return acquired;
        }

        @Override
        public void close() {
            if (acquired && released.compareAndSet(false, true)) {
                guard.release(key);
            }
        }
    }
}
