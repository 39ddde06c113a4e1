package com.medtracker.auth.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.medtracker.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window rate limiter keyed by an arbitrary string such as
 * {@code login:<email>} or {@code demo:start}. Process-local.
 *
 * <p>Windows not touched for a full window length are evicted, so distinct
 * keys do not accumulate.
 */
@Slf4j
@Service
public class RateLimitingService {

    private static final class Window {
        volatile long windowStartEpochSec;
        final AtomicInteger count = new AtomicInteger(0);

        Window(long start) {
            this.windowStartEpochSec = start;
        }
    }

    private final Cache<String, Window> windows;
    private final AuthProperties.RateLimit config;
    private final Clock clock;

    public RateLimitingService(AuthProperties authProperties, Clock clock) {
        this.config = authProperties.getRateLimit();
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofSeconds(windowSeconds()))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Count one event against {@code key}; false once the current window is over its limit.
     */
    public boolean allow(String key) {
        long nowSec = clock.instant().getEpochSecond();
        long start = windowStart(nowSec);

        Window w = windows.get(key, k -> new Window(start));

        if (w.windowStartEpochSec != start) {
            synchronized (w) {
                if (w.windowStartEpochSec != start) {
                    // Count is cleared before the new start is visible
                    w.count.set(0);
                    w.windowStartEpochSec = start;
                }
            }
        }

        int n = w.count.incrementAndGet();
        int limit = limitFor(key);
        if (n > limit) {
            log.warn("Rate limit exceeded for key prefix '{}' ({} > {})", prefixOf(key), n, limit);
            return false;
        }
        return true;
    }

    /**
     * Seconds until the window containing now rolls over.
     */
    public long retryAfterSeconds(String key) {
        long nowSec = clock.instant().getEpochSecond();
        return Math.max(1, windowStart(nowSec) + windowSeconds() - nowSec);
    }

    public void reset() {
        windows.invalidateAll();
    }

    long trackedKeys() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    int limitFor(String key) {
        Integer override = config.getLimits().get(prefixOf(key));
        int limit = override != null ? override : config.getMaxRequests();
        return Math.max(1, limit);
    }

    private long windowStart(long nowSec) {
        long size = windowSeconds();
        return (nowSec / size) * size;
    }

    private long windowSeconds() {
        return Math.max(1, config.getWindow().getSeconds());
    }

    private static String prefixOf(String key) {
        int idx = key.indexOf(':');
        return idx < 0 ? key : key.substring(0, idx);
    }
}
