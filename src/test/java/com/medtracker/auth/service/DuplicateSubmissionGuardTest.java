package com.medtracker.auth.service;

import com.medtracker.auth.service.DuplicateSubmissionGuard.GuardPermit;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateSubmissionGuardTest {

    private final DuplicateSubmissionGuard guard = new DuplicateSubmissionGuard();

    @Test
    void second_acquire_should_be_rejected_while_first_is_held() {
        try (GuardPermit first = guard.acquire("login:a@x.io")) {
            assertThat(first.isAcquired()).isTrue();

            try (GuardPermit second = guard.acquire("login:a@x.io")) {
                assertThat(second.isAcquired()).isFalse();
            }
            // Closing the rejected permit must not free the key
            assertThat(guard.isHeld("login:a@x.io")).isTrue();
        }
        assertThat(guard.isHeld("login:a@x.io")).isFalse();
    }

    @Test
    void different_keys_should_not_block_each_other() {
        try (GuardPermit a = guard.acquire("login:a@x.io");
             GuardPermit b = guard.acquire("login:b@x.io")) {
            assertThat(a.isAcquired()).isTrue();
            assertThat(b.isAcquired()).isTrue();
        }
    }

    @Test
    void key_should_be_released_when_body_throws() {
        assertThatThrownBy(() -> {
            try (GuardPermit permit = guard.acquire("register:a@x.io")) {
                assertThat(permit.isAcquired()).isTrue();
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(guard.isHeld("register:a@x.io")).isFalse();
        try (GuardPermit again = guard.acquire("register:a@x.io")) {
            assertThat(again.isAcquired()).isTrue();
        }
    }

    @Test
    void double_close_should_not_release_a_later_holder() {
        GuardPermit first = guard.acquire("k");
        first.close();

        try (GuardPermit second = guard.acquire("k")) {
            assertThat(second.isAcquired()).isTrue();
            first.close();
            assertThat(guard.isHeld("k")).isTrue();
        }
    }

    @Test
    void concurrent_acquire_should_admit_exactly_one() throws Exception {
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch acquiredAll = new CountDownLatch(threads);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    try {
                        start.await();
                        try (GuardPermit permit = guard.acquire("login:race@x.io")) {
                            if (permit.isAcquired()) {
                                winners.incrementAndGet();
                            }
                            acquiredAll.countDown();
                            release.await(5, TimeUnit.SECONDS);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                });
            }
            start.countDown();
            assertThat(acquiredAll.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(winners.get()).isEqualTo(1);
        } finally {
            release.countDown();
            pool.shutdown();
            pool.awaitTermination(10, TimeUnit.SECONDS);
        }

        assertThat(guard.isHeld("login:race@x.io")).isFalse();
    }
}
