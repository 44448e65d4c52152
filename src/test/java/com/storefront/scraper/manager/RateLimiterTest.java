package com.storefront.scraper.manager;

import com.storefront.scraper.exception.RateLimitExceededException;
import com.storefront.scraper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateLimiter Tests")
class RateLimiterTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    }

    private RateLimiter limiter(int maxRequests, int maxConcurrent, long windowMs, long timeoutMs) {
        return new RateLimiter(clock, clock.sleeper(), maxRequests, maxConcurrent, windowMs, timeoutMs, 250);
    }

    @Nested
    @DisplayName("Concurrency gate")
    class ConcurrencyGate {

        @Test
        @DisplayName("tryAcquire_atConcurrencyLimit_returnsNull")
        void tryAcquire_atConcurrencyLimit_returnsNull() {
            RateLimiter limiter = limiter(15, 3, 60_000, 30_000);

            RateLimiter.Permit a = limiter.tryAcquire();
            RateLimiter.Permit b = limiter.tryAcquire();
            RateLimiter.Permit c = limiter.tryAcquire();

            assertThat(List.of(a, b, c)).doesNotContainNull();
            assertThat(limiter.tryAcquire()).isNull();
            assertThat(limiter.status().inFlight()).isEqualTo(3);
        }

        @Test
        @DisplayName("release_freesSlotButKeepsWindowEntry")
        void release_freesSlotButKeepsWindowEntry() {
            RateLimiter limiter = limiter(15, 1, 60_000, 30_000);
            RateLimiter.Permit permit = limiter.tryAcquire();

            permit.release();

            RateLimiter.Status status = limiter.status();
            assertThat(status.inFlight()).isZero();
            assertThat(status.requestsInWindow()).isEqualTo(1);
            assertThat(limiter.tryAcquire()).isNotNull();
        }

        @Test
        @DisplayName("release_calledTwice_releasesOnce")
        void release_calledTwice_releasesOnce() {
            RateLimiter limiter = limiter(15, 2, 60_000, 30_000);
            RateLimiter.Permit first = limiter.tryAcquire();
            limiter.tryAcquire();

            first.release();
            first.close();

            assertThat(first.isReleased()).isTrue();
            assertThat(limiter.status().inFlight()).isEqualTo(1);
        }

        @Test
        @DisplayName("acquire_fromManyThreads_neverExceedsConcurrencyLimit")
        void acquire_fromManyThreads_neverExceedsConcurrencyLimit() throws InterruptedException {
            RateLimiter limiter = new RateLimiter(java.time.Clock.systemUTC(),
                    ms -> Thread.sleep(1), 1000, 3, 60_000, 10_000, 1);
            AtomicInteger current = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(40);

            for (int i = 0; i < 40; i++) {
                pool.submit(() -> {
                    try (RateLimiter.Permit ignored = limiter.acquire()) {
                        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
                        Thread.sleep(2);
                        current.decrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            pool.shutdownNow();
            assertThat(peak.get()).isLessThanOrEqualTo(3);
            assertThat(limiter.status().inFlight()).isZero();
        }
    }

    @Nested
    @DisplayName("Sliding window")
    class SlidingWindow {

        @Test
        @DisplayName("tryAcquire_windowBudgetSpent_returnsNullUntilOldestAgesOut")
        void tryAcquire_windowBudgetSpent_returnsNullUntilOldestAgesOut() {
            RateLimiter limiter = limiter(2, 5, 60_000, 30_000);
            limiter.tryAcquire().release();
            clock.advanceMillis(10_000);
            limiter.tryAcquire().release();

            assertThat(limiter.tryAcquire()).isNull();

            clock.advanceMillis(50_000);
            assertThat(limiter.tryAcquire()).isNotNull();
            assertThat(limiter.tryAcquire()).isNull();
        }

        @Test
        @DisplayName("acquire_budgetSpent_waitsUntilWindowSlides")
        void acquire_budgetSpent_waitsUntilWindowSlides() {
            RateLimiter limiter = limiter(1, 5, 5_000, 30_000);
            limiter.tryAcquire().release();

            RateLimiter.Permit permit = limiter.acquire();

            assertThat(permit).isNotNull();
            assertThat(clock.millis() - java.time.Instant.parse("2025-01-01T00:00:00Z").toEpochMilli())
                    .isGreaterThanOrEqualTo(5_000);
        }

        @Test
        @DisplayName("acquire_neverFreed_throwsAfterTimeout")
        void acquire_neverFreed_throwsAfterTimeout() {
            RateLimiter limiter = limiter(15, 1, 60_000, 2_000);
            limiter.tryAcquire();

            assertThatThrownBy(limiter::acquire)
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> assertThat(((RateLimitExceededException) e).getWaited())
                            .isGreaterThanOrEqualTo(Duration.ofMillis(2_000)));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("updateConfig_raisesLimits_admitsMoreRequests")
        void updateConfig_raisesLimits_admitsMoreRequests() {
            RateLimiter limiter = limiter(1, 1, 60_000, 30_000);
            List<RateLimiter.Permit> permits = new ArrayList<>();
            permits.add(limiter.tryAcquire());
            assertThat(limiter.tryAcquire()).isNull();

            limiter.updateConfig(5, 5);

            permits.add(limiter.tryAcquire());
            assertThat(permits).doesNotContainNull();
            assertThat(limiter.status().maxRequests()).isEqualTo(5);
        }

        @Test
        @DisplayName("updateConfig_nonPositive_throwsIllegalArgumentException")
        void updateConfig_nonPositive_throwsIllegalArgumentException() {
            RateLimiter limiter = limiter(1, 1, 60_000, 30_000);

            assertThatThrownBy(() -> limiter.updateConfig(0, 1)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
