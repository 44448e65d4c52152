package com.storefront.scraper.manager;

import com.storefront.scraper.exception.RateLimitExceededException;
import com.storefront.scraper.utils.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Combined concurrency gate and sliding-window request budget.
 * Both are reserved together under one monitor; waiting happens outside it.
 */
@Component
@Slf4j
public class RateLimiter {

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration window;
    private final Duration acquireTimeout;
    private final long pollIntervalMs;

    private final Object lock = new Object();
    private final Deque<Long> requestTimes = new ArrayDeque<>();
    private int inFlight;
    private int maxRequests;
    private int maxConcurrent;

    @Autowired
    public RateLimiter(Clock clock,
                       Sleeper sleeper,
                       @Value("${scraper.rate-limit.max-requests:15}") int maxRequests,
                       @Value("${scraper.rate-limit.max-concurrent:3}") int maxConcurrent,
                       @Value("${scraper.rate-limit.window.ms:60000}") long windowMs,
                       @Value("${scraper.rate-limit.acquire-timeout.ms:30000}") long acquireTimeoutMs,
                       @Value("${scraper.rate-limit.poll-interval.ms:250}") long pollIntervalMs) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.window = Duration.ofMillis(windowMs);
        this.acquireTimeout = Duration.ofMillis(acquireTimeoutMs);
        this.pollIntervalMs = Math.max(1, pollIntervalMs);
        updateConfig(maxRequests, maxConcurrent);
    }

    /**
     * Blocks until a slot and budget are both free, polling at a fixed interval.
     *
     * @throws RateLimitExceededException if nothing could be reserved within the acquire timeout
     */
    public Permit acquire() {
        long start = clock.millis();
        while (true) {
            Permit permit = tryAcquire();
            if (permit != null) {
                return permit;
            }
            long waited = clock.millis() - start;
            if (waited >= acquireTimeout.toMillis()) {
                Status status = status();
                log.warn("Rate limit wait expired | waited={}ms | inFlight={} | lastWindow={}",
                        waited, status.inFlight(), status.requestsInWindow());
                throw new RateLimitExceededException(
                        "Rate limit exceeded: no slot within " + acquireTimeout.toMillis() + "ms",
                        Duration.ofMillis(waited));
            }
            try {
                sleeper.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitExceededException("Interrupted while waiting for rate limiter",
                        Duration.ofMillis(clock.millis() - start));
            }
        }
    }

    /**
     * @return a permit, or null when either limit is currently saturated
     */
    public Permit tryAcquire() {
        synchronized (lock) {
            long now = clock.millis();
            evictExpired(now);
            if (inFlight >= maxConcurrent || requestTimes.size() >= maxRequests) {
                return null;
            }
            inFlight++;
            requestTimes.addLast(now);
            return new Permit();
        }
    }

    public Status status() {
        synchronized (lock) {
            evictExpired(clock.millis());
            return new Status(inFlight, requestTimes.size(), maxRequests, maxConcurrent);
        }
    }

    public void updateConfig(int maxRequests, int maxConcurrent) {
        if (maxRequests < 1 || maxConcurrent < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        synchronized (lock) {
            this.maxRequests = maxRequests;
            this.maxConcurrent = maxConcurrent;
        }
        log.info("Rate limiter configured | maxRequests={} per {}s | maxConcurrent={}",
                maxRequests, window.toSeconds(), maxConcurrent);
    }

    private void evictExpired(long now) {
        long cutoff = now - window.toMillis();
        while (!requestTimes.isEmpty() && requestTimes.peekFirst() <= cutoff) {
            requestTimes.pollFirst();
        }
    }

    private void releaseSlot() {
        synchronized (lock) {
            if (inFlight > 0) {
                inFlight--;
            }
        }
    }

    /**
     * Holds one concurrency slot. Releasing is idempotent; the request entry stays until it ages out.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                releaseSlot();
            }
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            release();
        }
    }

    public record Status(int inFlight, int requestsInWindow, int maxRequests, int maxConcurrent) {
    }
}
