package com.storefront.scraper.manager;

import com.storefront.scraper.exception.InvalidProxyException;
import com.storefront.scraper.interfaces.ProxyLivenessCheck;
import com.storefront.scraper.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Round-robin proxy pool with liveness probing and per-endpoint circuit breaking.
 */
@Component
@Slf4j
public class ProxyPoolManager {

    private final ProxyLivenessCheck check;
    private final Clock clock;
    private final int maxFailures;
    private final Duration failureCooldown;

    private final List<ProxyEndpoint> endpoints = new CopyOnWriteArrayList<>();
    private final Map<String, FailureRecord> failures = new ConcurrentHashMap<>();
    private final AtomicInteger cursor = new AtomicInteger();
    private final Object membershipLock = new Object();

    @Autowired
    public ProxyPoolManager(ProxyLivenessCheck check,
                            Clock clock,
                            @Value("${scraper.proxy.max-failures:3}") int maxFailures,
                            @Value("${scraper.proxy.failure-cooldown.ms:300000}") long failureCooldownMs,
                            @Value("${scraper.proxy.endpoints:}") String configuredEndpoints) {
        this.check = check;
        this.clock = clock;
        this.maxFailures = maxFailures;
        this.failureCooldown = Duration.ofMillis(failureCooldownMs);
        seed(configuredEndpoints);
    }

    private void seed(String configuredEndpoints) {
        if (configuredEndpoints == null || configuredEndpoints.isBlank()) {
            log.info("No proxies configured; scrapes requesting a proxy will fail");
            return;
        }
        Arrays.stream(configuredEndpoints.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(spec -> {
                    try {
                        add(ProxyEndpoint.parse(spec));
                    } catch (InvalidProxyException e) {
                        log.warn("Skipping proxy entry: {}", e.getMessage());
                    }
                });
        log.info("Loaded {} proxies", endpoints.size());
    }

    /**
     * Next live endpoint in round-robin order. Dead candidates are charged a failure and skipped.
     */
    public Optional<ProxyEndpoint> next() {
        return nextMatching(e -> true);
    }

    public Optional<ProxyEndpoint> byCountry(String country) {
        if (country == null || country.isBlank()) {
            return next();
        }
        String tag = country.trim().toUpperCase(Locale.ROOT);
        return nextMatching(e -> e.countryTag().map(tag::equals).orElse(false));
    }

    private Optional<ProxyEndpoint> nextMatching(Predicate<ProxyEndpoint> filter) {
        List<ProxyEndpoint> candidates = endpoints.stream().filter(filter).toList();
        int size = candidates.size();
        if (size == 0) {
            return Optional.empty();
        }
        int start = cursor.getAndIncrement();
        for (int i = 0; i < size; i++) {
            ProxyEndpoint candidate = candidates.get(Math.floorMod(start + i, size));
            if (!isEligible(candidate)) {
                continue;
            }
            boolean alive = check.isAlive(candidate);
            int rate = candidate.recordCheck(alive);
            if (alive) {
                candidate.setLastUsed(clock.instant());
                log.debug("Selected proxy {} | successRate={}", candidate.id(), rate);
                return Optional.of(candidate);
            }
            log.warn("Proxy {} failed liveness check | successRate={}", candidate.id(), rate);
            markFailed(candidate);
        }
        log.warn("No live proxy among {} candidates", size);
        return Optional.empty();
    }

    /**
     * Skips endpoints still cooling down and reopens inactive ones whose cooldown has elapsed.
     */
    private boolean isEligible(ProxyEndpoint endpoint) {
        if (isBlocked(endpoint)) {
            return false;
        }
        if (!endpoint.isActive()) {
            endpoint.setActive(true);
            log.info("Proxy {} reactivated after cooldown", endpoint.id());
        }
        return true;
    }

    public boolean isBlocked(ProxyEndpoint endpoint) {
        FailureRecord record = failures.get(endpoint.id());
        if (record == null) {
            return false;
        }
        return Duration.between(record.lastFailure(), clock.instant()).compareTo(failureCooldown) < 0;
    }

    public void markFailed(ProxyEndpoint endpoint) {
        Instant now = clock.instant();
        FailureRecord record = failures.compute(endpoint.id(),
                (id, existing) -> new FailureRecord(existing == null ? 1 : existing.count() + 1, now));
        if (record.count() >= maxFailures && endpoint.isActive()) {
            endpoint.setActive(false);
            log.warn("Proxy {} deactivated after {} failures", endpoint.id(), record.count());
        } else {
            log.debug("Proxy {} failure recorded | count={}", endpoint.id(), record.count());
        }
    }

    public void markFailed(String proxyId) {
        find(proxyId).ifPresent(this::markFailed);
    }

    public int failureCount(String proxyId) {
        FailureRecord record = failures.get(proxyId);
        return record == null ? 0 : record.count();
    }

    public void add(ProxyEndpoint endpoint) {
        if (!isValid(endpoint)) {
            throw new InvalidProxyException("Invalid proxy configuration: " + endpoint);
        }
        synchronized (membershipLock) {
            endpoints.removeIf(e -> e.id().equals(endpoint.id()));
            endpoints.add(endpoint);
        }
        log.info("Added proxy {}", endpoint);
    }

    public boolean remove(String proxyId) {
        boolean removed;
        synchronized (membershipLock) {
            removed = endpoints.removeIf(e -> e.id().equals(proxyId));
        }
        failures.remove(proxyId);
        if (removed) {
            log.info("Removed proxy {}", proxyId);
        }
        return removed;
    }

    public static boolean isValid(ProxyEndpoint endpoint) {
        return endpoint != null
                && endpoint.getHost() != null && !endpoint.getHost().isBlank()
                && endpoint.getPort() >= 1 && endpoint.getPort() <= 65535
                && endpoint.getProtocol() != null;
    }

    public void clearFailures() {
        failures.clear();
        endpoints.forEach(e -> e.setActive(true));
        log.info("Cleared proxy failure records");
    }

    /**
     * Checks every active endpoint once.
     *
     * @return number of endpoints that answered
     */
    public int refresh() {
        int alive = 0;
        for (ProxyEndpoint endpoint : active()) {
            boolean ok = check.isAlive(endpoint);
            endpoint.recordCheck(ok);
            if (ok) {
                alive++;
            } else {
                markFailed(endpoint);
            }
        }
        log.info("Proxy refresh complete | alive={}/{}", alive, endpoints.size());
        return alive;
    }

    public Optional<ProxyEndpoint> find(String proxyId) {
        return endpoints.stream().filter(e -> e.id().equals(proxyId)).findFirst();
    }

    public List<ProxyEndpoint> all() {
        return List.copyOf(endpoints);
    }

    public List<ProxyEndpoint> active() {
        return endpoints.stream().filter(ProxyEndpoint::isActive).toList();
    }

    public ProxyPoolStats stats() {
        int total = endpoints.size();
        int active = (int) endpoints.stream().filter(ProxyEndpoint::isActive).count();
        OptionalDouble avg = endpoints.stream()
                .filter(e -> e.getSuccessRate() != null)
                .mapToInt(ProxyEndpoint::getSuccessRate)
                .average();
        return new ProxyPoolStats(total, active, total - active, avg.orElse(0), failures.size());
    }

    private record FailureRecord(int count, Instant lastFailure) {
    }

    public record ProxyPoolStats(int total, int active, int inactive, double averageSuccessRate, int failedRecords) {
    }
}
