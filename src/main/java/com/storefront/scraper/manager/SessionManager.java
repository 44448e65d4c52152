package com.storefront.scraper.manager;

import com.storefront.scraper.model.ScrapingSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns scraping sessions. Each session is mutated under its own monitor.
 */
@Component
@Slf4j
public class SessionManager {

    static final List<String> DEFAULT_IDENTITIES = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/118.0.0.0 Safari/537.36"
    );

    private final Clock clock;
    private final Random random;
    private final int rotationInterval;
    private final Duration defaultMaxAge;

    private final Map<String, ScrapingSession> sessions = new ConcurrentHashMap<>();
    private final List<String> identities = new CopyOnWriteArrayList<>(DEFAULT_IDENTITIES);

    @Autowired
    public SessionManager(Clock clock,
                          Random behaviorRandom,
                          @Value("${scraper.session.rotation-interval:50}") int rotationInterval,
                          @Value("${scraper.session.max-age.hours:24}") long maxAgeHours) {
        this.clock = clock;
        this.random = behaviorRandom;
        this.rotationInterval = rotationInterval;
        this.defaultMaxAge = Duration.ofHours(maxAgeHours);
    }

    public ScrapingSession create(String platform) {
        Instant now = clock.instant();
        String id = "session_" + now.toEpochMilli() + "_" + Long.toString(random.nextLong() & Long.MAX_VALUE, 36);
        ScrapingSession session = new ScrapingSession(id, platform, randomIdentity(), now);
        sessions.put(id, session);
        log.info("Created session {} | platform={}", id, platform);
        return session;
    }

    public Optional<ScrapingSession> get(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    /**
     * Records one request against the session, rotating its identity every N requests.
     *
     * @return false if the session is unknown or inactive
     */
    public boolean touch(String sessionId) {
        ScrapingSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            if (!session.isActive()) {
                log.warn("Refusing activity on inactive session {}", sessionId);
                return false;
            }
            long count = session.getRequestCount() + 1;
            session.setRequestCount(count);
            session.setLastActivity(clock.instant());
            if (rotationInterval > 0 && count % rotationInterval == 0) {
                session.setIdentity(randomIdentity());
                log.info("Rotated identity for session {} after {} requests", sessionId, count);
            }
        }
        return true;
    }

    public void addCookies(String sessionId, List<Map<String, Object>> cookies) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.getCookies().addAll(cookies);
            }
        });
    }

    public List<Map<String, Object>> getCookies(String sessionId) {
        return get(sessionId).map(session -> {
            synchronized (session) {
                return List.copyOf(session.getCookies());
            }
        }).orElse(List.of());
    }

    public void clearCookies(String sessionId) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.getCookies().clear();
            }
        });
    }

    /**
     * Replaces the stored cookies with the page's current jar.
     */
    public void replaceCookies(String sessionId, List<Map<String, Object>> cookies) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.getCookies().clear();
                session.getCookies().addAll(cookies);
            }
        });
    }

    public void deactivate(String sessionId) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.setActive(false);
            }
            log.info("Deactivated session {}", sessionId);
        });
    }

    public void reactivate(String sessionId) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.setActive(true);
                session.setLastActivity(clock.instant());
            }
            log.info("Reactivated session {}", sessionId);
        });
    }

    public void assignProxy(String sessionId, String proxyId) {
        get(sessionId).ifPresent(session -> {
            synchronized (session) {
                session.setProxyId(proxyId);
            }
        });
    }

    /**
     * Drops every session created more than maxAge ago, active or not.
     *
     * @return number of sessions removed
     */
    public int sweep(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> expired = new ArrayList<>();
        sessions.forEach((id, session) -> {
            if (session.getCreatedAt().isBefore(cutoff)) {
                expired.add(id);
            }
        });
        expired.forEach(sessions::remove);
        if (!expired.isEmpty()) {
            log.info("Swept {} expired sessions", expired.size());
        }
        return expired.size();
    }

    @Scheduled(fixedDelayString = "${scraper.session.sweep.interval.ms:3600000}")
    public void scheduledSweep() {
        sweep(defaultMaxAge);
    }

    public void addIdentity(String identity) {
        if (identity != null && !identity.isBlank() && !identities.contains(identity)) {
            identities.add(identity);
        }
    }

    public boolean removeIdentity(String identity) {
        if (identities.size() <= 1 && identities.contains(identity)) {
            log.warn("Refusing to remove the last identity");
            return false;
        }
        return identities.remove(identity);
    }

    public List<String> identities() {
        return List.copyOf(identities);
    }

    public List<ScrapingSession> activeSessions() {
        return sessions.values().stream().filter(ScrapingSession::isActive).toList();
    }

    public SessionStats stats() {
        Instant now = clock.instant();
        int total = sessions.size();
        int active = 0;
        long totalRequests = 0;
        long totalAgeMs = 0;
        for (ScrapingSession session : sessions.values()) {
            if (session.isActive()) active++;
            totalRequests += session.getRequestCount();
            totalAgeMs += Duration.between(session.getCreatedAt(), now).toMillis();
        }
        return new SessionStats(total, active, total - active, total == 0 ? 0 : totalAgeMs / total, totalRequests);
    }

    private String randomIdentity() {
        List<String> snapshot = List.copyOf(identities);
        return snapshot.get(random.nextInt(snapshot.size()));
    }

    public record SessionStats(int total, int active, int inactive, long averageAgeMs, long totalRequests) {
    }
}
