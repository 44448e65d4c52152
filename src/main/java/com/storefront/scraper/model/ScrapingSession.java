package com.storefront.scraper.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Identity, cookie and activity state of one scraping session.
 * Mutated only by the session manager while holding this object's monitor.
 */
@Getter
public class ScrapingSession {

    private final String id;
    private final Instant createdAt;
    private final String platform;
    private final List<Map<String, Object>> cookies = new ArrayList<>();
    @Setter
    private String identity;
    @Setter
    private Instant lastActivity;
    @Setter
    private long requestCount;
    @Setter
    private boolean active = true;
    @Setter
    private String proxyId;

    public ScrapingSession(String id, String platform, String identity, Instant createdAt) {
        this.id = id;
        this.platform = platform;
        this.identity = identity;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }
}
