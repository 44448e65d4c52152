package com.storefront.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call knobs. Unset values fall back to configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScrapeOptions {

    /** Single strategy to try; null means the selector's default plan. */
    private String strategy;
    private Boolean useProxy;
    private Boolean simulateHuman;
    private Integer maxRetries;
    /** Reuse an existing active session instead of opening a new one. */
    private String sessionId;
    /** Restrict proxy selection to a country tag. */
    private String proxyCountry;

    public static ScrapeOptions defaults() {
        return new ScrapeOptions();
    }

    public boolean proxyRequested() {
        return Boolean.TRUE.equals(useProxy);
    }

    public boolean humanSimulationEnabled() {
        return !Boolean.FALSE.equals(simulateHuman);
    }

    public int maxRetriesOr(int fallback) {
        return maxRetries != null && maxRetries > 0 ? maxRetries : fallback;
    }
}
