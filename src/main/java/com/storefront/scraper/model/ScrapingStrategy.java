package com.storefront.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A named bundle of evasion techniques tried as a unit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScrapingStrategy {

    public static final String DEVICE_EMULATION = "deviceEmulation";
    public static final String INTERCEPT_API = "interceptApi";
    public static final String USE_PROXY = "useProxy";
    public static final String SIMULATE_HUMAN = "simulateHuman";
    public static final String ROTATE_PROXY = "rotateProxy";
    public static final String REFRESH_SESSION = "refreshSession";

    private String name;
    /** 1 is tried first. */
    private int priority;
    private double successRate;
    private boolean enabled;
    private Instant lastUsed;
    private Instant disabledAt;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    public boolean flag(String key) {
        Object value = config == null ? null : config.get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public boolean flag(String key, boolean fallback) {
        if (config == null || !config.containsKey(key)) return fallback;
        return flag(key);
    }

    public synchronized ScrapingStrategy snapshot() {
        return toBuilder().config(new HashMap<>(config)).build();
    }
}
