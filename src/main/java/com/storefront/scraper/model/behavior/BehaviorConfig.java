package com.storefront.scraper.model.behavior;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ranges for the human behaviour synthesizer. Every delay is drawn from a [min,max] range.
 */
@Component
@ConfigurationProperties(prefix = "scraper.behavior")
@Data
public class BehaviorConfig {

    private Mouse mouse = new Mouse();
    private Scroll scroll = new Scroll();
    private Typing typing = new Typing();
    private Reading reading = new Reading();
    private Delays delays = new Delays();

    @Data
    public static class Mouse {
        private boolean enabled = true;
        private long minDelay = 50;
        private long maxDelay = 200;
        private boolean naturalCurves = true;
        private int minWaypoints = 5;
        private int maxWaypoints = 12;
        private int minCurvePoints = 2;
        private int maxCurvePoints = 4;
        private double jitter = 25;
    }

    @Data
    public static class Scroll {
        private boolean enabled = true;
        private int minScroll = 100;
        private int maxScroll = 300;
        private long minStepDelay = 500;
        private long maxStepDelay = 1000;
        private int minSteps = 2;
        private int maxSteps = 5;
        private double reverseProbability = 0.2;
        private double longPauseProbability = 0.3;
        private long minLongPause = 2000;
        private long maxLongPause = 5000;
    }

    @Data
    public static class Typing {
        private long minDelay = 50;
        private long maxDelay = 150;
        private boolean naturalErrors = true;
        private double errorProbability = 0.02;
        private double hesitationProbability = 0.1;
        private long minHesitation = 200;
        private long maxHesitation = 600;
    }

    @Data
    public static class Reading {
        private int minWordsPerMinute = 200;
        private int maxWordsPerMinute = 300;
        private int charsPerWord = 5;
        private long maxReadingTimeMs = 30_000;
        private long minStepMs = 1500;
        private long maxStepMs = 2500;
        private double scrollProbability = 0.3;
        private int minScroll = 50;
        private int maxScroll = 150;
    }

    @Data
    public static class Delays {
        private long minPageLoad = 1000;
        private long maxPageLoad = 3000;
        private long minBetweenActions = 300;
        private long maxBetweenActions = 1200;
        private int maxHoverTargets = 3;
        private long minHoverPause = 200;
        private long maxHoverPause = 800;
    }
}
