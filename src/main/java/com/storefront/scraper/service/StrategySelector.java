package com.storefront.scraper.service;

import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.exception.NoStrategyAvailableException;
import com.storefront.scraper.exception.StrategiesExhaustedException;
import com.storefront.scraper.model.ScrapingStrategy;
import com.storefront.scraper.utils.FailureClassifier;
import com.storefront.scraper.utils.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of scraping strategies with smoothed success rates, failure pattern tracking and
 * an attempt loop with exponential backoff.
 */
@Service
@Slf4j
public class StrategySelector {

    public static final String STEALTH = "stealth";
    public static final String MOBILE = "mobile";
    public static final String API_INTERCEPTION = "api_interception";
    public static final String PROXY_ROTATION = "proxy_rotation";
    public static final String SESSION_REFRESH = "session_refresh";

    private static final Comparator<ScrapingStrategy> SELECTION_ORDER =
            Comparator.comparingInt(ScrapingStrategy::getPriority)
                    .thenComparing(ScrapingStrategy::getSuccessRate, Comparator.reverseOrder());

    private final Clock clock;
    private final Sleeper sleeper;
    private final long backoffBaseMs;
    private final double alpha;

    private final Map<String, ScrapingStrategy> strategies = new ConcurrentHashMap<>();
    private final Map<FailureKind, FailurePattern> failurePatterns = new ConcurrentHashMap<>();

    @Autowired
    public StrategySelector(Clock clock,
                            Sleeper sleeper,
                            @Value("${scraper.retry.backoff.base.ms:1000}") long backoffBaseMs,
                            @Value("${scraper.strategy.smoothing:0.1}") double alpha) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.backoffBaseMs = backoffBaseMs;
        this.alpha = alpha;
        seedDefaults();
    }

    private void seedDefaults() {
        Instant now = clock.instant();
        register(STEALTH, 1, 85, now, Map.of(
                ScrapingStrategy.USE_PROXY, false, ScrapingStrategy.SIMULATE_HUMAN, true));
        register(MOBILE, 2, 75, now, Map.of(
                ScrapingStrategy.USE_PROXY, false, ScrapingStrategy.SIMULATE_HUMAN, true,
                ScrapingStrategy.DEVICE_EMULATION, true));
        register(API_INTERCEPTION, 3, 60, now, Map.of(
                ScrapingStrategy.USE_PROXY, true, ScrapingStrategy.SIMULATE_HUMAN, false,
                ScrapingStrategy.INTERCEPT_API, true));
        register(PROXY_ROTATION, 4, 70, now, Map.of(
                ScrapingStrategy.USE_PROXY, true, ScrapingStrategy.SIMULATE_HUMAN, true,
                ScrapingStrategy.ROTATE_PROXY, true));
        register(SESSION_REFRESH, 5, 65, now, Map.of(
                ScrapingStrategy.USE_PROXY, false, ScrapingStrategy.SIMULATE_HUMAN, true,
                ScrapingStrategy.REFRESH_SESSION, true));
    }

    private void register(String name, int priority, double rate, Instant now, Map<String, Object> config) {
        strategies.put(name, ScrapingStrategy.builder()
                .name(name)
                .priority(priority)
                .successRate(rate)
                .enabled(true)
                .lastUsed(now)
                .config(new HashMap<>(config))
                .build());
    }

    /**
     * Exponentially smoothed update: {@code rate * (1 - alpha) + outcome * 100 * alpha}, clamped to [0, 100].
     */
    public void recordOutcome(String name, boolean success) {
        ScrapingStrategy strategy = strategies.get(name);
        if (strategy == null) {
            return;
        }
        synchronized (strategy) {
            double next = strategy.getSuccessRate() * (1 - alpha) + (success ? 100 : 0) * alpha;
            strategy.setSuccessRate(Math.max(0, Math.min(100, next)));
            strategy.setLastUsed(clock.instant());
        }
    }

    public void recordFailure(FailureKind kind, String strategyName) {
        Instant now = clock.instant();
        failurePatterns.compute(kind, (k, existing) -> {
            Set<String> names = new LinkedHashSet<>(existing == null ? Set.of() : existing.strategies());
            names.add(strategyName);
            return new FailurePattern(existing == null ? 1 : existing.count() + 1, now, Set.copyOf(names));
        });
    }

    /**
     * Attempt 1 gets the best-ranked enabled strategy; attempt k gets index {@code (k - 1) mod count}.
     */
    public ScrapingStrategy selectForAttempt(int attempt) {
        List<ScrapingStrategy> ordered = orderedEnabled();
        if (ordered.isEmpty()) {
            throw new NoStrategyAvailableException("No scraping strategies available");
        }
        return ordered.get(Math.floorMod(attempt - 1, ordered.size()));
    }

    /**
     * Distinct strategies for attempts 1..n, from a single consistent ordering.
     */
    public List<ScrapingStrategy> planAttempts(int attempts) {
        List<ScrapingStrategy> ordered = orderedEnabled();
        if (ordered.isEmpty()) {
            throw new NoStrategyAvailableException("No scraping strategies available");
        }
        return List.copyOf(ordered.subList(0, Math.min(Math.max(1, attempts), ordered.size())));
    }

    public <T> T executeWithRetry(Function<ScrapingStrategy, T> operation, int maxRetries) {
        List<ScrapingStrategy> plan = new ArrayList<>();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            plan.add(selectForAttempt(attempt));
        }
        return executeWithRetry(plan, operation);
    }

    /**
     * Runs the operation once per planned strategy until one succeeds, feeding every outcome back.
     *
     * @throws StrategiesExhaustedException carrying the last failure once the plan is used up
     */
    public <T> T executeWithRetry(List<ScrapingStrategy> plan, Function<ScrapingStrategy, T> operation) {
        if (plan.isEmpty()) {
            throw new NoStrategyAvailableException("No scraping strategies available");
        }
        RuntimeException lastError = null;
        FailureKind lastKind = FailureKind.UNKNOWN;
        List<String> attempted = new ArrayList<>();

        for (int attempt = 1; attempt <= plan.size(); attempt++) {
            ScrapingStrategy strategy = plan.get(attempt - 1);
            attempted.add(strategy.getName());
            log.info("Attempt {}/{} | strategy={}", attempt, plan.size(), strategy.getName());
            try {
                T result = operation.apply(strategy);
                recordOutcome(strategy.getName(), true);
                log.info("✅ Operation successful with {} strategy", strategy.getName());
                return result;
            } catch (RuntimeException e) {
                lastError = e;
                lastKind = FailureClassifier.classify(e);
                log.warn("❌ Strategy {} failed | kind={} | error={}", strategy.getName(), lastKind.code(), e.getMessage());
                recordOutcome(strategy.getName(), false);
                recordFailure(lastKind, strategy.getName());
            }

            if (attempt < plan.size()) {
                long delay = (1L << attempt) * backoffBaseMs;
                log.debug("⏳ Waiting {}ms before retry", delay);
                if (!sleeper.pause(delay)) {
                    log.warn("Retry loop interrupted after {} attempts", attempt);
                    throw new StrategiesExhaustedException(attempt, lastKind, attempted, lastError);
                }
            }
        }
        throw new StrategiesExhaustedException(plan.size(), lastKind, attempted, lastError);
    }

    public int disableLowPerforming(double threshold) {
        int disabled = 0;
        for (ScrapingStrategy s : strategies.values()) {
            synchronized (s) {
                if (s.isEnabled() && s.getSuccessRate() < threshold) {
                    s.setEnabled(false);
                    s.setDisabledAt(clock.instant());
                    disabled++;
                    log.info("🚫 Disabled low-performing strategy: {} ({}% success rate)",
                            s.getName(), Math.round(s.getSuccessRate()));
                }
            }
        }
        if (disabled > 0) {
            log.info("📊 Disabled {} low-performing strategies", disabled);
        }
        return disabled;
    }

    /**
     * Re-enables disabled strategies once the cooldown has passed since they were disabled
     * (or last used, for strategies registered disabled).
     */
    public int reenableAfterCooldown(Duration cooldown) {
        Instant cutoff = clock.instant().minus(cooldown);
        int reenabled = 0;
        for (ScrapingStrategy s : strategies.values()) {
            synchronized (s) {
                Instant since = s.getDisabledAt() != null ? s.getDisabledAt() : s.getLastUsed();
                if (!s.isEnabled() && (since == null || !since.isAfter(cutoff))) {
                    s.setEnabled(true);
                    s.setDisabledAt(null);
                    reenabled++;
                    log.info("✅ Re-enabled strategy after cooldown: {}", s.getName());
                }
            }
        }
        return reenabled;
    }

    public StrategyRecommendations recommendations() {
        List<ScrapingStrategy> byRate = all().stream()
                .sorted(Comparator.comparing(ScrapingStrategy::getSuccessRate).reversed())
                .toList();
        List<ScrapingStrategy> recommended = byRate.subList(0, Math.min(2, byRate.size()));
        List<ScrapingStrategy> avoid = byRate.subList(Math.max(0, byRate.size() - 2), byRate.size());

        List<String> insights = new ArrayList<>();
        failurePatterns.forEach((kind, pattern) -> {
            if (pattern.count() > 2) {
                insights.add(String.format("%s failures detected %d times. Consider adjusting strategy configuration.",
                        kind.code(), pattern.count()));
            }
        });
        for (ScrapingStrategy s : byRate) {
            if (s.getSuccessRate() < 50) {
                insights.add(String.format("%s strategy has low success rate (%d%%). Consider disabling or reconfiguring.",
                        s.getName(), Math.round(s.getSuccessRate())));
            }
        }
        return new StrategyRecommendations(List.copyOf(recommended), List.copyOf(avoid), insights);
    }

    public StrategyStats stats() {
        List<ScrapingStrategy> snapshot = all();
        List<ScrapingStrategy> enabled = snapshot.stream().filter(ScrapingStrategy::isEnabled).toList();
        double average = enabled.stream().mapToDouble(ScrapingStrategy::getSuccessRate).average().orElse(0);
        Map<String, Integer> patterns = new LinkedHashMap<>();
        failurePatterns.forEach((kind, pattern) -> patterns.put(kind.code(), pattern.count()));
        int totalFailures = patterns.values().stream().mapToInt(Integer::intValue).sum();
        return new StrategyStats(snapshot.size(), enabled.size(), Math.round(average), totalFailures, patterns);
    }

    public boolean updateConfig(String name, Map<String, Object> partial) {
        ScrapingStrategy strategy = strategies.get(name);
        if (strategy == null) {
            return false;
        }
        synchronized (strategy) {
            Map<String, Object> merged = new HashMap<>(strategy.getConfig());
            merged.putAll(partial);
            strategy.setConfig(merged);
        }
        log.info("⚙️ Updated configuration for strategy: {}", name);
        return true;
    }

    /**
     * Adds a strategy or replaces the one with the same name.
     */
    public void addStrategy(ScrapingStrategy strategy) {
        ScrapingStrategy copy = strategy.snapshot();
        copy.setLastUsed(clock.instant());
        ScrapingStrategy previous = strategies.put(copy.getName(), copy);
        log.info("{} strategy: {}", previous == null ? "➕ Added" : "🔄 Updated", copy.getName());
    }

    public Optional<ScrapingStrategy> get(String name) {
        return Optional.ofNullable(strategies.get(name)).map(ScrapingStrategy::snapshot);
    }

    public List<ScrapingStrategy> all() {
        return strategies.values().stream()
                .map(ScrapingStrategy::snapshot)
                .sorted(SELECTION_ORDER)
                .toList();
    }

    public Map<FailureKind, FailurePattern> failurePatterns() {
        return Map.copyOf(failurePatterns);
    }

    private List<ScrapingStrategy> orderedEnabled() {
        return all().stream().filter(ScrapingStrategy::isEnabled).sorted(SELECTION_ORDER).toList();
    }

    public record FailurePattern(int count, Instant lastFailure, Set<String> strategies) {
    }

    public record StrategyRecommendations(List<ScrapingStrategy> recommended,
                                          List<ScrapingStrategy> avoid,
                                          List<String> insights) {
    }

    public record StrategyStats(int totalStrategies, int enabledStrategies, long averageSuccessRate,
                                int totalFailures, Map<String, Integer> failurePatterns) {
    }
}
