package com.storefront.scraper.service;

import com.storefront.scraper.config.ScraperConfig;
import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.exception.NoStrategyAvailableException;
import com.storefront.scraper.exception.RateLimitExceededException;
import com.storefront.scraper.exception.ScrapeAttemptException;
import com.storefront.scraper.exception.StrategiesExhaustedException;
import com.storefront.scraper.interfaces.BrowserEngine;
import com.storefront.scraper.interfaces.BrowserPage;
import com.storefront.scraper.interfaces.JobProcessor;
import com.storefront.scraper.manager.AntiFingerprintOverrides;
import com.storefront.scraper.manager.DeviceProfileRegistry;
import com.storefront.scraper.manager.ExtractionScriptRegistry;
import com.storefront.scraper.manager.PageHealthMonitor;
import com.storefront.scraper.manager.ProxyPoolManager;
import com.storefront.scraper.manager.RateLimiter;
import com.storefront.scraper.manager.SessionManager;
import com.storefront.scraper.model.ProxyEndpoint;
import com.storefront.scraper.model.ScrapeOptions;
import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;
import com.storefront.scraper.model.ScrapingSession;
import com.storefront.scraper.model.ScrapingStrategy;
import com.storefront.scraper.model.ValidationResult;
import com.storefront.scraper.model.profile.DeviceProfile;
import com.storefront.scraper.utils.FailureClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Single entry point for scraping one listing: rate limit, proxy, session, then one attempt per planned
 * strategy until a validated record comes back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScrapeOrchestrator implements JobProcessor {

    static final String API_FRAGMENT = "/api/";

    private final RateLimiter rateLimiter;
    private final ProxyPoolManager proxyPool;
    private final SessionManager sessionManager;
    private final DeviceProfileRegistry deviceRegistry;
    private final HumanBehaviorSimulator behaviorSimulator;
    private final AntiFingerprintOverrides antiFingerprint;
    private final ExtractionScriptRegistry extractionScripts;
    private final PageHealthMonitor healthMonitor;
    private final DataValidator validator;
    private final StrategySelector strategySelector;
    private final BrowserEngine browserEngine;
    private final ScrapingMetricsService metrics;
    private final ScraperConfig scraperConfig;
    private final Clock clock;
    private final ExecutorService scrapeExecutor;

    @Value("${scraper.retry.max.attempts:3}")
    private int defaultMaxRetries = 3;

    @Override
    public ScrapingResult process(ScrapingJob job) {
        return scrape(job, job.getOptions());
    }

    public Future<ScrapingResult> submit(ScrapingJob job, ScrapeOptions options) {
        return scrapeExecutor.submit(() -> scrape(job, options));
    }

    public CompletableFuture<ScrapingResult> scrapeAsync(ScrapingJob job, ScrapeOptions options) {
        return CompletableFuture.supplyAsync(() -> scrape(job, options), scrapeExecutor);
    }

    public ScrapingResult scrape(ScrapingJob job, ScrapeOptions requested) {
        ScrapeOptions options = requested != null ? requested : ScrapeOptions.defaults();
        long start = clock.millis();
        metrics.recordScrapeAttempt();

        if (job.getPlatform() == null) {
            return fail(FailureKind.UNKNOWN, "Job " + job.getId() + " needs a platform", start,
                    options.getStrategy(), null, null);
        }
        String target;
        try {
            target = job.target();
        } catch (IllegalStateException e) {
            return fail(FailureKind.UNKNOWN, e.getMessage(), start, options.getStrategy(), null, null);
        }
        log.info("Scrape started | job={} | platform={} | target={}", job.getId(), job.getPlatform().getCode(), target);

        RateLimiter.Permit permit;
        try {
            permit = rateLimiter.acquire();
        } catch (RateLimitExceededException e) {
            return fail(FailureKind.RATE_LIMIT, e.getMessage(), start, options.getStrategy(), null, null);
        }

        try (permit) {
            ProxyEndpoint proxy = null;
            if (options.proxyRequested()) {
                proxy = selectProxy(options).orElse(null);
                if (proxy == null) {
                    return fail(FailureKind.PROXY_ERROR, "No proxy available", start, options.getStrategy(), null, null);
                }
            }

            ScrapingSession session = openSession(job, options);
            if (proxy != null) {
                sessionManager.assignProxy(session.getId(), proxy.id());
            }

            List<ScrapingStrategy> plan;
            try {
                plan = resolvePlan(options);
            } catch (NoStrategyAvailableException e) {
                return fail(FailureKind.UNKNOWN, e.getMessage(), start, options.getStrategy(), session.getId(),
                        proxy != null ? proxy.id() : null);
            }

            Attempts attempts = new Attempts(job, target, options, session, proxy);
            try {
                ScrapingResult result = strategySelector.executeWithRetry(plan, attempts::run);
                result.setExecutionTime(clock.millis() - start);
                metrics.recordScrapeSuccess(result.getStrategy(), result.getConfidence(), result.getExecutionTime());
                log.info("Scrape succeeded | job={} | strategy={} | confidence={} | time={}ms",
                        job.getId(), result.getStrategy(), result.getConfidence(), result.getExecutionTime());
                return result;
            } catch (StrategiesExhaustedException e) {
                String lastStrategy = e.getAttemptedStrategies().isEmpty() ? null
                        : e.getAttemptedStrategies().get(e.getAttemptedStrategies().size() - 1);
                return fail(e.getLastKind(), e.getMessage(), start, lastStrategy, session.getId(), attempts.proxyId());
            }
        }
    }

    private Optional<ProxyEndpoint> selectProxy(ScrapeOptions options) {
        if (options.getProxyCountry() != null && !options.getProxyCountry().isBlank()) {
            return proxyPool.byCountry(options.getProxyCountry());
        }
        return proxyPool.next();
    }

    private ScrapingSession openSession(ScrapingJob job, ScrapeOptions options) {
        if (options.getSessionId() != null) {
            Optional<ScrapingSession> existing = sessionManager.get(options.getSessionId())
                    .filter(ScrapingSession::isActive);
            if (existing.isPresent()) {
                return existing.get();
            }
            log.warn("Session {} unavailable, opening a new one", options.getSessionId());
        }
        return sessionManager.create(job.getPlatform().getCode());
    }

    private List<ScrapingStrategy> resolvePlan(ScrapeOptions options) {
        if (options.getStrategy() != null && !options.getStrategy().isBlank()) {
            ScrapingStrategy named = strategySelector.get(options.getStrategy())
                    .orElseThrow(() -> new NoStrategyAvailableException("Unknown strategy: " + options.getStrategy()));
            return List.of(named);
        }
        return strategySelector.planAttempts(options.maxRetriesOr(defaultMaxRetries));
    }

    private ScrapingResult fail(FailureKind kind, String error, long start, String strategy,
                                String sessionId, String proxyId) {
        long elapsed = clock.millis() - start;
        metrics.recordScrapeFailure(kind, elapsed);
        log.warn("Scrape failed | kind={} | strategy={} | time={}ms | error={}", kind.code(), strategy, elapsed, error);
        ScrapingResult result = ScrapingResult.failure(kind, error, elapsed, strategy, sessionId);
        result.setProxyUsed(proxyId);
        return result;
    }

    /**
     * Per-call attempt state. Attempts run sequentially, so the current proxy needs no locking.
     */
    private final class Attempts {

        private final ScrapingJob job;
        private final String target;
        private final ScrapeOptions options;
        private final ScrapingSession session;
        private ProxyEndpoint proxy;

        Attempts(ScrapingJob job, String target, ScrapeOptions options, ScrapingSession session, ProxyEndpoint proxy) {
            this.job = job;
            this.target = target;
            this.options = options;
            this.session = session;
            this.proxy = proxy;
        }

        String proxyId() {
            return proxy != null ? proxy.id() : null;
        }

        ScrapingResult run(ScrapingStrategy strategy) {
            if (!sessionManager.touch(session.getId())) {
                throw new ScrapeAttemptException(FailureKind.UNKNOWN, "Session " + session.getId() + " is inactive");
            }
            if (strategy.flag(ScrapingStrategy.REFRESH_SESSION)) {
                sessionManager.clearCookies(session.getId());
                log.debug("Session {} cookies cleared for refresh", session.getId());
            }
            ProxyEndpoint attemptProxy = proxyFor(strategy);

            try (BrowserPage page = browserEngine.openPage(attemptProxy)) {
                preparePage(page, strategy);
                page.navigate(target, scraperConfig.getNavigationTimeoutMs());
                healthMonitor.inspect(page);

                if (options.humanSimulationEnabled() && strategy.flag(ScrapingStrategy.SIMULATE_HUMAN, true)) {
                    behaviorSimulator.simulate(page);
                }

                Map<String, Object> extracted = page.runQuery(extractionScripts.scriptFor(job.getPlatform()));
                Map<String, Object> data = extracted != null ? new LinkedHashMap<>(extracted) : new LinkedHashMap<>();
                if (strategy.flag(ScrapingStrategy.INTERCEPT_API)) {
                    List<Map<String, Object>> captured = page.capturedResponses();
                    if (!captured.isEmpty()) {
                        data.put("apiResponses", captured);
                    }
                }
                sessionManager.replaceCookies(session.getId(), page.cookies());

                if (isEmpty(data)) {
                    throw new ScrapeAttemptException(FailureKind.NOT_FOUND, "No extractable content found at " + target);
                }
                ValidationResult validation = validator.validate(data);
                if (!validation.valid()) {
                    throw new ScrapeAttemptException(FailureKind.VALIDATION_ERROR,
                            "Data validation failed: " + String.join("; ", validation.errors()));
                }

                return ScrapingResult.builder()
                        .success(true)
                        .data(data)
                        .warnings(validation.warnings())
                        .confidence(validation.confidence())
                        .strategy(strategy.getName())
                        .sessionId(session.getId())
                        .proxyUsed(attemptProxy != null ? attemptProxy.id() : null)
                        .build();
            } catch (RuntimeException e) {
                if (attemptProxy != null && FailureClassifier.classify(e).isProxyRelated()) {
                    proxyPool.markFailed(attemptProxy);
                }
                throw e;
            }
        }

        /**
         * Strategy proxy flags are preferences: an explicit {@code useProxy=false} always goes direct, and a
         * strategy that finds the pool empty keeps whatever connection the call already has.
         */
        private ProxyEndpoint proxyFor(ScrapingStrategy strategy) {
            if (Boolean.FALSE.equals(options.getUseProxy())) {
                return null;
            }
            if (strategy.flag(ScrapingStrategy.ROTATE_PROXY)) {
                Optional<ProxyEndpoint> rotated = selectProxy(options);
                if (rotated.isPresent()) {
                    proxy = rotated.get();
                    sessionManager.assignProxy(session.getId(), proxy.id());
                    log.info("Rotated to proxy {}", proxy.id());
                } else {
                    log.info("Strategy {} found no proxy to rotate to; keeping {}", strategy.getName(),
                            proxy != null ? proxy.id() : "direct connection");
                }
            } else if (proxy == null && strategy.flag(ScrapingStrategy.USE_PROXY)) {
                proxy = selectProxy(options).orElse(null);
                if (proxy == null) {
                    log.info("Strategy {} prefers a proxy but none is available; going direct", strategy.getName());
                }
            }
            return proxy;
        }

        private void preparePage(BrowserPage page, ScrapingStrategy strategy) {
            antiFingerprint.apply(page);
            if (strategy.flag(ScrapingStrategy.DEVICE_EMULATION)) {
                DeviceProfile device = deviceRegistry.random();
                deviceRegistry.apply(page, device);
            } else {
                page.setViewport(scraperConfig.getDesktopViewportWidth(), scraperConfig.getDesktopViewportHeight());
                page.setIdentity(session.getIdentity());
            }
            if (strategy.flag(ScrapingStrategy.INTERCEPT_API)) {
                page.enableResponseCapture(API_FRAGMENT);
            }
            List<Map<String, Object>> cookies = sessionManager.getCookies(session.getId());
            if (!cookies.isEmpty()) {
                page.addCookies(cookies);
            }
        }
    }

    private static boolean isEmpty(Map<String, Object> data) {
        return data.entrySet().stream()
                .filter(e -> !"url".equals(e.getKey()) && !"scrapedAt".equals(e.getKey()))
                .map(Map.Entry::getValue)
                .allMatch(v -> v == null
                        || (v instanceof String s && s.isBlank())
                        || (v instanceof Collection<?> c && c.isEmpty()));
    }
}
