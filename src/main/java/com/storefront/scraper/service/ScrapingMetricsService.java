package com.storefront.scraper.service;

import com.storefront.scraper.enums.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ScrapingMetricsService {

    private final AtomicInteger totalScrapes = new AtomicInteger(0);
    private final AtomicInteger successfulScrapes = new AtomicInteger(0);
    private final AtomicInteger failedScrapes = new AtomicInteger(0);
    private final AtomicLong totalConfidence = new AtomicLong(0);
    private final AtomicLong totalExecutionMs = new AtomicLong(0);
    private final Map<String, AtomicInteger> successesByStrategy = new ConcurrentHashMap<>();
    private final Map<FailureKind, AtomicInteger> failuresByKind = new ConcurrentHashMap<>();

    public void recordScrapeAttempt() {
        totalScrapes.incrementAndGet();
    }

    public void recordScrapeSuccess(String strategy, int confidence, long executionMs) {
        successfulScrapes.incrementAndGet();
        totalConfidence.addAndGet(confidence);
        totalExecutionMs.addAndGet(executionMs);
        successesByStrategy.computeIfAbsent(strategy, k -> new AtomicInteger()).incrementAndGet();
    }

    public void recordScrapeFailure(FailureKind kind, long executionMs) {
        failedScrapes.incrementAndGet();
        totalExecutionMs.addAndGet(executionMs);
        failuresByKind.computeIfAbsent(kind, k -> new AtomicInteger()).incrementAndGet();
    }

    public Map<String, Object> getMetrics() {
        int total = totalScrapes.get();
        int successes = successfulScrapes.get();
        int finished = successes + failedScrapes.get();

        Map<String, Integer> byStrategy = new LinkedHashMap<>();
        successesByStrategy.forEach((k, v) -> byStrategy.put(k, v.get()));
        Map<String, Integer> byKind = new LinkedHashMap<>();
        failuresByKind.forEach((k, v) -> byKind.put(k.code(), v.get()));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("totalScrapes", total);
        metrics.put("successfulScrapes", successes);
        metrics.put("failedScrapes", failedScrapes.get());
        metrics.put("successRate", finished > 0 ? (successes * 100.0 / finished) : 0.0);
        metrics.put("averageConfidence", successes > 0 ? (totalConfidence.get() / (double) successes) : 0.0);
        metrics.put("averageExecutionMs", finished > 0 ? (totalExecutionMs.get() / (double) finished) : 0.0);
        metrics.put("successesByStrategy", byStrategy);
        metrics.put("failuresByKind", byKind);
        return metrics;
    }

    @Scheduled(fixedRate = 60000)
    public void logMetrics() {
        Map<String, Object> metrics = getMetrics();
        if ((int) metrics.get("totalScrapes") == 0) {
            return;
        }
        log.info("📊 Scraping Metrics: {}", metrics);

        double successRate = (double) metrics.get("successRate");
        if (successRate < 50.0) {
            log.warn("⚠️ LOW SCRAPE SUCCESS RATE: {}%", String.format("%.2f", successRate));
        }
    }
}
