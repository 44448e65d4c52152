package com.storefront.scraper.controller;

import com.storefront.scraper.dto.PriorityUpdateRequest;
import com.storefront.scraper.dto.ScrapeRequest;
import com.storefront.scraper.exception.JobNotFoundException;
import com.storefront.scraper.manager.PageHealthMonitor;
import com.storefront.scraper.manager.ProxyPoolManager;
import com.storefront.scraper.manager.RateLimiter;
import com.storefront.scraper.manager.SessionManager;
import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;
import com.storefront.scraper.service.ScrapeOrchestrator;
import com.storefront.scraper.service.ScrapingJobQueue;
import com.storefront.scraper.service.ScrapingMetricsService;
import com.storefront.scraper.service.StrategySelector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class ScrapeController {

    private final ScrapeOrchestrator orchestrator;
    private final ScrapingJobQueue jobQueue;
    private final StrategySelector strategySelector;
    private final ProxyPoolManager proxyPool;
    private final SessionManager sessionManager;
    private final RateLimiter rateLimiter;
    private final PageHealthMonitor healthMonitor;
    private final ScrapingMetricsService metrics;
    private final Clock clock;

    @Value("${scraper.queue.default-max-retries:3}")
    private int defaultMaxRetries = 3;

    /**
     * Scrape one listing and wait for it. The work runs on the scrape executor so browsers stay on its threads.
     */
    @PostMapping("/scrape")
    public ResponseEntity<ScrapingResult> scrape(@Valid @RequestBody ScrapeRequest request) {
        log.info("POST /api/v1/scrape - platform={}, url={}, query={}",
                request.platform().getCode(), request.url(), request.query());
        ScrapingJob job = request.toJob(clock.instant(), defaultMaxRetries);
        Future<ScrapingResult> pending = orchestrator.submit(job, job.getOptions());
        try {
            return ResponseEntity.ok(pending.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for scrape of job " + job.getId(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Scrape of job " + job.getId() + " failed", e.getCause());
        }
    }

    @PostMapping("/jobs")
    public ResponseEntity<ScrapingJob> enqueue(@Valid @RequestBody ScrapeRequest request) {
        ScrapingJob job = jobQueue.enqueue(request.toJob(clock.instant(), defaultMaxRetries));
        log.info("POST /api/v1/jobs - queued {}", job.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<Map<String, Object>> getJob(@PathVariable String id) {
        ScrapingJob job = jobQueue.getJob(id).orElseThrow(() -> new JobNotFoundException(id));
        Map<String, Object> response = new HashMap<>();
        response.put("job", job);
        jobQueue.lastResult(id).ifPresent(result -> response.put("result", result));
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/jobs/{id}/priority")
    public ResponseEntity<Map<String, Object>> updatePriority(@PathVariable String id,
                                                              @Valid @RequestBody PriorityUpdateRequest request) {
        boolean updated = jobQueue.updatePriority(id, request.priority());
        Map<String, Object> response = new HashMap<>();
        response.put("jobId", id);
        response.put("updated", updated);
        if (!updated) {
            response.put("message", "Job is no longer queued");
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/jobs/stats")
    public ResponseEntity<ScrapingJobQueue.QueueStats> queueStats() {
        return ResponseEntity.ok(jobQueue.stats());
    }

    @GetMapping("/scraper/stats")
    public ResponseEntity<Map<String, Object>> scraperStats() {
        Map<String, Object> response = new HashMap<>();
        response.put("strategies", strategySelector.stats());
        response.put("proxies", proxyPool.stats());
        response.put("sessions", sessionManager.stats());
        response.put("rateLimiter", rateLimiter.status());
        response.put("metrics", metrics.getMetrics());
        response.put("timestamp", clock.instant());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/scraper/strategies/recommendations")
    public ResponseEntity<StrategySelector.StrategyRecommendations> recommendations() {
        return ResponseEntity.ok(strategySelector.recommendations());
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/scraper/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> status = new HashMap<>();
        boolean pagesHealthy = healthMonitor.isHealthy();
        status.put("status", pagesHealthy ? "UP" : "DEGRADED");
        status.put("consecutiveRefusedPages", healthMonitor.getConsecutiveFailures());
        status.put("queuePaused", jobQueue.isPaused());
        status.put("queued", jobQueue.size());
        status.put("activeProxies", proxyPool.active().size());
        status.put("timestamp", clock.instant());
        return ResponseEntity.ok(status);
    }
}
