package com.storefront.scraper.controller;

import com.storefront.scraper.dto.PriorityUpdateRequest;
import com.storefront.scraper.dto.ScrapeRequest;
import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.JobStatus;
import com.storefront.scraper.enums.Platform;
import com.storefront.scraper.exception.JobNotFoundException;
import com.storefront.scraper.exception.NoProxyAvailableException;
import com.storefront.scraper.manager.PageHealthMonitor;
import com.storefront.scraper.manager.ProxyPoolManager;
import com.storefront.scraper.manager.RateLimiter;
import com.storefront.scraper.manager.SessionManager;
import com.storefront.scraper.model.ScrapeOptions;
import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;
import com.storefront.scraper.service.ScrapeOrchestrator;
import com.storefront.scraper.service.ScrapingJobQueue;
import com.storefront.scraper.service.ScrapingMetricsService;
import com.storefront.scraper.service.StrategySelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScrapeController Tests")
class ScrapeControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ScrapeOrchestrator orchestrator;
    @Mock
    private ScrapingJobQueue jobQueue;
    @Mock
    private StrategySelector strategySelector;
    @Mock
    private ProxyPoolManager proxyPool;
    @Mock
    private SessionManager sessionManager;
    @Mock
    private RateLimiter rateLimiter;
    @Mock
    private PageHealthMonitor healthMonitor;
    @Mock
    private ScrapingMetricsService metrics;

    private ScrapeController controller;

    @BeforeEach
    void setUp() {
        controller = new ScrapeController(orchestrator, jobQueue, strategySelector, proxyPool, sessionManager,
                rateLimiter, healthMonitor, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(controller, "defaultMaxRetries", 4);
    }

    private static ScrapeRequest searchRequest() {
        return new ScrapeRequest(null, "usb hub", Platform.ALIBABA, null, null, null, null);
    }

    @Nested
    @DisplayName("scrape and enqueue")
    class Submission {

        @Test
        @DisplayName("scrape_buildsJobWithDefaultsAndReturnsResult")
        void scrape_buildsJobWithDefaultsAndReturnsResult() {
            ScrapingResult result = ScrapingResult.builder().success(true).confidence(92).strategy("stealth").build();
            when(orchestrator.submit(any(ScrapingJob.class), any(ScrapeOptions.class)))
                    .thenReturn(CompletableFuture.completedFuture(result));

            ResponseEntity<ScrapingResult> response = controller.scrape(searchRequest());

            ArgumentCaptor<ScrapingJob> job = ArgumentCaptor.forClass(ScrapingJob.class);
            verify(orchestrator).submit(job.capture(), any(ScrapeOptions.class));
            verify(orchestrator, never()).scrape(any(), any());
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getBody()).isSameAs(result);
            assertThat(job.getValue().getPriority()).isEqualTo(JobPriority.MEDIUM);
            assertThat(job.getValue().getMaxRetries()).isEqualTo(4);
            assertThat(job.getValue().getCreatedAt()).isEqualTo(NOW);
            assertThat(job.getValue().target()).isEqualTo("https://www.alibaba.com/trade/search?SearchText=usb+hub");
        }

        @Test
        @DisplayName("scrape_executorFailure_rethrowsCause")
        void scrape_executorFailure_rethrowsCause() {
            CompletableFuture<ScrapingResult> failed = new CompletableFuture<>();
            failed.completeExceptionally(new NoProxyAvailableException("pool exhausted"));
            when(orchestrator.submit(any(ScrapingJob.class), any(ScrapeOptions.class))).thenReturn(failed);

            assertThatThrownBy(() -> controller.scrape(searchRequest()))
                    .isInstanceOf(NoProxyAvailableException.class)
                    .hasMessage("pool exhausted");
        }

        @Test
        @DisplayName("enqueue_returnsAcceptedWithQueuedJob")
        void enqueue_returnsAcceptedWithQueuedJob() {
            when(jobQueue.enqueue(any(ScrapingJob.class))).thenAnswer(inv -> inv.getArgument(0));
            ScrapeRequest request = new ScrapeRequest("https://www.amazon.com/dp/B0001", null, Platform.AMAZON,
                    JobPriority.HIGH, 5, null, Map.of("source", "catalog"));

            ResponseEntity<ScrapingJob> response = controller.enqueue(request);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
            assertThat(response.getBody().getPriority()).isEqualTo(JobPriority.HIGH);
            assertThat(response.getBody().getMaxRetries()).isEqualTo(5);
            assertThat(response.getBody().getMetadata()).containsEntry("source", "catalog");
            assertThat(response.getBody().getId()).startsWith("job_");
        }

        @Test
        @DisplayName("request_targetPresence")
        void request_targetPresence() {
            assertThat(searchRequest().isTargetPresent()).isTrue();
            assertThat(new ScrapeRequest(" ", null, Platform.AMAZON, null, null, null, null).isTargetPresent())
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("jobs")
    class Jobs {

        @Test
        @DisplayName("getJob_knownId_includesLastResult")
        void getJob_knownId_includesLastResult() {
            ScrapingJob job = ScrapingJob.forUrl("https://www.amazon.com/dp/B0001", Platform.AMAZON);
            job.setStatus(JobStatus.COMPLETED);
            ScrapingResult result = ScrapingResult.builder().success(true).build();
            when(jobQueue.getJob(job.getId())).thenReturn(Optional.of(job));
            when(jobQueue.lastResult(job.getId())).thenReturn(Optional.of(result));

            Map<String, Object> body = controller.getJob(job.getId()).getBody();

            assertThat(body).containsEntry("job", job).containsEntry("result", result);
        }

        @Test
        @DisplayName("getJob_unknownId_throwsJobNotFound")
        void getJob_unknownId_throwsJobNotFound() {
            when(jobQueue.getJob("job_missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> controller.getJob("job_missing"))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessageContaining("job_missing");
        }

        @Test
        @DisplayName("updatePriority_notQueued_reportsMessage")
        void updatePriority_notQueued_reportsMessage() {
            when(jobQueue.updatePriority("job_1", JobPriority.LOW)).thenReturn(false);

            Map<String, Object> body = controller.updatePriority("job_1", new PriorityUpdateRequest(JobPriority.LOW)).getBody();

            assertThat(body).containsEntry("updated", false).containsKey("message");
        }

        @Test
        @DisplayName("updatePriority_queued_updates")
        void updatePriority_queued_updates() {
            when(jobQueue.updatePriority(eq("job_1"), eq(JobPriority.HIGH))).thenReturn(true);

            Map<String, Object> body = controller.updatePriority("job_1", new PriorityUpdateRequest(JobPriority.HIGH)).getBody();

            assertThat(body).containsEntry("updated", true).doesNotContainKey("message");
        }
    }

    @Nested
    @DisplayName("monitoring")
    class Monitoring {

        @Test
        @DisplayName("healthCheck_refusedPages_reportsDegraded")
        void healthCheck_refusedPages_reportsDegraded() {
            when(healthMonitor.isHealthy()).thenReturn(false);
            when(healthMonitor.getConsecutiveFailures()).thenReturn(3);
            when(jobQueue.isPaused()).thenReturn(false);
            when(jobQueue.size()).thenReturn(4);
            when(proxyPool.active()).thenReturn(List.of());

            Map<String, Object> body = controller.healthCheck().getBody();

            assertThat(body)
                    .containsEntry("status", "DEGRADED")
                    .containsEntry("consecutiveRefusedPages", 3)
                    .containsEntry("queued", 4)
                    .containsEntry("activeProxies", 0)
                    .containsEntry("timestamp", NOW);
        }

        @Test
        @DisplayName("scraperStats_aggregatesEveryComponent")
        void scraperStats_aggregatesEveryComponent() {
            StrategySelector.StrategyStats strategyStats = new StrategySelector.StrategyStats(5, 5, 71, 0, Map.of());
            when(strategySelector.stats()).thenReturn(strategyStats);
            when(proxyPool.stats()).thenReturn(new ProxyPoolManager.ProxyPoolStats(0, 0, 0, 0, 0));
            when(sessionManager.stats()).thenReturn(new SessionManager.SessionStats(0, 0, 0, 0, 0));
            when(rateLimiter.status()).thenReturn(new RateLimiter.Status(0, 0, 10, 3));
            when(metrics.getMetrics()).thenReturn(Map.<String, Object>of("totalScrapes", 0));

            Map<String, Object> body = controller.scraperStats().getBody();

            assertThat(body).containsKeys("strategies", "proxies", "sessions", "rateLimiter", "metrics", "timestamp");
            assertThat(body.get("strategies")).isSameAs(strategyStats);
        }
    }
}
