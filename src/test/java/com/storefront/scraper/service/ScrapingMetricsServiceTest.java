package com.storefront.scraper.service;

import com.storefront.scraper.enums.FailureKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScrapingMetricsService Tests")
class ScrapingMetricsServiceTest {

    private final ScrapingMetricsService metrics = new ScrapingMetricsService();

    @Test
    @DisplayName("getMetrics_noActivity_zeroRates")
    void getMetrics_noActivity_zeroRates() {
        Map<String, Object> snapshot = metrics.getMetrics();

        assertThat(snapshot).containsEntry("totalScrapes", 0).containsEntry("successRate", 0.0);
    }

    @Test
    @DisplayName("getMetrics_mixedOutcomes_aggregates")
    @SuppressWarnings("unchecked")
    void getMetrics_mixedOutcomes_aggregates() {
        for (int i = 0; i < 4; i++) {
            metrics.recordScrapeAttempt();
        }
        metrics.recordScrapeSuccess("stealth", 90, 1000);
        metrics.recordScrapeSuccess("stealth", 70, 2000);
        metrics.recordScrapeSuccess("mobile", 80, 3000);
        metrics.recordScrapeFailure(FailureKind.BLOCKED, 2000);

        Map<String, Object> snapshot = metrics.getMetrics();

        assertThat(snapshot)
                .containsEntry("totalScrapes", 4)
                .containsEntry("successfulScrapes", 3)
                .containsEntry("failedScrapes", 1)
                .containsEntry("successRate", 75.0)
                .containsEntry("averageConfidence", 80.0)
                .containsEntry("averageExecutionMs", 2000.0);
        assertThat((Map<String, Integer>) snapshot.get("successesByStrategy"))
                .containsEntry("stealth", 2).containsEntry("mobile", 1);
        assertThat((Map<String, Integer>) snapshot.get("failuresByKind")).containsEntry("blocked", 1);
        metrics.logMetrics();
    }
}
