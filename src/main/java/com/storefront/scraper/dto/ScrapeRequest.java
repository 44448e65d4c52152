package com.storefront.scraper.dto;

import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.Platform;
import com.storefront.scraper.model.ScrapeOptions;
import com.storefront.scraper.model.ScrapingJob;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Body of a scrape or enqueue call. Either {@code url} or {@code query} must be set.
 */
public record ScrapeRequest(
        String url,
        String query,
        @NotNull(message = "platform is required")
        Platform platform,
        JobPriority priority,
        @Min(value = 1, message = "maxRetries must be at least 1")
        @Max(value = 10, message = "maxRetries must be at most 10")
        Integer maxRetries,
        ScrapeOptions options,
        Map<String, Object> metadata
) {

    @AssertTrue(message = "either url or query is required")
    public boolean isTargetPresent() {
        return (url != null && !url.isBlank()) || (query != null && !query.isBlank());
    }

    public ScrapingJob toJob(Instant now, int defaultMaxRetries) {
        return ScrapingJob.builder()
                .id(ScrapingJob.newId())
                .url(url)
                .query(query)
                .platform(platform)
                .priority(priority != null ? priority : JobPriority.MEDIUM)
                .maxRetries(maxRetries != null ? maxRetries : defaultMaxRetries)
                .createdAt(now)
                .options(options != null ? options : ScrapeOptions.defaults())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
    }
}
