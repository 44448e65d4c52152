package com.storefront.scraper.model;

import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.JobStatus;
import com.storefront.scraper.enums.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapingJob {

    private String id;
    private String url;
    private String query;
    private Platform platform;

    @Builder.Default
    private JobPriority priority = JobPriority.MEDIUM;

    private int retryCount;

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Builder.Default
    private Instant createdAt = Instant.now();

    @Builder.Default
    private ScrapeOptions options = ScrapeOptions.defaults();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static ScrapingJob forUrl(String url, Platform platform) {
        return ScrapingJob.builder()
                .id(newId())
                .url(url)
                .platform(platform)
                .build();
    }

    public static String newId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * The address to navigate to: the explicit URL, or the platform search page for a query.
     */
    public String target() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        if (query == null || query.isBlank()) {
            throw new IllegalStateException("Job " + id + " has neither url nor query");
        }
        String encoded = URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
        return String.format(platform.getSearchUrlTemplate(), encoded);
    }
}
