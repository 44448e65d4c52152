package com.storefront.scraper.config;

import com.storefront.scraper.interceptor.SimpleHttpLoggingInterceptor;
import com.storefront.scraper.model.validation.ValidationRules;
import com.storefront.scraper.utils.Sleeper;
import lombok.Data;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Data
@Configuration
public class ScraperConfig {
    private final List<String> BROWSER_FLAGS = Arrays.asList(
            // === Core Stealth Flags ===
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    @Value("${scraper.browser.headless:true}")
    private boolean headless;

    @Value("${scraper.browser.launch.timeout.ms:120000}")
    private double launchTimeoutMs;

    @Value("${scraper.navigation.timeout.ms:45000}")
    private int navigationTimeoutMs;

    @Value("${scraper.desktop.viewport.width:1366}")
    private int desktopViewportWidth;

    @Value("${scraper.desktop.viewport.height:768}")
    private int desktopViewportHeight;

    // ==================== PERFORMANCE TUNING ====================

    @Value("${scraper.thread.pool.size:8}")
    private int threadPoolSize;

    @Value("${scraper.proxy.check.timeout.ms:10000}")
    private int checkTimeoutMs;

    @Value("${scraper.proxy.check.logging:false}")
    private boolean checkLogging;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public Random behaviorRandom() {
        return new Random();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threadPoolSize, r -> {
            Thread t = new Thread(r, "scrape-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Base client for proxy liveness checks; a per-proxy client is derived from it.
     */
    @Bean
    public OkHttpClient checkHttpClient() {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(checkTimeoutMs))
                .connectTimeout(Duration.ofMillis(checkTimeoutMs))
                .retryOnConnectionFailure(false);
        if (checkLogging) {
            builder.addInterceptor(new SimpleHttpLoggingInterceptor());
        }
        return builder.build();
    }

    @Bean
    @ConfigurationProperties(prefix = "scraper.validation")
    public ValidationRules validationRules() {
        return new ValidationRules();
    }
}
