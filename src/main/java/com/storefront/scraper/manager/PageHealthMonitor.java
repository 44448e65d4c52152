package com.storefront.scraper.manager;

import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.exception.ScrapeAttemptException;
import com.storefront.scraper.interfaces.BrowserPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Detects anti-bot interstitials right after navigation and tracks how many pages in a row were refused.
 */
@Component
@Slf4j
public class PageHealthMonitor {

    private static final String EMOJI_HEALTH = "💚";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private static final int MAX_CONSECUTIVE_FAILURES = 3;

    private static final String CAPTCHA_SELECTOR = String.join(", ",
            "iframe[src*='recaptcha']",
            "iframe[src*='captcha']",
            "[class*='captcha']",
            "#nc_1_wrapper",
            "form[action*='validateCaptcha']"
    );

    private static final String BLOCKED_SELECTOR = String.join(", ",
            "[class*='access-denied']",
            "#px-captcha",
            "[class*='baxia-punish']"
    );

    private static final List<String> BLOCKED_TITLES = List.of(
            "access denied", "robot check", "attention required", "sorry! something went wrong");

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    /**
     * @throws ScrapeAttemptException with {@link FailureKind#CAPTCHA} or {@link FailureKind#BLOCKED}
     */
    public void inspect(BrowserPage page) {
        if (countSafely(page, CAPTCHA_SELECTOR) > 0) {
            log.error("{} {} CAPTCHA detected on page", EMOJI_ERROR, EMOJI_WARNING);
            incrementFailureCount();
            throw new ScrapeAttemptException(FailureKind.CAPTCHA, "CAPTCHA challenge detected");
        }

        String title = titleSafely(page);
        boolean blockedTitle = BLOCKED_TITLES.stream().anyMatch(title::contains);
        if (blockedTitle || countSafely(page, BLOCKED_SELECTOR) > 0) {
            log.error("{} {} Anti-bot interstitial detected (title: {})", EMOJI_ERROR, EMOJI_WARNING, title);
            incrementFailureCount();
            throw new ScrapeAttemptException(FailureKind.BLOCKED, "Access blocked by anti-bot interstitial");
        }

        resetFailureCount();
    }

    private int countSafely(BrowserPage page, String selector) {
        try {
            return page.countElements(selector);
        } catch (RuntimeException e) {
            log.debug("Selector check failed: {}", e.getMessage());
            return 0;
        }
    }

    private String titleSafely(BrowserPage page) {
        try {
            Object title = page.evaluate("() => document.title", null);
            return title == null ? "" : title.toString().toLowerCase(Locale.ROOT);
        } catch (RuntimeException e) {
            log.debug("Title check failed: {}", e.getMessage());
            return "";
        }
    }

    private void incrementFailureCount() {
        int failures = consecutiveFailures.incrementAndGet();
        log.warn("{} {} Consecutive refused pages: {}/{}",
                EMOJI_WARNING, EMOJI_HEALTH, failures, MAX_CONSECUTIVE_FAILURES);
    }

    private void resetFailureCount() {
        int previous = consecutiveFailures.getAndSet(0);
        if (previous > 0) {
            log.info("{} Failure count reset (was: {})", EMOJI_HEALTH, previous);
        }
    }

    public boolean isHealthy() {
        return consecutiveFailures.get() < MAX_CONSECUTIVE_FAILURES;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
