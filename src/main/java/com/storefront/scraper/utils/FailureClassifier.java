package com.storefront.scraper.utils;

import com.microsoft.playwright.TimeoutError;
import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.exception.NoProxyAvailableException;
import com.storefront.scraper.exception.RateLimitExceededException;
import com.storefront.scraper.exception.ScrapeAttemptException;

import java.util.Locale;

/**
 * Maps attempt errors onto {@link FailureKind}. Typed errors win, otherwise the message decides.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        if (error == null) {
            return FailureKind.UNKNOWN;
        }
        if (error instanceof ScrapeAttemptException attempt) {
            return attempt.getKind();
        }
        if (error instanceof TimeoutError) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof RateLimitExceededException) {
            return FailureKind.RATE_LIMIT;
        }
        if (error instanceof NoProxyAvailableException) {
            return FailureKind.PROXY_ERROR;
        }
        return classifyMessage(error.getMessage());
    }

    public static FailureKind classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return FailureKind.UNKNOWN;
        }
        String m = message.toLowerCase(Locale.ROOT);
        if (m.contains("timeout") || m.contains("timed out")) return FailureKind.TIMEOUT;
        if (m.contains("blocked") || m.contains("access denied")) return FailureKind.BLOCKED;
        if (m.contains("captcha")) return FailureKind.CAPTCHA;
        if (m.contains("rate limit") || m.contains("too many requests")) return FailureKind.RATE_LIMIT;
        if (m.contains("proxy")) return FailureKind.PROXY_ERROR;
        if (m.contains("network") || m.contains("net::err") || m.contains("connection")) return FailureKind.NETWORK_ERROR;
        if (m.contains("not found")) return FailureKind.NOT_FOUND;
        return FailureKind.UNKNOWN;
    }
}
