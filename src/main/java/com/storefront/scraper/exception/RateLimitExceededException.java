package com.storefront.scraper.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown when neither a concurrency slot nor a request budget could be reserved in time.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final Duration waited;

    public RateLimitExceededException(String message, Duration waited) {
        super(message);
        this.waited = waited;
    }
}
