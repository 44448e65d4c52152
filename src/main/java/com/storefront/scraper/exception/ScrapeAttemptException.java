package com.storefront.scraper.exception;

import com.storefront.scraper.enums.FailureKind;
import lombok.Getter;

/**
 * A single strategy attempt failed for a known reason.
 */
@Getter
public class ScrapeAttemptException extends RuntimeException {

    private final FailureKind kind;

    public ScrapeAttemptException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScrapeAttemptException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
