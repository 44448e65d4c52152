package com.storefront.scraper.exception;

import com.storefront.scraper.enums.FailureKind;
import lombok.Getter;

import java.util.List;

/**
 * Aggregated failure raised once every planned strategy attempt has failed.
 */
@Getter
public class StrategiesExhaustedException extends RuntimeException {

    private final int attempts;
    private final FailureKind lastKind;
    private final List<String> attemptedStrategies;

    public StrategiesExhaustedException(int attempts, FailureKind lastKind,
                                        List<String> attemptedStrategies, Throwable lastError) {
        super("All strategies failed after " + attempts + " attempts. Last error: "
                + (lastError != null ? lastError.getMessage() : "none"), lastError);
        this.attempts = attempts;
        this.lastKind = lastKind;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }
}
