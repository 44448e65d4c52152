package com.storefront.scraper.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {

    /**
     * Waiting in the queue
     */
    PENDING,

    /**
     * Picked up by a worker
     */
    PROCESSING,

    /**
     * Scraped and validated
     */
    COMPLETED,

    /**
     * Gave up after the last retry
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
