package com.storefront.scraper.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed failure taxonomy used for strategy feedback and proxy charging.
 */
public enum FailureKind {

    TIMEOUT,
    BLOCKED,
    CAPTCHA,
    RATE_LIMIT,
    PROXY_ERROR,
    NETWORK_ERROR,
    NOT_FOUND,
    VALIDATION_ERROR,
    UNKNOWN;

    public boolean isProxyRelated() {
        return this == PROXY_ERROR;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
