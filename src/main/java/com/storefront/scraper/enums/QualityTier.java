package com.storefront.scraper.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QualityTier {

    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static QualityTier fromConfidence(int confidence) {
        if (confidence >= 90) return EXCELLENT;
        if (confidence >= 75) return GOOD;
        if (confidence >= 50) return FAIR;
        return POOR;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
