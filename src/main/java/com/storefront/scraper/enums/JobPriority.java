package com.storefront.scraper.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobPriority {

    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * One tier lower; LOW stays LOW.
     */
    public JobPriority downgrade() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobPriority fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
