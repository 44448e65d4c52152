package com.storefront.scraper.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum Platform {

    ALIBABA("alibaba", "alibaba.com", "https://www.alibaba.com/trade/search?SearchText=%s"),
    ALIEXPRESS("aliexpress", "aliexpress.com", "https://www.aliexpress.com/wholesale?SearchText=%s"),
    AMAZON("amazon", "amazon.com", "https://www.amazon.com/s?k=%s");

    private final String code;
    private final String domain;
    private final String searchUrlTemplate;

    Platform(String code, String domain, String searchUrlTemplate) {
        this.code = code;
        this.domain = domain;
        this.searchUrlTemplate = searchUrlTemplate;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Platform fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(code) || p.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported platform: " + code));
    }
}
