package com.storefront.scraper.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ProxyProtocol {

    HTTP,
    HTTPS,
    SOCKS5;

    public static Optional<ProxyProtocol> parse(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.name().equals(normalized)).findFirst();
    }

    public String scheme() {
        return name().toLowerCase(Locale.ROOT);
    }
}
