package com.storefront.scraper.model;

import com.storefront.scraper.enums.ProxyProtocol;
import com.storefront.scraper.exception.InvalidProxyException;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Egress endpoint. Identity is host:port; the rest of the state is owned by the proxy pool.
 */
@Getter
public class ProxyEndpoint {

    // protocol://[user:pass@]host:port[#CC]
    private static final Pattern SPEC = Pattern.compile(
            "^(\\w+)://(?:([^:@]+):([^@]*)@)?([^:/#@]+):(\\d{1,5})(?:#(\\w{2,3}))?$");

    private final String host;
    private final int port;
    private final ProxyProtocol protocol;
    private final String username;
    private final String password;
    private final String country;

    @Setter
    private volatile boolean active;
    private volatile Integer successRate;
    @Setter
    private volatile Instant lastUsed;

    @Builder
    private ProxyEndpoint(String host, int port, ProxyProtocol protocol, String username,
                          String password, String country, Boolean active, Integer successRate) {
        this.host = host;
        this.port = port;
        this.protocol = protocol;
        this.username = username;
        this.password = password;
        this.country = country != null ? country.toUpperCase(Locale.ROOT) : null;
        this.active = active == null || active;
        this.successRate = successRate;
    }

    public static ProxyEndpoint parse(String spec) {
        Matcher m = SPEC.matcher(spec == null ? "" : spec.trim());
        if (!m.matches()) {
            throw new InvalidProxyException("Unparseable proxy spec: " + spec);
        }
        ProxyProtocol protocol = ProxyProtocol.parse(m.group(1))
                .orElseThrow(() -> new InvalidProxyException("Unsupported proxy protocol: " + m.group(1)));
        return ProxyEndpoint.builder()
                .protocol(protocol)
                .username(m.group(2))
                .password(m.group(3))
                .host(m.group(4))
                .port(Integer.parseInt(m.group(5)))
                .country(m.group(6))
                .build();
    }

    public String id() {
        return host + ":" + port;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public Optional<String> countryTag() {
        return Optional.ofNullable(country);
    }

    public String serverAddress() {
        return protocol.scheme() + "://" + id();
    }

    /**
     * +5 on success, -10 on failure; an unmeasured endpoint jumps straight to 100 or 0.
     */
    public synchronized int recordCheck(boolean success) {
        int next;
        if (successRate == null) {
            next = success ? 100 : 0;
        } else {
            next = success ? successRate + 5 : successRate - 10;
        }
        successRate = Math.max(0, Math.min(100, next));
        return successRate;
    }

    @Override
    public String toString() {
        return id() + (country != null ? " (" + country + ")" : "");
    }
}
