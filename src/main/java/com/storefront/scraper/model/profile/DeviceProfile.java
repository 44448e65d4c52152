package com.storefront.scraper.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.storefront.scraper.enums.DeviceType;
import lombok.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceProfile {
    private String name;
    private DeviceType type;
    private String userAgent;
    private Viewport viewport;
    private boolean mobile;
    private boolean hasTouch;
    private boolean landscape;
    private List<String> capabilities;
    private Navigator navigator;
    private Headers headers;

    // --- Nested Classes ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Viewport {
        private Integer width;
        private Integer height;
        private Double deviceScaleFactor;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Navigator {
        private String platform;
        private String vendor;
        private Integer maxTouchPoints;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Headers {
        private Map<String, String> standardHeaders;
        private Map<String, String> clientHintsHeaders;
    }

    public Map<String, String> allHeaders() {
        Map<String, String> all = new HashMap<>();
        if (headers == null) {
            return all;
        }
        if (headers.getStandardHeaders() != null) {
            all.putAll(headers.getStandardHeaders());
        }
        if (headers.getClientHintsHeaders() != null) {
            all.putAll(headers.getClientHintsHeaders());
        }
        return all;
    }
}
