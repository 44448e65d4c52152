package com.storefront.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.storefront.scraper.enums.FailureKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrapingResult {

    private boolean success;
    private Map<String, Object> data;
    private String error;
    private FailureKind failureKind;
    private List<String> warnings;
    private int confidence;
    private long executionTime;
    private String strategy;
    private String sessionId;
    private String proxyUsed;

    public static ScrapingResult failure(FailureKind kind, String error, long executionTime,
                                         String strategy, String sessionId) {
        return ScrapingResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .confidence(0)
                .executionTime(executionTime)
                .strategy(strategy)
                .sessionId(sessionId)
                .build();
    }
}
