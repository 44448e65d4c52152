package com.storefront.scraper.model.validation;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Field rules and named penalties for listing validation. Replaced wholesale at runtime.
 */
@Data
public class ValidationRules {

    private TextRule title = TextRule.required(3, 200, 30);
    private PriceRule price = new PriceRule();
    private TextRule description = TextRule.required(10, 2000, 20);
    private ImageRule images = new ImageRule();
    private TextRule supplierName = TextRule.optional(2, 100);
    private UrlRule url = new UrlRule();
    private Duration maxDataAge = Duration.ofHours(24);
    /** Browser and server clocks may disagree slightly. */
    private Duration futureSkew = Duration.ofMinutes(1);
    private int minTitleLength = 5;
    private int minDescriptionLength = 20;
    private List<String> importantFields = new ArrayList<>(List.of("title", "price", "description", "images"));
    private Penalties penalties = new Penalties();

    @Data
    public static class TextRule {
        private boolean required;
        private int requiredPenalty;
        private int minLength;
        private int maxLength;

        public static TextRule required(int minLength, int maxLength, int requiredPenalty) {
            TextRule rule = new TextRule();
            rule.setRequired(true);
            rule.setRequiredPenalty(requiredPenalty);
            rule.setMinLength(minLength);
            rule.setMaxLength(maxLength);
            return rule;
        }

        public static TextRule optional(int minLength, int maxLength) {
            TextRule rule = new TextRule();
            rule.setMinLength(minLength);
            rule.setMaxLength(maxLength);
            return rule;
        }
    }

    @Data
    public static class PriceRule {
        private boolean required = true;
        private int requiredPenalty = 25;
        private double min = 0.01;
        private double max = 100_000;
        private double smallWholeNumberBelow = 10;
    }

    @Data
    public static class ImageRule {
        private boolean required = true;
        private int requiredPenalty = 20;
        private int minItems = 1;
        private int maxItems = 20;
        private List<String> extensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".svg"));
        private List<String> hostHints = new ArrayList<>(List.of("image", "img"));
    }

    @Data
    public static class UrlRule {
        private List<String> expectedDomains = new ArrayList<>(
                List.of("alibaba.com", "aliexpress.com", "amazon.com", "amazon.co.uk"));
        private List<String> unsafeSchemes = new ArrayList<>(List.of("javascript:", "data:"));
    }

    @Data
    public static class Penalties {
        private int tooShort = 15;
        private int tooLong = 5;
        private int suspiciousContent = 10;
        private int repetitiveContent = 8;
        private int priceUnparseable = 20;
        private int priceTooLow = 15;
        private int priceTooHigh = 5;
        private int suspiciousPrice = 10;
        private int suspiciousWholePrice = 5;
        private int tooFewImages = 15;
        private int tooManyImages = 5;
        private int invalidImageUrl = 3;
        private int duplicateImages = 5;
        private int unexpectedDomain = 5;
        private int unsafeUrl = 20;
        private int malformedUrl = 15;
        private int invalidTimestamp = 10;
        private int staleTimestamp = 5;
        private int futureTimestamp = 15;
        private int missingImportantField = 5;
        private int placeholderContent = 8;
        private int shortTitle = 10;
        private int shortDescription = 8;
    }
}
