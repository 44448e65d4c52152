package com.storefront.scraper.service;

import com.storefront.scraper.enums.QualityTier;
import com.storefront.scraper.model.ValidationResult;
import com.storefront.scraper.model.validation.ValidationRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores extracted listings. Each defect subtracts a named penalty from 100; hard errors make the record invalid.
 */
@Service
@Slf4j
public class DataValidator {

    private static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
            Pattern.compile("\\[.*?]"),
            Pattern.compile("\\{.*?}"),
            Pattern.compile("<.*?>"),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("data:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("blob:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("about:blank", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> PLACEHOLDER_PATTERNS = List.of(
            Pattern.compile("^[A-Z\\s]+$"),
            Pattern.compile("^[a-z\\s]+$"),
            Pattern.compile("^\\d+$"),
            Pattern.compile("^[^\\w\\s]+$"),
            Pattern.compile("^(product|item|goods|merchandise)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(title|name|description|price)$", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d*\\.?\\d+");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^\\d+,\\d{1,2}$");

    private final AtomicReference<ValidationRules> rules;
    private final Clock clock;

    public DataValidator(ValidationRules validationRules, Clock clock) {
        this.rules = new AtomicReference<>(validationRules);
        this.clock = clock;
    }

    public ValidationResult validate(Map<String, Object> data) {
        try {
            return new Pass(rules.get(), data == null ? Map.of() : data).run();
        } catch (RuntimeException e) {
            log.warn("Validation aborted: {}", e.getMessage());
            return ValidationResult.broken("Validation error: " + e.getMessage());
        }
    }

    public ValidationRules getRules() {
        return rules.get();
    }

    public void updateRules(ValidationRules newRules) {
        rules.set(Objects.requireNonNull(newRules, "rules"));
        log.info("⚙️ Validation rules updated");
    }

    /**
     * One validation run: accumulates errors, warnings and penalties for a single record.
     */
    private final class Pass {

        private final ValidationRules r;
        private final ValidationRules.Penalties p;
        private final Map<String, Object> data;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private int penalty;

        Pass(ValidationRules rules, Map<String, Object> data) {
            this.r = rules;
            this.p = rules.getPenalties();
            this.data = data;
        }

        ValidationResult run() {
            checkRequiredText("title", r.getTitle(), "Product title");
            checkPrice();
            checkRequiredText("description", r.getDescription(), "Product description");
            checkImages();
            checkOptionalText("supplierName", r.getSupplierName());
            if (present("url")) checkUrl(String.valueOf(data.get("url")));
            if (present("scrapedAt")) checkTimestamp(data.get("scrapedAt"));
            qualityChecks();

            int confidence = Math.max(0, Math.min(100, 100 - penalty));
            return new ValidationResult(errors.isEmpty(), errors, warnings, confidence,
                    QualityTier.fromConfidence(confidence));
        }

        private void error(String message, int points) {
            errors.add(message);
            penalty += points;
        }

        private void warning(String message, int points) {
            warnings.add(message);
            penalty += points;
        }

        private boolean present(String field) {
            Object value = data.get(field);
            if (value == null) return false;
            if (value instanceof String s) return !s.isEmpty();
            if (value instanceof Number n) return n.doubleValue() != 0;
            if (value instanceof Boolean b) return b;
            return true;
        }

        private void checkRequiredText(String field, ValidationRules.TextRule rule, String label) {
            Object value = data.get(field);
            if (rule.isRequired() && (!present(field) || !(value instanceof String))) {
                error(label + " is required and must be a string", rule.getRequiredPenalty());
            } else if (value instanceof String s && !s.isEmpty()) {
                checkText(field, s, rule);
            }
        }

        private void checkOptionalText(String field, ValidationRules.TextRule rule) {
            if (data.get(field) instanceof String s && !s.isEmpty()) {
                checkText(field, s, rule);
            } else if (rule.isRequired()) {
                error(field + " is required and must be a string", rule.getRequiredPenalty());
            }
        }

        private void checkText(String field, String value, ValidationRules.TextRule rule) {
            if (value.length() < rule.getMinLength()) {
                error(String.format("%s is too short (%d chars, minimum %d)", field, value.length(), rule.getMinLength()),
                        p.getTooShort());
            }
            if (value.length() > rule.getMaxLength()) {
                warning(String.format("%s is very long (%d chars, maximum %d)", field, value.length(), rule.getMaxLength()),
                        p.getTooLong());
            }
            if (SUSPICIOUS_PATTERNS.stream().anyMatch(pt -> pt.matcher(value).find())) {
                warning(field + " contains suspicious patterns", p.getSuspiciousContent());
            }
            if (isRepetitive(value)) {
                warning(field + " appears to contain repetitive content", p.getRepetitiveContent());
            }
        }

        private void checkPrice() {
            ValidationRules.PriceRule rule = r.getPrice();
            Object value = data.get("price");
            boolean usable = present("price") && (value instanceof String || value instanceof Number);
            if (!usable) {
                if (rule.isRequired()) {
                    error("Product price is required and must be a string", rule.getRequiredPenalty());
                }
                return;
            }
            Double price = parsePrice(value.toString());
            if (price == null) {
                error("Price could not be parsed as a number", p.getPriceUnparseable());
                return;
            }
            if (price < rule.getMin()) {
                error(String.format(Locale.ROOT, "Price is too low: %s (minimum %s)", price, rule.getMin()),
                        p.getPriceTooLow());
            }
            if (price > rule.getMax()) {
                warning(String.format(Locale.ROOT, "Price is very high: %s (maximum %s)", price, rule.getMax()),
                        p.getPriceTooHigh());
            }
            if (price == 0 || price == 1) {
                warning("Price seems suspiciously low", p.getSuspiciousPrice());
            }
            if (price % 1 == 0 && price < rule.getSmallWholeNumberBelow()) {
                warning("Price is a suspicious whole number", p.getSuspiciousWholePrice());
            }
        }

        private void checkImages() {
            ValidationRules.ImageRule rule = r.getImages();
            Object value = data.get("images");
            if (!(value instanceof Collection<?> images)) {
                if (rule.isRequired()) {
                    error("Product images are required and must be an array", rule.getRequiredPenalty());
                }
                return;
            }
            if (images.size() < rule.getMinItems()) {
                error(String.format("Too few images: %d (minimum %d)", images.size(), rule.getMinItems()),
                        p.getTooFewImages());
            }
            if (images.size() > rule.getMaxItems()) {
                warning(String.format("Many images: %d (maximum %d)", images.size(), rule.getMaxItems()),
                        p.getTooManyImages());
            }
            int index = 0;
            for (Object image : images) {
                index++;
                if (!isImageUrl(image == null ? null : image.toString(), rule)) {
                    warning(String.format("Image %d has invalid URL: %s", index, image), p.getInvalidImageUrl());
                }
            }
            if (new HashSet<>(images).size() < images.size()) {
                warning("Duplicate images detected", p.getDuplicateImages());
            }
        }

        private void checkUrl(String url) {
            URI uri;
            try {
                uri = new URI(url.trim());
            } catch (URISyntaxException e) {
                error("Invalid URL format", p.getMalformedUrl());
                return;
            }
            if (uri.getScheme() == null) {
                error("Invalid URL format", p.getMalformedUrl());
                return;
            }
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            if (r.getUrl().getExpectedDomains().stream().noneMatch(host::contains)) {
                warning("URL domain (" + host + ") is not from expected e-commerce platform", p.getUnexpectedDomain());
            }
            String lower = url.toLowerCase(Locale.ROOT);
            if (r.getUrl().getUnsafeSchemes().stream().anyMatch(lower::contains)) {
                error("URL contains suspicious patterns", p.getUnsafeUrl());
            }
        }

        private void checkTimestamp(Object raw) {
            Instant at = parseInstant(raw);
            if (at == null) {
                error("Invalid timestamp format", p.getInvalidTimestamp());
                return;
            }
            Instant now = clock.instant();
            if (Duration.between(at, now).abs().compareTo(r.getMaxDataAge()) > 0) {
                warning("Timestamp is more than " + r.getMaxDataAge().toHours() + " hours old", p.getStaleTimestamp());
            }
            if (at.isAfter(now.plus(r.getFutureSkew()))) {
                error("Timestamp is in the future", p.getFutureTimestamp());
            }
        }

        private void qualityChecks() {
            List<String> missing = r.getImportantFields().stream().filter(f -> !present(f)).toList();
            if (!missing.isEmpty()) {
                warning("Missing important fields: " + String.join(", ", missing),
                        missing.size() * p.getMissingImportantField());
            }
            for (Map.Entry<String, Object> entry : data.entrySet()) {
                if (entry.getValue() instanceof String s
                        && PLACEHOLDER_PATTERNS.stream().anyMatch(pt -> pt.matcher(s).matches())) {
                    warning("Field '" + entry.getKey() + "' contains placeholder-like content: \"" + s + "\"",
                            p.getPlaceholderContent());
                }
            }
            if (data.get("title") instanceof String title && !title.isEmpty() && title.length() < r.getMinTitleLength()) {
                warning("Title is extremely short", p.getShortTitle());
            }
            if (data.get("description") instanceof String d && !d.isEmpty() && d.length() < r.getMinDescriptionLength()) {
                warning("Description is very short", p.getShortDescription());
            }
        }
    }

    static Double parsePrice(String raw) {
        String cleaned = raw.replaceAll("[^\\d.,]", "");
        if (DECIMAL_COMMA.matcher(cleaned).matches()) {
            cleaned = cleaned.replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }
        Matcher m = LEADING_NUMBER.matcher(cleaned);
        if (!m.find()) {
            return null;
        }
        return Double.parseDouble(m.group());
    }

    static boolean isRepetitive(String text) {
        if (text.length() < 20) return false;
        String[] words = text.toLowerCase(Locale.ROOT).split("\\s+");
        Map<String, Integer> counts = new HashMap<>();
        for (String word : words) {
            if (word.length() > 2) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        int maxFrequency = (int) Math.ceil(words.length * 0.3);
        return counts.values().stream().anyMatch(c -> c > maxFrequency);
    }

    static boolean isImageUrl(String url, ValidationRules.ImageRule rule) {
        if (url == null || url.isBlank()) return false;
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) return false;
            String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
            String host = uri.getHost().toLowerCase(Locale.ROOT);
            return rule.getExtensions().stream().anyMatch(path::contains)
                    || rule.getHostHints().stream().anyMatch(host::contains);
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static Instant parseInstant(Object raw) {
        if (raw instanceof Instant instant) return instant;
        if (raw instanceof Number n) return Instant.ofEpochMilli(n.longValue());
        String s = raw.toString().trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeException ignored) {
                return null;
            }
        }
    }
}
