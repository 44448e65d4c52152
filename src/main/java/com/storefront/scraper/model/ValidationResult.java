package com.storefront.scraper.model;

import com.storefront.scraper.enums.QualityTier;

import java.util.List;

/**
 * @param valid      true iff there are no hard errors
 * @param errors     hard errors
 * @param warnings   soft warnings, never invalidating on their own
 * @param confidence 0-100 after penalties
 * @param quality    tier derived from confidence
 */
public record ValidationResult(boolean valid,
                               List<String> errors,
                               List<String> warnings,
                               int confidence,
                               QualityTier quality) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult broken(String reason) {
        return new ValidationResult(false, List.of(reason), List.of(), 0, QualityTier.POOR);
    }
}
