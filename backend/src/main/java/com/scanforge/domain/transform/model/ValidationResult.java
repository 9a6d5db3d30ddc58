package com.scanforge.domain.transform.model;

import java.util.List;

/**
 * Outcome of one validation category.
 *
 * @param category checked category
 * @param valid    true if no errors were found
 * @param errors   blocking problems
 * @param warnings advisory findings, never blocking
 */
public record ValidationResult(
        ValidationCategory category,
        boolean valid,
        List<String> errors,
        List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(ValidationCategory category, List<String> errors, List<String> warnings) {
        return new ValidationResult(category, errors.isEmpty(), errors, warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
