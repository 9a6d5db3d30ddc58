package com.scanforge.domain.transform.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one transformation. Callers must check {@code success} before using {@code generatedCode}.
 */
public record TransformationResult(
        boolean success,
        String generatedCode,
        List<ValidationResult> validationResults,
        Map<String, Object> metadata,
        List<String> errors,
        int correctionsApplied
) {
    public TransformationResult {
        validationResults = List.copyOf(validationResults);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        errors = List.copyOf(errors);
    }

    public static TransformationResult failure(String error, Map<String, Object> metadata) {
        return new TransformationResult(false, null, List.of(), metadata, List.of(error), 0);
    }
}
