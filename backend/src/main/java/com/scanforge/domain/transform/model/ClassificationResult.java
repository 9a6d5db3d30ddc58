package com.scanforge.domain.transform.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural fingerprint of an input script, decided once per transformation.
 *
 * @param patternType     classified shape
 * @param confidence      classifier confidence in [0, 1]
 * @param indicators      structural indicator counts, keyed by indicator name
 * @param dataSourceFlags data source detection result
 * @param patternNames    distinct detection-rule names found, sorted
 */
public record ClassificationResult(
        PatternType patternType,
        double confidence,
        Map<String, Integer> indicators,
        DataSourceFlags dataSourceFlags,
        List<String> patternNames
) {
    public static final String FUNCTIONS = "functions";
    public static final String CLASSES = "classes";
    public static final String IMPORTS = "imports";
    public static final String PATTERN_ASSIGNMENTS = "pattern_assignments";
    public static final String PATTERN_CHECK_FUNCTIONS = "pattern_check_functions";
    public static final String PATTERN_COUNT = "pattern_count";
    public static final String STANDALONE_MARKERS = "standalone_markers";
    public static final String CONFIG_LITERAL = "config_literal";
    public static final String ENTRY_GUARD = "entry_guard";
    public static final String NUMERIC_LITERALS = "numeric_literals";
    public static final String STRING_LITERALS = "string_literals";

    public ClassificationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        indicators = Collections.unmodifiableMap(new TreeMap<>(indicators));
        patternNames = List.copyOf(patternNames);
    }

    public int indicator(String name) {
        return indicators.getOrDefault(name, 0);
    }
}
