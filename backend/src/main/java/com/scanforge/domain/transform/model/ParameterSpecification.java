package com.scanforge.domain.transform.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Categorized thresholds extracted from a scanner. Deeply immutable: corrections never alter these values.
 */
public record ParameterSpecification(Map<ParameterCategory, Map<String, ParameterValue>> categories) {

    public ParameterSpecification {
        EnumMap<ParameterCategory, Map<String, ParameterValue>> copy = new EnumMap<>(ParameterCategory.class);
        for (ParameterCategory category : ParameterCategory.values()) {
            Map<String, ParameterValue> entries = categories == null ? null : categories.get(category);
            copy.put(category, entries == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
        categories = Collections.unmodifiableMap(copy);
    }

    public static ParameterSpecification empty() {
        return new ParameterSpecification(Map.of());
    }

    public Map<String, ParameterValue> get(ParameterCategory category) {
        return categories.get(category);
    }

    public Optional<ParameterValue> find(String name) {
        for (Map<String, ParameterValue> entries : categories.values()) {
            ParameterValue value = entries.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return categories.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns a copy with source-declared defaults added to OTHER for names not already present anywhere.
     */
    public ParameterSpecification withSourceDefaults(Map<String, ParameterValue> sourceValues) {
        EnumMap<ParameterCategory, Map<String, ParameterValue>> merged = new EnumMap<>(ParameterCategory.class);
        categories.forEach((category, entries) -> merged.put(category, new LinkedHashMap<>(entries)));
        sourceValues.forEach((name, value) -> {
            if (find(name).isEmpty()) {
                merged.get(ParameterCategory.OTHER).put(name, value);
            }
        });
        return new ParameterSpecification(merged);
    }
}
