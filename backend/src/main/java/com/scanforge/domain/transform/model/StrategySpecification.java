package com.scanforge.domain.transform.model;

import java.util.List;

/**
 * Semantic description of a scanner, produced by the extractor or synthesized on fallback.
 */
public record StrategySpecification(
        String name,
        String description,
        StrategyType strategyType,
        List<String> entryConditions,
        List<String> exitConditions,
        ParameterSpecification parameters,
        String timeframe,
        String rationale,
        String scanKind
) {
    public StrategySpecification {
        entryConditions = entryConditions == null ? List.of() : List.copyOf(entryConditions);
        exitConditions = exitConditions == null ? List.of() : List.copyOf(exitConditions);
        parameters = parameters == null ? ParameterSpecification.empty() : parameters;
    }

    /**
     * Minimal specification used when extraction failed for a fallback-eligible shape.
     */
    public static StrategySpecification minimal(String name, ParameterSpecification parameters) {
        return new StrategySpecification(
                name,
                "Synthesized after semantic extraction failed",
                StrategyType.OTHER,
                List.of(),
                List.of(),
                parameters,
                "daily",
                "",
                "scanner"
        );
    }

    public StrategySpecification withParameters(ParameterSpecification newParameters) {
        return new StrategySpecification(name, description, strategyType, entryConditions, exitConditions,
                newParameters, timeframe, rationale, scanKind);
    }
}
