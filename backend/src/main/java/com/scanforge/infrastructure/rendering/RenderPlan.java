package com.scanforge.infrastructure.rendering;

import com.scanforge.domain.transform.model.GenerationStrategy;

import java.util.List;

/**
 * Parameterizes the single code renderer for one generation strategy.
 *
 * @param strategy           strategy this plan implements
 * @param keepOriginalModule embed the (rewritten) source module above the generated class
 * @param aggregatePatterns  group detections by (ticker, date) with a joined label
 * @param extractionRule     where the detection fragment comes from
 * @param requiredImports    import statements the skeleton needs
 */
public record RenderPlan(
        GenerationStrategy strategy,
        boolean keepOriginalModule,
        boolean aggregatePatterns,
        ExtractionRule extractionRule,
        List<RequiredImport> requiredImports
) {
    public static final List<RequiredImport> SKELETON_IMPORTS = List.of(
            new RequiredImport("os", "import os", List.of("os")),
            new RequiredImport("pandas", "import pandas as pd", List.of("pd")),
            new RequiredImport("numpy", "import numpy as np", List.of("np")),
            new RequiredImport("requests", "import requests", List.of("requests")),
            new RequiredImport("pandas_market_calendars", "import pandas_market_calendars as mcal", List.of("mcal")),
            new RequiredImport("concurrent.futures",
                    "from concurrent.futures import ThreadPoolExecutor, as_completed",
                    List.of("ThreadPoolExecutor", "as_completed"))
    );

    /**
     * An import statement and the names it binds.
     */
    public record RequiredImport(String module, String statement, List<String> boundNames) {
    }

    public RenderPlan {
        requiredImports = List.copyOf(requiredImports);
    }

    public static RenderPlan forStrategy(GenerationStrategy strategy, boolean preserveGenericSource) {
        return switch (strategy) {
            case HYBRID_PRESERVE -> new RenderPlan(strategy, true, false,
                    ExtractionRule.DETECTION_LOOP, SKELETON_IMPORTS);
            case HYBRID_PRESERVE_MULTI -> new RenderPlan(strategy, true, true,
                    ExtractionRule.PATTERN_RULES, SKELETON_IMPORTS);
            case GENERIC_PRESERVE -> new RenderPlan(strategy, preserveGenericSource, false,
                    ExtractionRule.DETECTOR_CALL, SKELETON_IMPORTS);
        };
    }

    /**
     * Template-only plans render the skeleton without embedding any source code.
     */
    public boolean isTemplateOnly() {
        return !keepOriginalModule;
    }
}
