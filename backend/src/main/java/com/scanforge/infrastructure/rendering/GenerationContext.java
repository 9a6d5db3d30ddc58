package com.scanforge.infrastructure.rendering;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.OutputWindow;
import com.scanforge.domain.transform.model.ParameterSpecification;
import com.scanforge.domain.transform.model.StrategySpecification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the renderer needs for one attempt. Rebuilt for every attempt via {@link #withAdjustments}; never
 * mutated.
 *
 * @param scannerName      generated class name
 * @param classification   structural classification of the source
 * @param specification    extracted or synthesized strategy specification
 * @param parameters       extracted parameters (read-only)
 * @param plan             render plan for the selected strategy
 * @param preservedSource  rewritten source module, or null for template-only plans
 * @param featureFunctions source functions applied per ticker in the compute stage
 * @param smartFilters     cheap-filter thresholds
 * @param fragment         detection fragment
 * @param outputWindow     requested output window
 * @param concurrency      worker pool sizes
 * @param lookbackDays     default historical lookback in calendar days
 * @param lookbackBuffer   extra days added to the lookback
 * @param adjustments      corrections accumulated so far
 */
public record GenerationContext(
        String scannerName,
        ClassificationResult classification,
        StrategySpecification specification,
        ParameterSpecification parameters,
        RenderPlan plan,
        PreservedSource preservedSource,
        List<String> featureFunctions,
        Map<String, Number> smartFilters,
        DetectionFragment fragment,
        OutputWindow outputWindow,
        ConcurrencyHints concurrency,
        int lookbackDays,
        int lookbackBuffer,
        ContextAdjustments adjustments
) {
    public GenerationContext {
        featureFunctions = List.copyOf(featureFunctions);
        smartFilters = Collections.unmodifiableMap(new LinkedHashMap<>(smartFilters));
        adjustments = adjustments == null ? ContextAdjustments.none() : adjustments;
    }

    /**
     * A fresh context equal to this one with {@code extra} merged into the accumulated adjustments.
     */
    public GenerationContext withAdjustments(ContextAdjustments extra) {
        return new GenerationContext(scannerName, classification, specification, parameters, plan,
                preservedSource, featureFunctions, smartFilters, fragment, outputWindow, concurrency,
                lookbackDays, lookbackBuffer, adjustments.merge(extra));
    }

    /**
     * Fragment to render: the correction override if one was requested, else the generated one.
     */
    public DetectionFragment effectiveFragment() {
        return adjustments.fragmentOverride() != null ? adjustments.fragmentOverride() : fragment;
    }
}
