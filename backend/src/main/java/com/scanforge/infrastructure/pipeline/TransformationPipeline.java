package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.GenerationStrategy;
import com.scanforge.domain.transform.model.OutputWindow;
import com.scanforge.domain.transform.model.ParameterSpecification;
import com.scanforge.domain.transform.model.ParameterValue;
import com.scanforge.domain.transform.model.PatternType;
import com.scanforge.domain.transform.model.SemanticExtraction;
import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.domain.transform.model.TransformationResult;
import com.scanforge.domain.transform.service.SemanticExtractor;
import com.scanforge.infrastructure.ai.ExtractionException;
import com.scanforge.infrastructure.classification.ConfigLiteral;
import com.scanforge.infrastructure.classification.StructuralAnalysis;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import com.scanforge.infrastructure.rendering.ConcurrencyHints;
import com.scanforge.infrastructure.rendering.ContextAdjustments;
import com.scanforge.infrastructure.rendering.DetectionFragment;
import com.scanforge.infrastructure.rendering.DetectionFragmentGenerator;
import com.scanforge.infrastructure.rendering.GenerationContext;
import com.scanforge.infrastructure.rendering.PreservedSource;
import com.scanforge.infrastructure.rendering.RenderException;
import com.scanforge.infrastructure.rendering.RenderPlan;
import com.scanforge.infrastructure.rendering.SourcePreserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrates one transformation:
 * <p>
 * classify → extract (or fall back) → select strategy → detection fragment → render/validate/correct → result
 * </p>
 * Every exception is converted into a failed result here; nothing escapes to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransformationPipeline {

    public static final String STAGE_CLASSIFICATION = "structural_classification";
    public static final String STAGE_EXTRACTION = "semantic_extraction";
    public static final String STAGE_EXTRACTION_FALLBACK = "semantic_extraction_fallback";
    public static final String STAGE_SELECTION = "strategy_selection";
    public static final String STAGE_PATTERNS = "pattern_generation";
    public static final String STAGE_PATTERNS_SKIPPED = "pattern_generation_skipped";
    public static final String STAGE_CODE = "code_generation";

    static final Map<String, Number> SMART_FILTER_DEFAULTS = smartFilterDefaults();

    private final StructuralClassifier classifier;
    private final SemanticExtractor extractor;
    private final StrategySelector selector;
    private final SourcePreserver sourcePreserver;
    private final DetectionFragmentGenerator fragmentGenerator;
    private final SelfCorrectionController correctionController;
    private final TransformProperties properties;

    public TransformationResult transform(String source, String proposedName, OutputWindow outputWindow,
                                          boolean verbose) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", Instant.now().toString());
        List<String> stages = new ArrayList<>();
        metadata.put("stages_completed", stages);

        try {
            metadata.put("output_window", Objects.requireNonNull(outputWindow, "output window is required").toString());
            // 1. Classify
            StructuralAnalysis analysis = classifier.analyze(source);
            ClassificationResult classification = analysis.classification();
            metadata.put("pattern_type", classification.patternType().name());
            metadata.put("classification_confidence", classification.confidence());
            stages.add(STAGE_CLASSIFICATION);
            progress(verbose, "[Pipeline] Classified as {} (confidence {})",
                    classification.patternType(), classification.confidence());

            // 2. Extract semantics, falling back for recognized shapes
            StrategySpecification specification = extract(source, proposedName, classification, metadata, stages);
            ParameterSpecification parameters = specification.parameters();
            if (analysis.configLiteral().isPresent()) {
                parameters = parameters.withSourceDefaults(sourceValues(analysis.configLiteral().get()));
                specification = specification.withParameters(parameters);
            }
            progress(verbose, "[Pipeline] Strategy '{}' with {} parameter(s)", specification.name(), parameters.size());

            // 3. Select strategy
            GenerationStrategy strategy = selector.select(classification, specification, source);
            String scannerName = ScannerNameFormatter.format(proposedName, specification.name());
            metadata.put("generation_strategy", strategy.name());
            metadata.put("strategy_name", specification.name());
            metadata.put("scanner_name", scannerName);
            stages.add(STAGE_SELECTION);
            progress(verbose, "[Pipeline] Selected {} for {}", strategy, scannerName);

            // 4. Detection fragment
            RenderPlan plan = RenderPlan.forStrategy(strategy, properties.getGeneric().isPreserveSource());
            PreservedSource preserved = plan.keepOriginalModule()
                    ? sourcePreserver.preserve(analysis, fragmentGenerator.fixedArityFunctions(analysis, plan))
                    : null;
            List<String> featureFunctions = fragmentGenerator.featureFunctions(analysis, plan);
            DetectionFragment fragment;
            try {
                fragment = fragmentGenerator.generate(analysis, plan, specification, preserved);
                stages.add(STAGE_PATTERNS);
            } catch (RenderException e) {
                log.warn("[Pipeline] Detection fragment unavailable, using placeholder: {}", e.getMessage());
                fragment = DetectionFragment.placeholder(e.getMessage(), specification.entryConditions());
                stages.add(STAGE_PATTERNS_SKIPPED);
            }

            // 5. Render, validate and correct
            GenerationContext context = new GenerationContext(
                    scannerName,
                    classification,
                    specification,
                    parameters,
                    plan,
                    preserved,
                    featureFunctions,
                    smartFilters(parameters),
                    fragment,
                    outputWindow,
                    new ConcurrencyHints(properties.getFetchWorkers(), properties.getDetectWorkers()),
                    properties.getLookbackDays(),
                    properties.getLookbackBufferDays(),
                    ContextAdjustments.none()
            );
            LoopOutcome outcome = correctionController.run(context);
            stages.add(STAGE_CODE);
            metadata.put("corrections", outcome.corrections());
            metadata.put("attempts", outcome.attempts());
            progress(verbose, "[Pipeline] Generation finished: {} after {} attempt(s), {} correction(s)",
                    outcome.state(), outcome.attempts(), outcome.corrections().size());

            List<String> errors = outcome.succeeded()
                    ? List.of()
                    : List.of("Validation failed after " + outcome.attempts()
                    + " attempt(s). Please review the generated code.");
            return new TransformationResult(
                    outcome.succeeded(),
                    outcome.artifact().code(),
                    outcome.validationResults(),
                    metadata,
                    errors,
                    outcome.corrections().size()
            );
        } catch (Exception e) {
            log.error("[Pipeline] Transformation failed after stages {}", stages, e);
            return TransformationResult.failure("Transformation failed: " + e.getMessage(), metadata);
        }
    }

    private StrategySpecification extract(String source, String proposedName, ClassificationResult classification,
                                          Map<String, Object> metadata, List<String> stages) {
        try {
            SemanticExtraction extraction = extractor.extract(source, classification);
            stages.add(STAGE_EXTRACTION);
            return extraction.specification().withParameters(extraction.parameters());
        } catch (ExtractionException e) {
            metadata.put("extraction_error", e.getMessage());
            PatternType type = classification.patternType();
            if (properties.policyFor(type) == FallbackPolicy.FAIL_FAST) {
                throw e;
            }
            log.warn("[Pipeline] Extraction failed for {} source, synthesizing a minimal specification: {}",
                    type, e.getMessage());
            stages.add(STAGE_EXTRACTION_FALLBACK);
            return StrategySpecification.minimal(fallbackName(type, proposedName), ParameterSpecification.empty());
        }
    }

    static String fallbackName(PatternType type, String proposedName) {
        if (proposedName != null && !proposedName.isBlank()) {
            return proposedName.strip() + "_Scanner";
        }
        return switch (type) {
            case MULTI -> "Multi_Scanner";
            case STANDALONE -> "Standalone_Scanner";
            default -> "Generic_Scanner";
        };
    }

    private static Map<String, ParameterValue> sourceValues(ConfigLiteral literal) {
        String provenance = "source:line " + literal.line();
        Map<String, ParameterValue> values = new LinkedHashMap<>();
        literal.entries().forEach((name, value) -> values.put(name, new ParameterValue(value, null, provenance)));
        return values;
    }

    static Map<String, Number> smartFilters(ParameterSpecification parameters) {
        Map<String, Number> filters = new LinkedHashMap<>(SMART_FILTER_DEFAULTS);
        filters.replaceAll((name, current) -> parameters.find(name)
                .map(ParameterValue::value)
                .filter(Number.class::isInstance)
                .map(Number.class::cast)
                .orElse(current));
        return filters;
    }

    private static Map<String, Number> smartFilterDefaults() {
        Map<String, Number> defaults = new LinkedHashMap<>();
        defaults.put("min_prev_close", 0.75);
        defaults.put("max_prev_close", 1000.0);
        defaults.put("min_prev_volume", 500_000L);
        defaults.put("max_prev_volume", 100_000_000L);
        return Collections.unmodifiableMap(defaults);
    }

    private void progress(boolean verbose, String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
