package com.scanforge.infrastructure.pipeline;

import com.scanforge.Fixtures;
import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.OutputWindow;
import com.scanforge.domain.transform.model.ParameterCategory;
import com.scanforge.domain.transform.model.ParameterSpecification;
import com.scanforge.domain.transform.model.ParameterValue;
import com.scanforge.domain.transform.model.PatternType;
import com.scanforge.domain.transform.model.SemanticExtraction;
import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.domain.transform.model.StrategyType;
import com.scanforge.domain.transform.model.TransformationResult;
import com.scanforge.domain.transform.model.ValidationCategory;
import com.scanforge.domain.transform.model.ValidationResult;
import com.scanforge.domain.transform.service.SemanticExtractor;
import com.scanforge.infrastructure.ai.ExtractionException;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import com.scanforge.infrastructure.rendering.CodeRenderer;
import com.scanforge.infrastructure.rendering.DetectionFragment;
import com.scanforge.infrastructure.rendering.DetectionFragmentGenerator;
import com.scanforge.infrastructure.rendering.OutputSanitizer;
import com.scanforge.infrastructure.rendering.SourcePreserver;
import com.scanforge.infrastructure.validation.CodeValidator;
import com.scanforge.infrastructure.validation.ValidationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransformationPipelineTest {

    private static final OutputWindow WINDOW = new OutputWindow(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 3, 28));

    @Mock
    private SemanticExtractor extractor;

    private TransformProperties properties;
    private TransformationPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new TransformProperties();
        pipeline = pipelineWith(new CodeValidator(new ValidationProperties()));
    }

    private TransformationPipeline pipelineWith(CodeValidator validator) {
        CodeRenderer renderer = new CodeRenderer(new OutputSanitizer());
        return new TransformationPipeline(
                new StructuralClassifier(),
                extractor,
                new StrategySelector(),
                new SourcePreserver(),
                new DetectionFragmentGenerator(),
                new SelfCorrectionController(renderer, validator, properties),
                properties
        );
    }

    private static SemanticExtraction extraction(String name,
                                                 Map<ParameterCategory, Map<String, ParameterValue>> params) {
        ParameterSpecification parameters = new ParameterSpecification(params);
        StrategySpecification specification = new StrategySpecification(name, "Extracted for tests",
                StrategyType.PATTERN, List.of("pattern fires"), List.of(), parameters, "daily", "", "scanner");
        return new SemanticExtraction(specification, parameters);
    }

    @SuppressWarnings("unchecked")
    private static List<String> stages(TransformationResult result) {
        return (List<String>) result.metadata().get("stages_completed");
    }

    // ── End-to-end scenarios ──

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Standalone scanner, extractor down → fallback specification, valid hybrid scanner")
        void standalone_with_extraction_fallback() {
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenThrow(new ExtractionException("Semantic extraction failed: timeout"));

            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.STANDALONE), null, WINDOW, false);

            assertThat(result.success()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.correctionsApplied()).isZero();
            assertThat(stages(result)).containsExactly(
                    TransformationPipeline.STAGE_CLASSIFICATION,
                    TransformationPipeline.STAGE_EXTRACTION_FALLBACK,
                    TransformationPipeline.STAGE_SELECTION,
                    TransformationPipeline.STAGE_PATTERNS,
                    TransformationPipeline.STAGE_CODE);
            assertThat(result.metadata())
                    .containsEntry("pattern_type", "STANDALONE")
                    .containsEntry("generation_strategy", "HYBRID_PRESERVE")
                    .containsEntry("strategy_name", "Standalone_Scanner")
                    .containsEntry("scanner_name", "StandaloneScanner")
                    .containsEntry("extraction_error", "Semantic extraction failed: timeout")
                    .containsEntry("output_window", "2024-01-02..2024-03-28")
                    .containsEntry("attempts", 1);
            assertThat(result.generatedCode())
                    .contains("class StandaloneScanner:")
                    .contains("\"price_min\": 8.0,")
                    .contains("\"adv20_min_usd\": 30000000,")
                    .contains("\"d1_volume_min\": None,")
                    .contains("merged.update(P)")
                    .contains("if not gap_ok(P_local, r0, r1):");
        }

        @Test
        @DisplayName("Multi-pattern scanner with extracted parameters → labelled multi scanner")
        void multi_pattern_with_extraction() {
            when(extractor.extract(anyString(), any(ClassificationResult.class))).thenReturn(extraction("lc_multi",
                    Map.of(ParameterCategory.PRICE,
                            Map.of("min_prev_close", new ParameterValue(2.5, "usd", "extractor:primary")))));

            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.MULTI), "lc multi", WINDOW, true);

            assertThat(result.success()).isTrue();
            assertThat(stages(result)).contains(TransformationPipeline.STAGE_EXTRACTION)
                    .doesNotContain(TransformationPipeline.STAGE_EXTRACTION_FALLBACK);
            assertThat(result.metadata())
                    .containsEntry("generation_strategy", "HYBRID_PRESERVE_MULTI")
                    .containsEntry("scanner_name", "LcMultiScanner");
            assertThat(result.generatedCode())
                    .contains("class LcMultiScanner:")
                    .contains("\"min_prev_close\": 2.5,")
                    .contains("\"gap_min\": 0.5,")
                    .contains("\"pm_setup\",")
                    .contains("scanner_label");
            assertThat(result.validationResults()).extracting(ValidationResult::category)
                    .contains(ValidationCategory.SYNTAX, ValidationCategory.STYLE);
        }

        @Test
        @DisplayName("Generic scanner with extraction → detector call wrapped in the skeleton")
        void generic_with_extraction() {
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenReturn(extraction("breakout_20", Map.of()));

            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.GENERIC), null, WINDOW, false);

            assertThat(result.success()).isTrue();
            assertThat(result.metadata()).containsEntry("generation_strategy", "GENERIC_PRESERVE")
                    .containsEntry("scanner_name", "Breakout20Scanner");
            assertThat(result.generatedCode())
                    .contains("import numpy as np")
                    .contains("detected = find_breakouts(ticker_df.copy())");
        }

        @Test
        @DisplayName("Generic scanner, extractor down → fail fast with only classification done")
        void generic_extraction_failure_fails_fast() {
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenThrow(new ExtractionException("Semantic extraction failed: 503"));

            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.GENERIC), null, WINDOW, false);

            assertThat(result.success()).isFalse();
            assertThat(result.generatedCode()).isNull();
            assertThat(result.errors()).containsExactly("Transformation failed: Semantic extraction failed: 503");
            assertThat(stages(result)).containsExactly(TransformationPipeline.STAGE_CLASSIFICATION);
        }

        @Test
        @DisplayName("Generic fallback policy continues with a synthesized specification")
        void generic_fallback_policy() {
            properties.getFallbackPolicy().put(PatternType.GENERIC, FallbackPolicy.FALLBACK);
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenThrow(new ExtractionException("Semantic extraction failed: 503"));

            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.GENERIC), "breakouts", WINDOW,
                    false);

            assertThat(result.success()).isTrue();
            assertThat(result.metadata()).containsEntry("strategy_name", "breakouts_Scanner")
                    .containsEntry("scanner_name", "BreakoutsScanner");
        }

        @Test
        @DisplayName("Standalone scanner importing less common stdlib modules → still valid")
        void standalone_with_stdlib_imports() {
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenThrow(new ExtractionException("down"));
            String source = "import cProfile\nimport getopt\nimport graphlib\n" + Fixtures.load(Fixtures.STANDALONE);

            TransformationResult result = pipeline.transform(source, null, WINDOW, false);

            assertThat(result.success()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.generatedCode()).contains("import cProfile");
        }

        @Test
        @DisplayName("Missing output window → failed result instead of an exception")
        void missing_output_window() {
            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.STANDALONE), null, null, false);

            assertThat(result.success()).isFalse();
            assertThat(result.errors()).containsExactly("Transformation failed: output window is required");
            assertThat(result.metadata()).doesNotContainKey("output_window");
            verifyNoInteractions(extractor);
        }

        @Test
        @DisplayName("Unparseable source → failed result, nothing extracted")
        void parse_error() {
            TransformationResult result = pipeline.transform(Fixtures.load(Fixtures.BROKEN), null, WINDOW, false);

            assertThat(result.success()).isFalse();
            assertThat(result.errors()).singleElement().asString().startsWith("Transformation failed: ");
            assertThat(stages(result)).isEmpty();
            verifyNoInteractions(extractor);
        }
    }

    // ── Degraded paths ──

    @Nested
    @DisplayName("Degraded paths")
    class DegradedPaths {

        @Test
        @DisplayName("Standalone shape without a detection loop → placeholder fragment, still valid")
        void fragment_unavailable() {
            String source = """
                    P = {"x": 1}


                    def fetch_daily(t, s, e):
                        return None


                    def add_daily_metrics(df):
                        return df


                    def _mold_on_row(rx):
                        return rx["close"] > P["x"]


                    def scan_symbol(sym, start, end):
                        return []


                    if __name__ == "__main__":
                        scan_symbol("A", "2024-01-01", "2024-01-31")
                    """;
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenThrow(new ExtractionException("down"));

            TransformationResult result = pipeline.transform(source, null, WINDOW, false);

            assertThat(result.success()).isTrue();
            assertThat(stages(result)).contains(TransformationPipeline.STAGE_PATTERNS_SKIPPED)
                    .doesNotContain(TransformationPipeline.STAGE_PATTERNS);
            assertThat(result.generatedCode()).contains(DetectionFragment.PLACEHOLDER_COMMENT);
        }

        @Test
        @DisplayName("Validation that never passes → failed result that still carries the last code")
        void validation_never_passes() {
            CodeValidator failing = new CodeValidator(new ValidationProperties()) {
                @Override
                public List<ValidationResult> validate(String code, String primaryClassName) {
                    return List.of(ValidationResult.of(ValidationCategory.STRUCTURE,
                            List.of("Missing required methods: detect_patterns"), List.of()));
                }
            };
            when(extractor.extract(anyString(), any(ClassificationResult.class)))
                    .thenReturn(extraction("breakout_20", Map.of()));

            TransformationResult result = pipelineWith(failing)
                    .transform(Fixtures.load(Fixtures.GENERIC), null, WINDOW, false);

            assertThat(result.success()).isFalse();
            assertThat(result.generatedCode()).contains("class Breakout20Scanner:");
            assertThat(result.errors())
                    .containsExactly("Validation failed after 3 attempt(s). Please review the generated code.");
            assertThat(result.correctionsApplied()).isEqualTo(2);
            assertThat(result.metadata()).containsEntry("attempts", 3);
        }
    }

    // ── Helpers ──

    @Test
    @DisplayName("Fallback names by pattern type")
    void fallback_names() {
        assertThat(TransformationPipeline.fallbackName(PatternType.MULTI, "lc_frontside"))
                .isEqualTo("lc_frontside_Scanner");
        assertThat(TransformationPipeline.fallbackName(PatternType.MULTI, null)).isEqualTo("Multi_Scanner");
        assertThat(TransformationPipeline.fallbackName(PatternType.STANDALONE, " gap ")).isEqualTo("gap_Scanner");
        assertThat(TransformationPipeline.fallbackName(PatternType.STANDALONE, null)).isEqualTo("Standalone_Scanner");
        assertThat(TransformationPipeline.fallbackName(PatternType.GENERIC, "")).isEqualTo("Generic_Scanner");
    }

    @Test
    @DisplayName("Smart filters take numeric parameters by name and default the rest")
    void smart_filters() {
        ParameterSpecification parameters = new ParameterSpecification(Map.of(ParameterCategory.VOLUME, Map.of(
                "min_prev_volume", new ParameterValue(2_000_000L, null, "extractor:primary"),
                "max_prev_volume", new ParameterValue("lots", null, "extractor:primary"))));

        Map<String, Number> filters = TransformationPipeline.smartFilters(parameters);

        assertThat(filters).containsExactly(
                Map.entry("min_prev_close", 0.75),
                Map.entry("max_prev_close", 1000.0),
                Map.entry("min_prev_volume", 2_000_000L),
                Map.entry("max_prev_volume", 100_000_000L));
    }
}
