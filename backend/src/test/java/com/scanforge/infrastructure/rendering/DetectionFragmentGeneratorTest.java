package com.scanforge.infrastructure.rendering;

import com.scanforge.Fixtures;
import com.scanforge.domain.transform.model.GenerationStrategy;
import com.scanforge.domain.transform.model.ParameterSpecification;
import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.infrastructure.classification.StructuralAnalysis;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionFragmentGeneratorTest {

    private final StructuralClassifier classifier = new StructuralClassifier();
    private final SourcePreserver preserver = new SourcePreserver();
    private final DetectionFragmentGenerator generator = new DetectionFragmentGenerator();
    private final StrategySpecification specification =
            StrategySpecification.minimal("Test_Scanner", ParameterSpecification.empty());

    private DetectionFragment generate(String source, GenerationStrategy strategy) {
        StructuralAnalysis analysis = classifier.analyze(source);
        RenderPlan plan = RenderPlan.forStrategy(strategy, true);
        PreservedSource preserved = preserver.preserve(analysis, generator.fixedArityFunctions(analysis, plan));
        return generator.generate(analysis, plan, specification, preserved);
    }

    // ── Detection loop ──

    @Nested
    @DisplayName("Detection loop")
    class DetectionLoop {

        @Test
        @DisplayName("Loop body after the row bindings is re-targeted to the skeleton's names")
        void standalone_loop() {
            DetectionFragment fragment =
                    generate(Fixtures.load(Fixtures.STANDALONE), GenerationStrategy.HYBRID_PRESERVE);

            assertThat(fragment.placeholder()).isFalse();
            assertThat(fragment.origin()).isEqualTo("scan_symbol loop (lines 49-53)");
            assertThat(fragment.code()).isEqualTo(String.join("\n",
                    "if not _mold_on_row(P_local, r1):",
                    "    continue",
                    "if not gap_ok(P_local, r0, r1):",
                    "    continue",
                    "all_rows.append({\"Ticker\": ticker, \"Date\": d0, \"Gap\": r0[\"open\"] - r1[\"close\"]})"));
        }

        @Test
        @DisplayName("Loop over len(frame) without add_daily_metrics binds the frame from range()")
        void frame_from_range() {
            String source = """
                    def scan_symbol(sym, bars):
                        hits = []
                        for k in range(len(bars)):
                            if bars.iloc[k]["Close"] > 10:
                                hits.append(sym)
                        return hits
                    """;

            DetectionFragment fragment = generate(source, GenerationStrategy.HYBRID_PRESERVE);

            assertThat(fragment.code()).isEqualTo(String.join("\n",
                    "if ticker_df.iloc[i][\"close\"] > 10:",
                    "    all_rows.append(ticker)"));
        }

        @Test
        @DisplayName("Keys on rows derived from the frame are lowercased, other lookups keep their case")
        void non_frame_keys_untouched() {
            String source = """
                    import os

                    LIMITS = {"Max": 5}


                    def scan_symbol(sym, start, end):
                        m = add_daily_metrics(fetch_daily(sym, start, end))
                        rows = []
                        for i in range(2, len(m)):
                            r0 = m.iloc[i]
                            bar = m.iloc[i - 1]
                            if bar["Close"] > LIMITS["Max"] and os.environ.get("MODE") == "Live":
                                rows.append({"Ticker": sym, "Open": r0["Open"]})
                        return rows
                    """;

            DetectionFragment fragment = generate(source, GenerationStrategy.HYBRID_PRESERVE);

            assertThat(fragment.code()).isEqualTo(String.join("\n",
                    "bar = ticker_df.iloc[i - 1]",
                    "if bar[\"close\"] > LIMITS[\"Max\"] and os.environ.get(\"MODE\") == \"Live\":",
                    "    all_rows.append({\"Ticker\": ticker, \"Open\": r0[\"open\"]})"));
        }

        @Test
        @DisplayName("No scan_symbol → RenderException")
        void missing_scan_function() {
            assertThatThrownBy(() -> generate("def other(x):\n    return x\n", GenerationStrategy.HYBRID_PRESERVE))
                    .isInstanceOf(RenderException.class)
                    .hasMessageContaining("scan_symbol");
        }

        @Test
        @DisplayName("Loop with nothing but row bindings → RenderException")
        void only_row_bindings() {
            String source = """
                    def scan_symbol(sym, m):
                        for i in range(len(m)):
                            r0 = m.iloc[i]
                    """;

            assertThatThrownBy(() -> generate(source, GenerationStrategy.HYBRID_PRESERVE))
                    .isInstanceOf(RenderException.class)
                    .hasMessageContaining("no statements to preserve");
        }

        @Test
        @DisplayName("Feature functions are add_daily_metrics only")
        void feature_functions() {
            StructuralAnalysis analysis = classifier.analyze(Fixtures.load(Fixtures.STANDALONE));
            RenderPlan plan = RenderPlan.forStrategy(GenerationStrategy.HYBRID_PRESERVE, true);

            assertThat(generator.featureFunctions(analysis, plan)).containsExactly("add_daily_metrics");
            assertThat(generator.fixedArityFunctions(analysis, plan))
                    .containsExactly("fetch_daily", "add_daily_metrics", "scan_symbol");
        }
    }

    // ── Pattern rules ──

    @Nested
    @DisplayName("Pattern rules")
    class PatternRules {

        @Test
        @DisplayName("One lowercase column per rule, conditions re-targeted to df and P_local")
        void multi_rules() {
            DetectionFragment fragment = generate(Fixtures.load(Fixtures.MULTI),
                    GenerationStrategy.HYBRID_PRESERVE_MULTI);

            assertThat(fragment.patternNames()).containsExactly(
                    "lc_frontside_d2", "lc_backside_d2", "d3_pattern", "pm_setup", "extreme_volume");
            assertThat(fragment.code().lines()).hasSize(5).allMatch(l -> l.endsWith(".astype(int)"));
            assertThat(fragment.code())
                    .startsWith("df[\"lc_frontside_d2\"] = (")
                    .contains("df[\"lc_backside_d2\"] = (df[\"close\"] < df[\"ema9\"]).astype(int)")
                    .contains("P_local[\"gap_min\"]")
                    .contains("P_local[\"vol_mult\"]")
                    .doesNotContain("\"Close\"");
        }

        @Test
        @DisplayName("Feature function and detector are recognized")
        void multi_feature_functions() {
            StructuralAnalysis analysis = classifier.analyze(Fixtures.load(Fixtures.MULTI));
            RenderPlan plan = RenderPlan.forStrategy(GenerationStrategy.HYBRID_PRESERVE_MULTI, true);

            assertThat(generator.featureFunctions(analysis, plan)).containsExactly("add_indicators");
            assertThat(generator.detectorFunction(analysis.module()))
                    .hasValueSatisfying(f -> assertThat(f.name()).isEqualTo("detect_all"));
        }

        @Test
        @DisplayName("Rules assigned to another frame name are re-targeted to df")
        void other_frame_name() {
            String source = """
                    def rules(bars):
                        bars["D2_up"] = (bars["Close"] > bars["Open"]).astype(int)
                    """;

            DetectionFragment fragment = generate(source, GenerationStrategy.HYBRID_PRESERVE_MULTI);

            assertThat(fragment.code()).isEqualTo("df[\"d2_up\"] = (df[\"close\"] > df[\"open\"]).astype(int)");
        }

        @Test
        @DisplayName("Lookups on module-level mappings inside a rule keep their keys")
        void rule_mapping_keys_untouched() {
            String source = """
                    LEVELS = {"Gap": 0.5}


                    def rules(bars):
                        bars["D2_up"] = (bars["Close"] - bars["Open"] > LEVELS["Gap"]).astype(int)
                    """;

            DetectionFragment fragment = generate(source, GenerationStrategy.HYBRID_PRESERVE_MULTI);

            assertThat(fragment.code())
                    .isEqualTo("df[\"d2_up\"] = ((df[\"close\"] - df[\"open\"]) > LEVELS[\"Gap\"]).astype(int)");
        }

        @Test
        @DisplayName("No rules → RenderException")
        void no_rules() {
            assertThatThrownBy(() -> generate("x = 1\n", GenerationStrategy.HYBRID_PRESERVE_MULTI))
                    .isInstanceOf(RenderException.class);
        }
    }

    // ── Detector call ──

    @Nested
    @DisplayName("Detector call")
    class DetectorCall {

        @Test
        @DisplayName("Recognized detector is called with the ticker frame")
        void generic_detector() {
            DetectionFragment fragment = generate(Fixtures.load(Fixtures.GENERIC),
                    GenerationStrategy.GENERIC_PRESERVE);

            assertThat(fragment.origin()).isEqualTo("call to find_breakouts");
            assertThat(fragment.code()).startsWith("detected = find_breakouts(ticker_df.copy())")
                    .contains("all_rows.append(row)");
        }

        @Test
        @DisplayName("No detector → placeholder carrying the entry conditions as comments")
        void placeholder() {
            StructuralAnalysis analysis = classifier.analyze("def load(path):\n    return path\n");
            RenderPlan plan = RenderPlan.forStrategy(GenerationStrategy.GENERIC_PRESERVE, true);
            StrategySpecification withConditions = new StrategySpecification("S", "d", null,
                    List.of("gap up\nover ATR"), null, null, "daily", "", "scanner");

            DetectionFragment fragment = generator.generate(analysis, plan, withConditions, null);

            assertThat(fragment.placeholder()).isTrue();
            assertThat(fragment.code()).isEqualTo(String.join("\n",
                    DetectionFragment.PLACEHOLDER_COMMENT,
                    "# Entry condition: gap up over ATR",
                    "pass"));
        }
    }

    @Test
    @DisplayName("dedent strips the common indentation and keeps blank lines empty")
    void dedent() {
        assertThat(DetectionFragmentGenerator.dedent("        a\n\n            b\n")).isEqualTo("a\n\n    b");
    }
}
