package com.scanforge.infrastructure.classification;

import com.scanforge.Fixtures;
import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.DataSourceKind;
import com.scanforge.domain.transform.model.PatternType;
import com.scanforge.infrastructure.parsing.SourceParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class StructuralClassifierTest {

    private final StructuralClassifier classifier = new StructuralClassifier();

    // ── Pattern type ──

    @Nested
    @DisplayName("Pattern type")
    class PatternTypes {

        @Test
        @DisplayName("Five detection rules → MULTI with confidence 0.9")
        void multi_pattern_fixture() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.MULTI));

            assertThat(result.patternType()).isEqualTo(PatternType.MULTI);
            assertThat(result.confidence()).isEqualTo(0.9);
            assertThat(result.patternNames()).containsExactly(
                    "d3_pattern", "extreme_volume", "lc_backside_d2", "lc_frontside_d2", "pm_setup");
            assertThat(result.indicator(ClassificationResult.PATTERN_COUNT)).isEqualTo(5);
        }

        @Test
        @DisplayName("Quadruple + P literal + __main__ guard → STANDALONE with confidence 0.95")
        void standalone_fixture() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.STANDALONE));

            assertThat(result.patternType()).isEqualTo(PatternType.STANDALONE);
            assertThat(result.confidence()).isEqualTo(0.95);
            assertThat(result.indicator(ClassificationResult.STANDALONE_MARKERS)).isEqualTo(4);
            assertThat(result.indicator(ClassificationResult.CONFIG_LITERAL)).isEqualTo(1);
            assertThat(result.indicator(ClassificationResult.ENTRY_GUARD)).isEqualTo(1);
            assertThat(result.patternNames()).isEmpty();
        }

        @Test
        @DisplayName("Unrecognized shape → GENERIC with confidence 0.3")
        void generic_fixture() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.GENERIC));

            assertThat(result.patternType()).isEqualTo(PatternType.GENERIC);
            assertThat(result.confidence()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("Multi-pattern rules win over the standalone shape")
        void standalone_with_three_rules_is_multi() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.STANDALONE_MULTI));

            assertThat(result.patternType()).isEqualTo(PatternType.MULTI);
            assertThat(StructuralClassifier.isStandalone(result.indicators())).isTrue();
        }

        @Test
        @DisplayName("Quadruple without the entry guard is not standalone")
        void missing_guard_is_generic() {
            String source = Fixtures.load(Fixtures.STANDALONE);
            String withoutGuard = source.substring(0, source.indexOf("if __name__"));

            ClassificationResult result = classifier.classify(withoutGuard);

            assertThat(result.patternType()).isEqualTo(PatternType.GENERIC);
            assertThat(result.indicator(ClassificationResult.ENTRY_GUARD)).isZero();
        }

        @Test
        @DisplayName("Functions named check_*_d2 count as detection rules")
        void check_functions_count() {
            String source = """
                    def check_d2(df):
                        return True


                    def check_d3(df):
                        return True


                    def check_lc_frontside(df):
                        return False
                    """;

            ClassificationResult result = classifier.classify(source);

            assertThat(result.indicator(ClassificationResult.PATTERN_CHECK_FUNCTIONS)).isEqualTo(3);
            assertThat(result.patternType()).isEqualTo(PatternType.MULTI);
        }
    }

    @Test
    @DisplayName("Rule keywords match regardless of the default locale")
    void locale_independent_keywords() {
        String source = """
                def CHECK_LC_FRONTSIDE(df):
                    return True


                def CHECK_LC_BACKSIDE(df):
                    return True


                def scan(df):
                    df["LC_FRONTSIDE_HIT"] = (df["close"] > df["open"]).astype(int)
                    df["LC_BACKSIDE_HIT"] = (df["close"] < df["open"]).astype(int)
                    df["EXTREME_INSIDE"] = (df["high"] > df["low"]).astype(int)
                    return df
                """;
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ClassificationResult result = classifier.classify(source);

            assertThat(result.indicator(ClassificationResult.PATTERN_CHECK_FUNCTIONS)).isEqualTo(2);
            assertThat(result.patternNames())
                    .containsExactlyInAnyOrder("LC_FRONTSIDE_HIT", "LC_BACKSIDE_HIT", "EXTREME_INSIDE");
            assertThat(result.patternType()).isEqualTo(PatternType.MULTI);
        } finally {
            Locale.setDefault(previous);
        }
    }

    // ── Indicators ──

    @Nested
    @DisplayName("Indicators")
    class Indicators {

        @Test
        @DisplayName("Inventory counts functions, classes and imports")
        void inventory_counts() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.GENERIC));

            assertThat(result.indicators()).contains(
                    entry(ClassificationResult.FUNCTIONS, 2),
                    entry(ClassificationResult.CLASSES, 0),
                    entry(ClassificationResult.IMPORTS, 1));
            assertThat(result.indicator(ClassificationResult.STRING_LITERALS)).isPositive();
            assertThat(result.indicator(ClassificationResult.NUMERIC_LITERALS)).isPositive();
        }

        @Test
        @DisplayName("Classifying the same source twice gives equal results")
        void idempotent() {
            String source = Fixtures.load(Fixtures.MULTI);

            assertThat(classifier.classify(source)).isEqualTo(classifier.classify(source));
        }

        @Test
        @DisplayName("P literal entries keep numbers, None and underscores")
        void config_literal_entries() {
            StructuralAnalysis analysis = classifier.analyze(Fixtures.load(Fixtures.STANDALONE));

            ConfigLiteral literal = analysis.configLiteral().orElseThrow();
            assertThat(literal.line()).isEqualTo(7);
            assertThat(literal.entries())
                    .containsEntry("price_min", 8.0)
                    .containsEntry("adv20_min_usd", 30_000_000L)
                    .containsEntry("gap_div_atr_min", 0.75)
                    .containsEntry("d1_volume_min", null);
        }

        @Test
        @DisplayName("Pattern assignments record frame, enclosing function and condition")
        void pattern_assignments() {
            StructuralAnalysis analysis = classifier.analyze(Fixtures.load(Fixtures.MULTI));

            assertThat(analysis.patternAssignments()).hasSize(5);
            PatternAssignment first = analysis.patternAssignments().get(0);
            assertThat(first.name()).isEqualTo("lc_frontside_d2");
            assertThat(first.frameName()).isEqualTo("df");
            assertThat(first.enclosingFunction()).isEqualTo("detect_all");
            assertThat(first.statement().line()).isEqualTo(14);
        }

        @Test
        @DisplayName("Negative literal values are parsed as numbers")
        void negative_literal() {
            StructuralAnalysis analysis =
                    classifier.analyze("P = {\"floor\": -2, \"ratio\": -0.5, \"window\": (1, 2)}\n");

            assertThat(analysis.configLiteral().orElseThrow().entries())
                    .containsEntry("floor", -2L)
                    .containsEntry("ratio", -0.5)
                    .containsEntry("window", "(1, 2)");
        }
    }

    // ── Data sources ──

    @Nested
    @DisplayName("Data sources")
    class DataSources {

        @Test
        @DisplayName("requests calls and polygon.io URLs → POLYGON_API")
        void polygon() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.STANDALONE));

            assertThat(result.dataSourceFlags().usesPolygon()).isTrue();
            assertThat(result.dataSourceFlags().primarySource()).isEqualTo(DataSourceKind.POLYGON_API);
        }

        @Test
        @DisplayName("read_csv → FILE")
        void file_reader() {
            ClassificationResult result = classifier.classify(Fixtures.load(Fixtures.GENERIC));

            assertThat(result.dataSourceFlags().readsFiles()).isTrue();
            assertThat(result.dataSourceFlags().primarySource()).isEqualTo(DataSourceKind.FILE);
        }

        @Test
        @DisplayName("Literal list of three symbols → HARDCODED")
        void hardcoded_symbols() {
            ClassificationResult result = classifier.classify("SYMBOLS = [\"AAPL\", \"MSFT\", \"NVDA\"]\n");

            assertThat(result.dataSourceFlags().hasHardcodedSymbols()).isTrue();
            assertThat(result.dataSourceFlags().primarySource()).isEqualTo(DataSourceKind.HARDCODED);
        }

        @Test
        @DisplayName("Nothing recognized → UNKNOWN")
        void unknown() {
            assertThat(classifier.classify("x = 1\n").dataSourceFlags().primarySource())
                    .isEqualTo(DataSourceKind.UNKNOWN);
        }
    }

    @Test
    @DisplayName("Syntax error propagates as SourceParseException")
    void broken_source() {
        assertThatThrownBy(() -> classifier.classify(Fixtures.load(Fixtures.BROKEN)))
                .isInstanceOf(SourceParseException.class);
    }
}
