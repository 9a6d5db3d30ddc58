package com.scanforge.infrastructure.rendering;

import com.scanforge.Fixtures;
import com.scanforge.infrastructure.classification.StructuralAnalysis;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import com.scanforge.infrastructure.parsing.PythonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SourcePreserverTest {

    private static final Set<String> FIXED = Set.of("fetch_daily", "add_daily_metrics", "scan_symbol");

    private final StructuralClassifier classifier = new StructuralClassifier();
    private final SourcePreserver preserver = new SourcePreserver();

    private PreservedSource preserve(String source, Set<String> fixed) {
        StructuralAnalysis analysis = classifier.analyze(source);
        return preserver.preserve(analysis, fixed);
    }

    @Test
    @DisplayName("Helpers reading P take params first and read lowercase columns")
    void helpers_rewritten() {
        PreservedSource preserved = preserve(Fixtures.load(Fixtures.STANDALONE), FIXED);

        assertThat(preserved.rewrittenHelpers()).containsExactly("gap_ok", "_mold_on_row");
        assertThat(preserved.code())
                .contains("def gap_ok(params, r0, r1):")
                .contains("return (r0[\"open\"] - r1[\"close\"]) / r1[\"atr\"] >= params[\"gap_div_atr_min\"]")
                .contains("def _mold_on_row(params, rx):")
                .contains("if rx[\"close\"] < params[\"price_min\"]:")
                .contains("return rx[\"adv20_usd\"] >= params[\"adv20_min_usd\"]");
    }

    @Test
    @DisplayName("Only row lookups are lowercased; environment and module dict keys keep their case")
    void non_row_keys_untouched() {
        String source = """
                import os

                P = {"price_min": 5.0}
                TIERS = {"Tier1": 1.0}


                def _mold_on_row(rx):
                    key = os.environ["POLYGON_KEY"]
                    region = os.environ.get("REGION", "US")
                    row = rx.copy()
                    if row["High"] <= 0:
                        return False
                    return rx["Close"] < P["price_min"] + TIERS["Tier1"] and rx.get("Volume") > 0
                """;

        PreservedSource preserved = preserve(source, FIXED);

        assertThat(preserved.rewrittenHelpers()).containsExactly("_mold_on_row");
        assertThat(preserved.code())
                .contains("key = os.environ[\"POLYGON_KEY\"]")
                .contains("region = os.environ.get(\"REGION\", \"US\")")
                .contains("if row[\"high\"] <= 0:")
                .contains("return rx[\"close\"] < params[\"price_min\"] + TIERS[\"Tier1\"] and rx.get(\"volume\") > 0")
                .contains("TIERS = {\"Tier1\": 1.0}");
    }

    @Test
    @DisplayName("Call sites outside helpers pass the module-level P")
    void call_sites_pass_config() {
        PreservedSource preserved = preserve(Fixtures.load(Fixtures.STANDALONE), FIXED);

        assertThat(preserved.code())
                .contains("if not _mold_on_row(P, r1):")
                .contains("if not gap_ok(P, r0, r1):")
                .contains("m[\"EMA_9\"] = m[\"Close\"]");
    }

    @Test
    @DisplayName("Entry guard is dropped and the rest still parses")
    void entry_guard_removed() {
        PreservedSource preserved = preserve(Fixtures.load(Fixtures.STANDALONE), FIXED);

        assertThat(preserved.code()).doesNotContain("__main__").endsWith("return pd.DataFrame(rows)\n");
        assertThatCode(() -> new PythonParser().parse(preserved.code())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Import names and insert line are reported")
    void imports_reported() {
        PreservedSource preserved = preserve(Fixtures.load(Fixtures.STANDALONE), FIXED);

        assertThat(preserved.boundImportNames()).containsExactlyInAnyOrder("pd", "np", "requests");
        assertThat(preserved.importInsertLine()).isZero();
    }

    @Test
    @DisplayName("Imports go after __future__ imports")
    void future_imports() {
        PreservedSource preserved = preserve("from __future__ import annotations\nimport os\n\nx = 1\n", Set.of());

        assertThat(preserved.importInsertLine()).isEqualTo(1);
    }

    @Test
    @DisplayName("Helpers called only through another helper are rewritten transitively")
    void transitive_helpers() {
        String source = """
                P = {"limit": 3}


                def base(x):
                    return x > P["limit"]


                def wrapper(x):
                    return base(x)


                def untouched(x, P):
                    return P
                """;

        PreservedSource preserved = preserve(source, Set.of());

        assertThat(preserved.rewrittenHelpers()).containsExactly("base", "wrapper");
        assertThat(preserved.code())
                .contains("def wrapper(params, x):")
                .contains("return base(params, x)")
                .contains("def untouched(x, P):");
    }

    @Test
    @DisplayName("Without a config literal nothing is rewritten")
    void no_config_literal() {
        String source = Fixtures.load(Fixtures.GENERIC);

        PreservedSource preserved = preserve(source, Set.of());

        assertThat(preserved.rewrittenHelpers()).isEmpty();
        String beforeGuard = source.substring(0, source.indexOf("if __name__")).stripTrailing();

        assertThat(preserved.code()).isEqualTo(beforeGuard + "\n");
    }
}
