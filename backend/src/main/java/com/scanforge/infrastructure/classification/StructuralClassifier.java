package com.scanforge.infrastructure.classification;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.DataSourceFlags;
import com.scanforge.domain.transform.model.PatternType;
import com.scanforge.infrastructure.parsing.ExpressionPrinter;
import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PyWalker;
import com.scanforge.infrastructure.parsing.PythonParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses a scanner script and fingerprints its shape.
 * <p>
 * Multi: 3+ independent detection rules. Standalone: the {@code fetch_daily / add_daily_metrics / scan_symbol /
 * _mold_on_row} quadruple plus a {@code P = {...}} literal plus a {@code __main__} guard. Anything else is
 * Generic. Parse failures propagate as {@link com.scanforge.infrastructure.parsing.SourceParseException}.
 * </p>
 */
@Slf4j
@Component
public class StructuralClassifier {

    public static final List<String> STANDALONE_FUNCTIONS =
            List.of("fetch_daily", "add_daily_metrics", "scan_symbol", "_mold_on_row");

    public static final String CONFIG_LITERAL_NAME = "P";

    private static final List<String> PATTERN_KEYWORDS = List.of(
            "pattern", "d2", "d3", "d4", "lc_frontside", "lc_backside", "pm_setup", "pmh_break", "extreme"
    );

    private static final List<String> CHECK_FUNCTION_KEYWORDS = List.of(
            "d2", "d3", "d4", "pattern", "lc_frontside", "lc_backside"
    );

    private static final Set<String> FILE_READERS = Set.of(
            "read_csv", "read_parquet", "read_excel", "read_json", "read_feather", "read_pickle"
    );

    private static final double MULTI_CONFIDENCE = 0.9;
    private static final double STANDALONE_CONFIDENCE = 0.95;
    private static final double GENERIC_CONFIDENCE = 0.3;
    private static final int MULTI_THRESHOLD = 3;

    private final PythonParser parser = new PythonParser();

    public ClassificationResult classify(String source) {
        return analyze(source).classification();
    }

    public StructuralAnalysis analyze(String source) {
        PyModule module = parser.parse(source);

        List<PatternAssignment> patterns = findPatternAssignments(module);
        List<String> checkFunctions = PyWalker.statements(module.body()).stream()
                .filter(PyStmt.FunctionDef.class::isInstance)
                .map(s -> ((PyStmt.FunctionDef) s).name())
                .filter(StructuralClassifier::isPatternCheckFunction)
                .toList();
        Set<String> patternNames = new TreeSet<>();
        patterns.forEach(p -> patternNames.add(p.name()));

        Optional<ConfigLiteral> config = findConfigLiteral(module);
        Optional<PyStmt.If> guard = findEntryGuard(module);
        int standaloneMarkers = (int) STANDALONE_FUNCTIONS.stream()
                .filter(name -> module.function(name).isPresent())
                .count();

        Map<String, Integer> indicators = new HashMap<>();
        countInventory(module, indicators);
        indicators.put(ClassificationResult.PATTERN_ASSIGNMENTS, patterns.size());
        indicators.put(ClassificationResult.PATTERN_CHECK_FUNCTIONS, checkFunctions.size());
        indicators.put(ClassificationResult.PATTERN_COUNT, patternNames.size() + checkFunctions.size());
        indicators.put(ClassificationResult.STANDALONE_MARKERS, standaloneMarkers);
        indicators.put(ClassificationResult.CONFIG_LITERAL, config.isPresent() ? 1 : 0);
        indicators.put(ClassificationResult.ENTRY_GUARD, guard.isPresent() ? 1 : 0);

        PatternType type;
        double confidence;
        if (patternNames.size() + checkFunctions.size() >= MULTI_THRESHOLD) {
            type = PatternType.MULTI;
            confidence = MULTI_CONFIDENCE;
        } else if (isStandalone(indicators)) {
            type = PatternType.STANDALONE;
            confidence = STANDALONE_CONFIDENCE;
        } else {
            type = PatternType.GENERIC;
            confidence = GENERIC_CONFIDENCE;
        }

        ClassificationResult result = new ClassificationResult(
                type, confidence, indicators, detectDataSources(module), List.copyOf(patternNames));
        log.debug("[Classifier] type={}, confidence={}, indicators={}", type, confidence, result.indicators());
        return new StructuralAnalysis(module, result, config, patterns, guard);
    }

    /**
     * True when the standalone quadruple, the configuration literal and the entry guard are all present.
     */
    public static boolean isStandalone(Map<String, Integer> indicators) {
        return indicators.getOrDefault(ClassificationResult.STANDALONE_MARKERS, 0) == STANDALONE_FUNCTIONS.size()
                && indicators.getOrDefault(ClassificationResult.CONFIG_LITERAL, 0) > 0
                && indicators.getOrDefault(ClassificationResult.ENTRY_GUARD, 0) > 0;
    }

    // ===== Detection rules =====

    private List<PatternAssignment> findPatternAssignments(PyModule module) {
        List<PatternAssignment> found = new ArrayList<>();
        for (PyStmt stmt : module.body()) {
            String function = stmt instanceof PyStmt.FunctionDef f ? f.name() : null;
            for (PyStmt nested : PyWalker.statements(List.of(stmt))) {
                if (nested instanceof PyStmt.Assign assign) {
                    toPatternAssignment(assign, function).ifPresent(found::add);
                }
            }
        }
        return found;
    }

    private Optional<PatternAssignment> toPatternAssignment(PyStmt.Assign assign, String function) {
        if (assign.targets().size() != 1 || !(assign.targets().get(0) instanceof PyExpr.Subscript target)) {
            return Optional.empty();
        }
        if (!(target.index() instanceof PyExpr.Constant key) || !key.isString()) {
            return Optional.empty();
        }
        String name = key.stringValue();
        String lower = name.toLowerCase(Locale.ROOT);
        if (PATTERN_KEYWORDS.stream().noneMatch(lower::contains)) {
            return Optional.empty();
        }
        Optional<PyExpr> condition = booleanCondition(assign.value());
        if (condition.isEmpty()) {
            return Optional.empty();
        }
        String frame = target.value() instanceof PyExpr.Name n ? n.id() : null;
        return Optional.of(new PatternAssignment(name, frame, condition.get(), assign, function));
    }

    /**
     * The boolean construct a rule assigns: the receiver of {@code .astype(...)}, a comparison, a boolean or
     * bitwise conjunction, or a negation.
     */
    private static Optional<PyExpr> booleanCondition(PyExpr value) {
        if (value instanceof PyExpr.Call call && call.func() instanceof PyExpr.Attribute attr
                && attr.attr().equals("astype")) {
            return Optional.of(attr.value());
        }
        if (value instanceof PyExpr.Compare || value instanceof PyExpr.BoolOp) {
            return Optional.of(value);
        }
        if (value instanceof PyExpr.UnaryOp unary && (unary.op().equals("not") || unary.op().equals("~"))) {
            return Optional.of(value);
        }
        if (value instanceof PyExpr.BinOp bin && (bin.op().equals("&") || bin.op().equals("|"))) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    private static boolean isPatternCheckFunction(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("check") && CHECK_FUNCTION_KEYWORDS.stream().anyMatch(lower::contains);
    }

    // ===== Configuration literal / entry guard =====

    private Optional<ConfigLiteral> findConfigLiteral(PyModule module) {
        for (PyStmt stmt : module.body()) {
            if (stmt instanceof PyStmt.Assign assign && assign.targets().size() == 1
                    && assign.targets().get(0) instanceof PyExpr.Name name
                    && name.id().equals(CONFIG_LITERAL_NAME)
                    && assign.value() instanceof PyExpr.DictExpr dict) {
                return Optional.of(new ConfigLiteral(name.id(), assign, literalEntries(dict)));
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> literalEntries(PyExpr.DictExpr dict) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (int i = 0; i < dict.keys().size(); i++) {
            PyExpr key = dict.keys().get(i);
            if (key instanceof PyExpr.Constant constant && constant.isString()) {
                entries.put(constant.stringValue(), literalValue(dict.values().get(i)));
            }
        }
        return entries;
    }

    /**
     * Java value of a literal: Long/Double for numbers, Boolean, String, null for None, source text otherwise.
     */
    static Object literalValue(PyExpr expr) {
        if (expr instanceof PyExpr.UnaryOp unary && unary.op().equals("-")
                && unary.operand() instanceof PyExpr.Constant c && c.kind() == PyExpr.Constant.Kind.NUMBER) {
            Object value = parseNumber(c.text());
            if (value instanceof Long l) {
                return -l;
            }
            if (value instanceof Double d) {
                return -d;
            }
            return ExpressionPrinter.print(expr);
        }
        if (expr instanceof PyExpr.Constant c) {
            return switch (c.kind()) {
                case NUMBER -> parseNumber(c.text());
                case STRING -> c.stringValue();
                case TRUE -> Boolean.TRUE;
                case FALSE -> Boolean.FALSE;
                case NONE -> null;
                case ELLIPSIS -> "...";
            };
        }
        return ExpressionPrinter.print(expr);
    }

    private static Object parseNumber(String text) {
        String clean = text.replace("_", "");
        try {
            if (clean.matches("\\d+")) {
                return Long.parseLong(clean);
            }
            if (clean.matches("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
                return new BigDecimal(clean).doubleValue();
            }
        } catch (NumberFormatException e) {
            log.debug("[Classifier] keeping numeric literal '{}' as text: {}", text, e.getMessage());
        }
        return text;
    }

    private Optional<PyStmt.If> findEntryGuard(PyModule module) {
        return module.body().stream()
                .filter(PyStmt.If.class::isInstance)
                .map(PyStmt.If.class::cast)
                .filter(StructuralClassifier::isEntryGuard)
                .findFirst();
    }

    public static boolean isEntryGuard(PyStmt.If stmt) {
        if (!(stmt.test() instanceof PyExpr.Compare compare) || compare.ops().size() != 1
                || !compare.ops().get(0).equals("==")) {
            return false;
        }
        PyExpr left = compare.left();
        PyExpr right = compare.comparators().get(0);
        return (isDunderName(left) && isMainLiteral(right)) || (isDunderName(right) && isMainLiteral(left));
    }

    private static boolean isDunderName(PyExpr expr) {
        return expr instanceof PyExpr.Name n && n.id().equals("__name__");
    }

    private static boolean isMainLiteral(PyExpr expr) {
        return expr instanceof PyExpr.Constant c && c.isString() && "__main__".equals(c.stringValue());
    }

    // ===== Inventory / data sources =====

    private void countInventory(PyModule module, Map<String, Integer> indicators) {
        int functions = 0;
        int classes = 0;
        int imports = 0;
        for (PyStmt stmt : PyWalker.statements(module.body())) {
            if (stmt instanceof PyStmt.FunctionDef) {
                functions++;
            } else if (stmt instanceof PyStmt.ClassDef) {
                classes++;
            } else if (stmt instanceof PyStmt.Import || stmt instanceof PyStmt.ImportFrom) {
                imports++;
            }
        }
        int[] literals = new int[2];
        PyWalker.forEachExpression(module.body(), expr -> {
            if (expr instanceof PyExpr.Constant c) {
                if (c.kind() == PyExpr.Constant.Kind.NUMBER) {
                    literals[0]++;
                } else if (c.isString()) {
                    literals[1]++;
                }
            }
        });
        indicators.put(ClassificationResult.FUNCTIONS, functions);
        indicators.put(ClassificationResult.CLASSES, classes);
        indicators.put(ClassificationResult.IMPORTS, imports);
        indicators.put(ClassificationResult.NUMERIC_LITERALS, literals[0]);
        indicators.put(ClassificationResult.STRING_LITERALS, literals[1]);
    }

    private DataSourceFlags detectDataSources(PyModule module) {
        boolean[] flags = new boolean[3];
        PyWalker.forEachExpression(module.body(), expr -> {
            if (expr instanceof PyExpr.Constant c && c.isString() && c.text().contains("polygon.io")) {
                flags[0] = true;
            } else if (expr instanceof PyExpr.Call call) {
                if (call.func() instanceof PyExpr.Attribute attr && attr.value() instanceof PyExpr.Name receiver
                        && receiver.id().equals("requests")) {
                    flags[0] = true;
                }
                if (call.func() instanceof PyExpr.Name n && n.id().equals("open")) {
                    flags[1] = true;
                }
                if (call.func() instanceof PyExpr.Attribute attr && FILE_READERS.contains(attr.attr())) {
                    flags[1] = true;
                }
            } else if (expr instanceof PyExpr.ListExpr list && list.elements().size() >= 3
                    && list.elements().stream().allMatch(e -> e instanceof PyExpr.Constant c && c.isString())) {
                flags[2] = true;
            }
        });
        return DataSourceFlags.of(flags[0], flags[1], flags[2]);
    }
}
