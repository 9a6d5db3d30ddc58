package com.scanforge.infrastructure.rendering;

import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.infrastructure.classification.PatternAssignment;
import com.scanforge.infrastructure.classification.StructuralAnalysis;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import com.scanforge.infrastructure.parsing.ExpressionPrinter;
import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PyWalker;
import com.scanforge.infrastructure.parsing.StringLiterals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Extracts the detection logic of a source scanner as a fragment that runs inside the generated per-ticker
 * method. The fragment sees {@code ticker}, {@code ticker_df} (or {@code df} for pattern rules), {@code i},
 * {@code r0}/{@code r1}/{@code r2}, {@code d0}, {@code P_local} and the {@code all_rows} accumulator.
 */
@Slf4j
@Component
public class DetectionFragmentGenerator {

    public static final String LOCAL_PARAMS = "P_local";

    private static final Set<String> ROW_BINDINGS = Set.of("d0", "r0", "r1", "r2");
    private static final Pattern DETECTOR_NAME = Pattern.compile("^(scan|detect|check|find)_\\w+");
    private static final Pattern FORMAT_PREFIX = Pattern.compile("^[A-Za-z]*[fF][A-Za-z]*['\"].*", Pattern.DOTALL);
    private static final String SCAN_FUNCTION = "scan_symbol";
    private static final String METRICS_FUNCTION = "add_daily_metrics";

    public DetectionFragment generate(StructuralAnalysis analysis, RenderPlan plan,
                                      StrategySpecification specification, PreservedSource preserved) {
        DetectionFragment fragment = switch (plan.extractionRule()) {
            case DETECTION_LOOP -> fromDetectionLoop(analysis, preserved);
            case PATTERN_RULES -> fromPatternRules(analysis);
            case DETECTOR_CALL -> fromDetector(analysis.module(), plan, specification);
        };
        log.debug("[Fragment] rule={}, origin={}, lines={}", plan.extractionRule(), fragment.origin(),
                fragment.lineCount());
        return fragment;
    }

    /**
     * Source functions applied to each ticker frame in the compute stage.
     */
    public List<String> featureFunctions(StructuralAnalysis analysis, RenderPlan plan) {
        PyModule module = analysis.module();
        if (plan.isTemplateOnly()) {
            return List.of();
        }
        if (plan.extractionRule() == ExtractionRule.DETECTION_LOOP) {
            return module.function(METRICS_FUNCTION).map(f -> List.of(f.name())).orElse(List.of());
        }
        String detector = detectorFunction(module).map(PyStmt.FunctionDef::name).orElse(null);
        Set<PyStmt.Assign> ruleStatements = new HashSet<>();
        analysis.patternAssignments().forEach(p -> ruleStatements.add(p.statement()));
        List<String> features = new ArrayList<>();
        for (PyStmt.FunctionDef f : module.functions()) {
            Optional<String> frame = singleRequiredParam(f);
            if (frame.isEmpty() || f.name().equals(detector) || f.name().startsWith("_")) {
                continue;
            }
            boolean assignsColumns = PyWalker.statements(f.body()).stream()
                    .filter(PyStmt.Assign.class::isInstance)
                    .map(PyStmt.Assign.class::cast)
                    .filter(a -> !ruleStatements.contains(a))
                    .anyMatch(a -> a.targets().stream().anyMatch(t -> isColumnOf(t, frame.get())));
            if (assignsColumns) {
                features.add(f.name());
            }
        }
        return features;
    }

    /**
     * Functions the generated skeleton calls with a fixed signature; they keep reading the configuration
     * literal as a module global.
     */
    public Set<String> fixedArityFunctions(StructuralAnalysis analysis, RenderPlan plan) {
        Set<String> fixed = new LinkedHashSet<>(List.of("fetch_daily", METRICS_FUNCTION, SCAN_FUNCTION));
        fixed.addAll(featureFunctions(analysis, plan));
        detectorFunction(analysis.module()).ifPresent(f -> fixed.add(f.name()));
        return fixed;
    }

    /**
     * First top-level {@code scan_* / detect_* / check_* / find_*} function taking exactly one required argument.
     */
    public Optional<PyStmt.FunctionDef> detectorFunction(PyModule module) {
        return module.functions().stream()
                .filter(f -> DETECTOR_NAME.matcher(f.name()).matches())
                .filter(f -> !f.name().equals(SCAN_FUNCTION))
                .filter(f -> singleRequiredParam(f).isPresent())
                .findFirst();
    }

    // ===== DETECTION_LOOP =====

    private DetectionFragment fromDetectionLoop(StructuralAnalysis analysis, PreservedSource preserved) {
        PyModule module = analysis.module();
        PyStmt.FunctionDef scan = module.function(SCAN_FUNCTION)
                .orElseThrow(() -> new RenderException(
                        "No " + SCAN_FUNCTION + " function to take the detection loop from"));

        // 1. Locate the loop and its accumulator
        List<PyStmt.For> loops = PyWalker.statements(scan.body()).stream()
                .filter(PyStmt.For.class::isInstance)
                .map(PyStmt.For.class::cast)
                .toList();
        if (loops.isEmpty()) {
            throw new RenderException("No loop found in " + SCAN_FUNCTION);
        }
        PyStmt.For loop = loops.stream()
                .filter(l -> appendTarget(l.body()).isPresent())
                .findFirst()
                .orElse(loops.get(0));
        String accumulator = appendTarget(loop.body()).orElse(null);

        // 2. Skip the row bindings the skeleton already provides
        List<PyStmt> body = loop.body();
        int first = 0;
        while (first < body.size() && isRowBinding(body.get(first))) {
            first++;
        }
        if (first == body.size()) {
            throw new RenderException("Detection loop in " + SCAN_FUNCTION + " has no statements to preserve");
        }
        int fromLine = body.get(first).line();
        int toLine = body.get(body.size() - 1).endLine();

        // 3. Re-target names to the skeleton's
        Map<String, String> renames = new LinkedHashMap<>();
        firstParam(scan).ifPresent(p -> renames.put(p, "ticker"));
        if (loop.target() instanceof PyExpr.Name n) {
            renames.put(n.id(), "i");
        }
        Optional<String> frame = frameName(scan, loop);
        frame.ifPresent(f -> renames.put(f, "ticker_df"));
        if (accumulator != null) {
            renames.put(accumulator, "all_rows");
        }
        renames.put(StructuralClassifier.CONFIG_LITERAL_NAME, LOCAL_PARAMS);
        renames.entrySet().removeIf(e -> e.getKey().equals(e.getValue()));

        SourceEdits edits = new SourceEdits(module.source());
        TokenRewriter rewriter = new TokenRewriter(module.tokens(), edits);
        rewriter.renameNames(fromLine, toLine, renames);
        rewriter.insertLeadingArgument(fromLine, toLine, Set.copyOf(preserved.rewrittenHelpers()), LOCAL_PARAMS);
        Set<String> seeds = new LinkedHashSet<>(ROW_BINDINGS);
        frame.ifPresent(seeds::add);
        rewriter.lowercaseKeys(fromLine, toLine, FrameNames.derive(seeds, scan.body()));

        int[] offsets = SourceEdits.lineOffsets(module.source());
        int end = toLine + 1 < offsets.length ? offsets[toLine + 1] : module.source().length();
        String code = dedent(edits.apply(offsets[fromLine], end));
        return new DetectionFragment(code, SCAN_FUNCTION + " loop (lines " + fromLine + "-" + toLine + ")",
                false, List.of());
    }

    private static Optional<String> appendTarget(List<PyStmt> body) {
        for (PyStmt stmt : PyWalker.statements(body)) {
            if (stmt instanceof PyStmt.ExprStmt e && e.value() instanceof PyExpr.Call call
                    && call.func() instanceof PyExpr.Attribute attr && attr.attr().equals("append")
                    && attr.value() instanceof PyExpr.Name receiver) {
                return Optional.of(receiver.id());
            }
        }
        return Optional.empty();
    }

    private static boolean isRowBinding(PyStmt stmt) {
        return stmt instanceof PyStmt.Assign a && a.targets().stream().allMatch(DetectionFragmentGenerator::bindsRow);
    }

    private static boolean bindsRow(PyExpr target) {
        if (target instanceof PyExpr.TupleExpr t) {
            return !t.elements().isEmpty() && t.elements().stream().allMatch(DetectionFragmentGenerator::bindsRow);
        }
        return target instanceof PyExpr.Name n && ROW_BINDINGS.contains(n.id());
    }

    /**
     * Frame the loop walks: the result of {@code add_daily_metrics(...)}, else the {@code len(x)} argument of
     * the loop's {@code range(...)}.
     */
    private static Optional<String> frameName(PyStmt.FunctionDef scan, PyStmt.For loop) {
        for (PyStmt stmt : PyWalker.statements(scan.body())) {
            if (stmt instanceof PyStmt.Assign a && a.targets().size() == 1
                    && a.targets().get(0) instanceof PyExpr.Name n
                    && a.value() instanceof PyExpr.Call call && call.func() instanceof PyExpr.Name f
                    && f.id().equals(METRICS_FUNCTION)) {
                return Optional.of(n.id());
            }
        }
        List<String> found = new ArrayList<>();
        PyWalker.walk(loop.iter(), expr -> {
            if (expr instanceof PyExpr.Call call && call.func() instanceof PyExpr.Name f && f.id().equals("len")
                    && call.args().size() == 1 && call.args().get(0) instanceof PyExpr.Name arg) {
                found.add(arg.id());
            }
        });
        return found.stream().findFirst();
    }

    private static Optional<String> firstParam(PyStmt.FunctionDef function) {
        return function.params().stream()
                .filter(p -> p.kind() == PyStmt.ParamKind.REGULAR)
                .map(PyStmt.Param::name)
                .findFirst();
    }

    // ===== PATTERN_RULES =====

    private DetectionFragment fromPatternRules(StructuralAnalysis analysis) {
        Map<String, PatternAssignment> rules = new LinkedHashMap<>();
        for (PatternAssignment rule : analysis.patternAssignments()) {
            rules.putIfAbsent(rule.name().toLowerCase(Locale.ROOT), rule);
        }
        if (rules.isEmpty()) {
            throw new RenderException("No pattern rules found to preserve");
        }
        StringBuilder code = new StringBuilder();
        rules.forEach((column, rule) -> code.append("df[")
                .append(StringLiterals.quote(column))
                .append("] = (")
                .append(ExpressionPrinter.print(rule.condition(), retarget(rule.frameName())))
                .append(").astype(int)\n"));
        return new DetectionFragment(code.toString().stripTrailing(), rules.size() + " pattern rules", false,
                new ArrayList<>(rules.keySet()));
    }

    private static UnaryOperator<PyExpr> retarget(String frame) {
        String config = StructuralClassifier.CONFIG_LITERAL_NAME;
        return expr -> {
            if (expr instanceof PyExpr.Name n) {
                if (n.id().equals(frame)) {
                    return new PyExpr.Name("df");
                }
                if (n.id().equals(config)) {
                    return new PyExpr.Name(LOCAL_PARAMS);
                }
            }
            if (expr instanceof PyExpr.Subscript s && s.index() instanceof PyExpr.Constant key && key.isString()
                    && !FORMAT_PREFIX.matcher(key.text()).matches()
                    && FrameNames.rootedAt(s.value(), Set.of(frame))) {
                String lowered = key.stringValue().toLowerCase(Locale.ROOT);
                return new PyExpr.Subscript(s.value(),
                        new PyExpr.Constant(PyExpr.Constant.Kind.STRING, StringLiterals.quote(lowered)));
            }
            return expr;
        };
    }

    // ===== DETECTOR_CALL =====

    private DetectionFragment fromDetector(PyModule module, RenderPlan plan, StrategySpecification specification) {
        Optional<PyStmt.FunctionDef> detector = plan.isTemplateOnly() ? Optional.empty() : detectorFunction(module);
        if (detector.isEmpty()) {
            return DetectionFragment.placeholder("no recognized detector function",
                    specification.entryConditions().stream().map(c -> "Entry condition: " + c).toList());
        }
        String name = detector.get().name();
        String code = String.join("\n",
                "detected = " + name + "(ticker_df.copy())",
                "if isinstance(detected, pd.DataFrame):",
                "    detected = detected.to_dict(\"records\")",
                "for row in detected or []:",
                "    row = dict(row)",
                "    row_date = pd.to_datetime(row.get(\"date\", row.get(\"Date\")))",
                "    if pd.isna(row_date) or not (d0_start_dt <= row_date <= d0_end_dt):",
                "        continue",
                "    row[\"ticker\"] = ticker",
                "    all_rows.append(row)");
        return new DetectionFragment(code, "call to " + name, false, List.of());
    }

    // ===== helpers =====

    private static Optional<String> singleRequiredParam(PyStmt.FunctionDef function) {
        List<PyStmt.Param> required = function.params().stream()
                .filter(p -> p.kind() == PyStmt.ParamKind.REGULAR && p.defaultValue() == null)
                .toList();
        return required.size() == 1 ? Optional.of(required.get(0).name()) : Optional.empty();
    }

    private static boolean isColumnOf(PyExpr target, String frame) {
        return target instanceof PyExpr.Subscript s && s.value() instanceof PyExpr.Name n && n.id().equals(frame)
                && s.index() instanceof PyExpr.Constant key && key.isString();
    }

    static String dedent(String block) {
        List<String> lines = block.lines().toList();
        int indent = lines.stream()
                .filter(l -> !l.isBlank())
                .mapToInt(l -> l.length() - l.stripLeading().length())
                .min()
                .orElse(0);
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append(line.isBlank() ? "" : line.substring(Math.min(indent, line.length()))).append('\n');
        }
        return out.toString().stripTrailing();
    }
}
