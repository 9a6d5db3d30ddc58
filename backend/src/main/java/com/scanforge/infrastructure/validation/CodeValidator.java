package com.scanforge.infrastructure.validation;

import com.scanforge.domain.transform.model.ValidationCategory;
import com.scanforge.domain.transform.model.ValidationResult;
import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PyWalker;
import com.scanforge.infrastructure.parsing.PythonParser;
import com.scanforge.infrastructure.parsing.SourceParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static checks on generated code, one {@link ValidationResult} per category.
 * A syntax failure ends validation; the other categories are not reported for that code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeValidator {

    public static final List<String> REQUIRED_METHODS =
            List.of("fetch_grouped_data", "apply_smart_filters", "compute_full_features", "detect_patterns");
    public static final List<String> RECOMMENDED_METHODS = List.of("format_results", "run_scan");

    public static final String NO_SCANNER_CLASS = "No scanner class found";
    public static final String HISTORICAL_NOT_RECOMBINED = "Historical rows are not recombined in apply_smart_filters";
    public static final String MISSING_METHODS_PREFIX = "Missing required methods: ";
    public static final String MISSING_IMPORTS_PREFIX = "Missing required imports: ";
    public static final String SYNTAX_ERROR_PREFIX = "Syntax error at line ";

    private static final int MIN_KEY_LENGTH = 16;

    private final ValidationProperties properties;
    private final PythonParser parser = new PythonParser();

    /**
     * @param code             generated module
     * @param primaryClassName expected scanner class; the last top-level class is used when absent
     */
    public List<ValidationResult> validate(String code, String primaryClassName) {
        PyModule module;
        try {
            module = parser.parse(code);
        } catch (SourceParseException e) {
            log.debug("[Validator] syntax error: {}", e.describe());
            return List.of(ValidationResult.of(ValidationCategory.SYNTAX,
                    List.of(syntaxError(e.getLine(), e.getMessage())), List.of()));
        }
        List<String> compileErrors = new ArrayList<>();
        checkContext(module.body(), false, false, compileErrors);
        if (!compileErrors.isEmpty()) {
            return List.of(ValidationResult.of(ValidationCategory.SYNTAX, compileErrors, List.of()));
        }

        List<ValidationResult> results = List.of(
                ValidationResult.of(ValidationCategory.SYNTAX, List.of(), List.of()),
                checkStructure(module, primaryClassName),
                checkImports(module),
                checkStyle(module)
        );
        log.debug("[Validator] errors={}, warnings={}",
                results.stream().mapToInt(r -> r.errors().size()).sum(),
                results.stream().mapToInt(r -> r.warnings().size()).sum());
        return results;
    }

    /**
     * True when every blocking category passed.
     */
    public static boolean isValid(List<ValidationResult> results) {
        return results.stream()
                .filter(r -> r.category().isBlocking())
                .allMatch(ValidationResult::valid);
    }

    public static String syntaxError(int line, String message) {
        return SYNTAX_ERROR_PREFIX + line + ": " + message;
    }

    // ===== Syntax: statements only legal in some contexts =====

    private void checkContext(List<PyStmt> body, boolean inFunction, boolean inLoop, List<String> errors) {
        for (PyStmt stmt : body) {
            if (stmt instanceof PyStmt.Return && !inFunction) {
                errors.add(syntaxError(stmt.line(), "'return' outside function"));
            } else if (stmt instanceof PyStmt.Keyword k && !inLoop) {
                if (k.keyword().equals("break")) {
                    errors.add(syntaxError(stmt.line(), "'break' outside loop"));
                } else if (k.keyword().equals("continue")) {
                    errors.add(syntaxError(stmt.line(), "'continue' not properly in loop"));
                }
            }
            if (!inFunction && !(stmt instanceof PyStmt.FunctionDef) && containsYield(stmt)) {
                errors.add(syntaxError(stmt.line(), "'yield' outside function"));
            }

            if (stmt instanceof PyStmt.FunctionDef f) {
                checkContext(f.body(), true, false, errors);
            } else if (stmt instanceof PyStmt.ClassDef c) {
                checkContext(c.body(), false, false, errors);
            } else if (stmt instanceof PyStmt.For f) {
                checkContext(f.body(), inFunction, true, errors);
                checkContext(f.orElse(), inFunction, inLoop, errors);
            } else if (stmt instanceof PyStmt.While w) {
                checkContext(w.body(), inFunction, true, errors);
                checkContext(w.orElse(), inFunction, inLoop, errors);
            } else {
                for (List<PyStmt> block : PyWalker.childBlocks(stmt)) {
                    checkContext(block, inFunction, inLoop, errors);
                }
            }
        }
    }

    private static boolean containsYield(PyStmt stmt) {
        boolean[] found = {false};
        for (PyExpr expr : PyWalker.ownExpressions(stmt)) {
            PyWalker.walk(expr, e -> {
                if (e instanceof PyExpr.Yield) {
                    found[0] = true;
                }
            });
        }
        return found[0];
    }

    // ===== Structure =====

    private ValidationResult checkStructure(PyModule module, String primaryClassName) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Optional<PyStmt.ClassDef> scanner = findScannerClass(module, primaryClassName);
        if (scanner.isEmpty()) {
            errors.add(NO_SCANNER_CLASS);
            return ValidationResult.of(ValidationCategory.STRUCTURE, errors, warnings);
        }
        PyStmt.ClassDef cls = scanner.get();
        Set<String> methods = new LinkedHashSet<>();
        cls.methods().forEach(m -> methods.add(m.name()));

        List<String> missing = REQUIRED_METHODS.stream().filter(m -> !methods.contains(m)).toList();
        if (!missing.isEmpty()) {
            errors.add(MISSING_METHODS_PREFIX + String.join(", ", missing));
        }
        List<String> missingRecommended = RECOMMENDED_METHODS.stream().filter(m -> !methods.contains(m)).toList();
        if (!missingRecommended.isEmpty()) {
            warnings.add("Missing recommended methods: " + String.join(", ", missingRecommended));
        }

        if (cls.docstring() == null) {
            warnings.add("Class " + cls.name() + " has no docstring");
        }
        for (PyStmt.FunctionDef method : cls.methods()) {
            if (method.docstring() == null) {
                warnings.add("Method " + method.name() + " has no docstring");
            }
        }

        cls.methods().stream()
                .filter(m -> m.name().equals("apply_smart_filters"))
                .findFirst()
                .filter(m -> !keepsHistoricalRows(m))
                .ifPresent(m -> errors.add(HISTORICAL_NOT_RECOMBINED));

        return ValidationResult.of(ValidationCategory.STRUCTURE, errors, warnings);
    }

    private static Optional<PyStmt.ClassDef> findScannerClass(PyModule module, String primaryClassName) {
        List<PyStmt.ClassDef> classes = module.classes();
        if (primaryClassName != null) {
            Optional<PyStmt.ClassDef> named = classes.stream()
                    .filter(c -> c.name().equals(primaryClassName))
                    .findFirst();
            if (named.isPresent()) {
                return named;
            }
        }
        return classes.isEmpty() ? Optional.empty() : Optional.of(classes.get(classes.size() - 1));
    }

    /**
     * A frame split off with a negated mask ({@code df[~mask]}) must reappear in a {@code concat(...)} list.
     * A method that filters on a date window without such a split drops history.
     */
    static boolean keepsHistoricalRows(PyStmt.FunctionDef method) {
        Set<String> historical = new TreeSet<>();
        for (PyStmt stmt : PyWalker.statements(method.body())) {
            if (stmt instanceof PyStmt.Assign a && a.value() instanceof PyExpr.Subscript s
                    && s.index() instanceof PyExpr.UnaryOp u && u.op().equals("~")) {
                a.targets().stream()
                        .filter(PyExpr.Name.class::isInstance)
                        .forEach(t -> historical.add(((PyExpr.Name) t).id()));
            }
        }
        boolean[] recombined = {false};
        boolean[] windowed = {false};
        PyWalker.forEachExpression(method.body(), expr -> {
            if (!(expr instanceof PyExpr.Call call) || !(call.func() instanceof PyExpr.Attribute attr)) {
                return;
            }
            if (attr.attr().equals("between")) {
                windowed[0] = true;
            }
            if (attr.attr().equals("concat") && !call.args().isEmpty()) {
                List<PyExpr> parts = call.args().get(0) instanceof PyExpr.ListExpr l ? l.elements()
                        : call.args().get(0) instanceof PyExpr.TupleExpr t ? t.elements()
                        : List.of();
                if (parts.stream().anyMatch(p -> p instanceof PyExpr.Name n && historical.contains(n.id()))) {
                    recombined[0] = true;
                }
            }
        });
        if (!historical.isEmpty()) {
            return recombined[0];
        }
        return !windowed[0];
    }

    // ===== Imports =====

    private ValidationResult checkImports(PyModule module) {
        Set<String> errors = new LinkedHashSet<>();
        Set<String> warnings = new LinkedHashSet<>();
        Set<String> imported = new TreeSet<>();

        for (PyStmt stmt : PyWalker.statements(module.body())) {
            List<String> modules = new ArrayList<>();
            if (stmt instanceof PyStmt.Import imp) {
                imp.names().forEach(a -> modules.add(a.name()));
            } else if (stmt instanceof PyStmt.ImportFrom from) {
                if (from.level() > 0) {
                    errors.add("Unresolved import: " + ".".repeat(from.level())
                            + (from.module() == null ? "" : from.module()));
                    continue;
                }
                modules.add(from.module());
            }
            for (String name : modules) {
                String top = name.split("\\.")[0];
                imported.add(top);
                if (PythonStdlib.MODULES.contains(top) || properties.getKnownModules().contains(top)) {
                    continue;
                }
                if (properties.getRecognizedLibraries().contains(top)) {
                    warnings.add("External library '" + top + "' must be installed");
                } else {
                    errors.add("Unresolved import: " + name);
                }
            }
        }

        List<String> missingRequired = properties.getRequiredImports().stream()
                .filter(r -> !imported.contains(r))
                .toList();
        if (!missingRequired.isEmpty()) {
            errors.add(MISSING_IMPORTS_PREFIX + String.join(", ", missingRequired));
        }
        return ValidationResult.of(ValidationCategory.IMPORTS, new ArrayList<>(errors), new ArrayList<>(warnings));
    }

    // ===== Style (warnings only) =====

    private ValidationResult checkStyle(PyModule module) {
        List<String> warnings = new ArrayList<>();
        List<String> lines = module.lines();
        int max = properties.getMaxLineLength();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.length() > max) {
                warnings.add("Line " + (i + 1) + " exceeds " + max + " characters (" + line.length() + ")");
            }
            if (!line.isEmpty() && Character.isWhitespace(line.charAt(line.length() - 1))) {
                warnings.add("Line " + (i + 1) + " has trailing whitespace");
            }
        }

        for (PyStmt stmt : PyWalker.statements(module.body())) {
            if (callsAttribute(stmt, "iterrows")) {
                warnings.add("Line " + stmt.line() + ": iterrows() is slow, prefer vectorized operations");
            }
            if (assignsApiKeyLiteral(stmt)) {
                warnings.add("Line " + stmt.line() + ": hardcoded API key literal");
            }
        }
        return ValidationResult.of(ValidationCategory.STYLE, List.of(), warnings);
    }

    private static boolean callsAttribute(PyStmt stmt, String attribute) {
        boolean[] found = {false};
        for (PyExpr expr : PyWalker.ownExpressions(stmt)) {
            PyWalker.walk(expr, e -> {
                if (e instanceof PyExpr.Call call && call.func() instanceof PyExpr.Attribute a
                        && a.attr().equals(attribute)) {
                    found[0] = true;
                }
            });
        }
        return found[0];
    }

    private static boolean assignsApiKeyLiteral(PyStmt stmt) {
        if (!(stmt instanceof PyStmt.Assign a) || !(a.value() instanceof PyExpr.Constant c) || !c.isString()) {
            return false;
        }
        String value = c.stringValue();
        if (value == null || value.length() < MIN_KEY_LENGTH || value.contains(" ")) {
            return false;
        }
        return a.targets().stream().anyMatch(t -> {
            String name = t instanceof PyExpr.Name n ? n.id()
                    : t instanceof PyExpr.Attribute at ? at.attr()
                    : "";
            String lower = name.toLowerCase(Locale.ROOT);
            return lower.contains("api_key") || lower.contains("apikey");
        });
    }
}
