package com.scanforge.infrastructure.rendering;

import com.scanforge.infrastructure.classification.StructuralAnalysis;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PyWalker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Prepares the original module for embedding in the generated scanner.
 * <ol>
 *   <li>drops the {@code __main__} entry block</li>
 *   <li>rewrites helpers that read the configuration literal as a global to take {@code params} first</li>
 *   <li>passes the configuration explicitly at every call site of a rewritten helper</li>
 * </ol>
 */
@Slf4j
@Component
public class SourcePreserver {

    public static final String PARAMS_NAME = "params";

    // Kept in the module but never called by the generated class
    private static final Set<String> DETACHED_FUNCTIONS = Set.of("fetch_daily", "scan_symbol");

    /**
     * @param analysis             classified source
     * @param fixedArityFunctions  functions the skeleton calls with a fixed signature; never rewritten
     */
    public PreservedSource preserve(StructuralAnalysis analysis, Set<String> fixedArityFunctions) {
        PyModule module = analysis.module();
        String config = StructuralClassifier.CONFIG_LITERAL_NAME;

        // 1. Find helpers
        Set<String> helpers = analysis.configLiteral().isPresent()
                ? findHelpers(module, config, fixedArityFunctions)
                : Set.of();
        Set<String> calledFromFixed = new TreeSet<>();
        module.functions().stream()
                .filter(f -> fixedArityFunctions.contains(f.name()) && !DETACHED_FUNCTIONS.contains(f.name()))
                .forEach(f -> calledFromFixed.addAll(calledNames(f.body(), helpers)));

        // 2. Rewrite definitions and call sites
        SourceEdits edits = new SourceEdits(module.source());
        TokenRewriter rewriter = new TokenRewriter(module.tokens(), edits);
        PyStmt guard = analysis.entryGuard().orElse(null);
        for (PyStmt stmt : module.body()) {
            if (stmt == guard) {
                continue;
            }
            if (stmt instanceof PyStmt.FunctionDef f && helpers.contains(f.name())) {
                rewriter.insertLeadingParameter(f.nameOffset(), PARAMS_NAME);
                rewriter.renameNames(f.line(), f.endLine(), Map.of(config, PARAMS_NAME));
                rewriter.insertLeadingArgument(f.line(), f.endLine(), helpers, PARAMS_NAME);
                if (!calledFromFixed.contains(f.name())) {
                    rewriter.lowercaseKeys(f.line(), f.endLine(), rowNames(f, config));
                }
            } else if (!helpers.isEmpty()) {
                rewriter.insertLeadingArgument(stmt.line(), stmt.endLine(), helpers, config);
            }
        }

        // 3. Drop the entry block
        int[] offsets = SourceEdits.lineOffsets(module.source());
        if (guard != null) {
            int end = guard.endLine() + 1 < offsets.length ? offsets[guard.endLine() + 1] : module.source().length();
            edits.delete(offsets[guard.line()], end);
        }

        String code = edits.apply().stripTrailing() + "\n";
        log.debug("[Preserver] helpers rewritten={}, entry guard removed={}", helpers, guard != null);
        return new PreservedSource(code, boundImportNames(module), importInsertLine(module), new ArrayList<>(helpers));
    }

    /**
     * Parameters of a helper receive rows or frames from the detection loop; locals derived from them do too.
     */
    static Set<String> rowNames(PyStmt.FunctionDef helper, String config) {
        Set<String> seeds = new LinkedHashSet<>();
        helper.params().stream()
                .filter(p -> p.kind() == PyStmt.ParamKind.REGULAR)
                .map(PyStmt.Param::name)
                .filter(name -> !name.equals(config) && !name.equals(PARAMS_NAME))
                .forEach(seeds::add);
        return FrameNames.derive(seeds, helper.body());
    }

    /**
     * Top-level functions reading {@code config} as a free name, directly or through another such function.
     */
    static Set<String> findHelpers(PyModule module, String config, Set<String> excluded) {
        List<PyStmt.FunctionDef> candidates = module.functions().stream()
                .filter(f -> !excluded.contains(f.name()))
                .toList();
        Set<String> helpers = new LinkedHashSet<>();
        candidates.stream().filter(f -> readsFreeName(f, config)).forEach(f -> helpers.add(f.name()));

        boolean changed = true;
        while (changed) {
            changed = false;
            for (PyStmt.FunctionDef f : candidates) {
                if (!helpers.contains(f.name()) && !f.hasParam(config)
                        && !calledNames(f.body(), helpers).isEmpty()) {
                    helpers.add(f.name());
                    changed = true;
                }
            }
        }
        return helpers;
    }

    static boolean readsFreeName(PyStmt.FunctionDef function, String name) {
        if (function.hasParam(name) || assignsName(function.body(), name)) {
            return false;
        }
        boolean[] found = {false};
        PyWalker.forEachExpression(function.body(), expr -> {
            if (expr instanceof PyExpr.Name n && n.id().equals(name)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    private static boolean assignsName(List<PyStmt> body, String name) {
        for (PyStmt stmt : PyWalker.statements(body)) {
            List<PyExpr> targets = new ArrayList<>();
            if (stmt instanceof PyStmt.Assign a) {
                targets.addAll(a.targets());
            } else if (stmt instanceof PyStmt.AugAssign a) {
                targets.add(a.target());
            } else if (stmt instanceof PyStmt.AnnAssign a) {
                targets.add(a.target());
            } else if (stmt instanceof PyStmt.For f) {
                targets.add(f.target());
            }
            for (PyExpr target : targets) {
                if (bindsName(target, name)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean bindsName(PyExpr target, String name) {
        if (target instanceof PyExpr.Name n) {
            return n.id().equals(name);
        }
        if (target instanceof PyExpr.TupleExpr t) {
            return t.elements().stream().anyMatch(e -> bindsName(e, name));
        }
        if (target instanceof PyExpr.ListExpr l) {
            return l.elements().stream().anyMatch(e -> bindsName(e, name));
        }
        if (target instanceof PyExpr.Starred s) {
            return bindsName(s.value(), name);
        }
        return false;
    }

    static Set<String> calledNames(List<PyStmt> body, Set<String> candidates) {
        Set<String> called = new TreeSet<>();
        PyWalker.forEachExpression(body, expr -> {
            if (expr instanceof PyExpr.Call call && call.func() instanceof PyExpr.Name n
                    && candidates.contains(n.id())) {
                called.add(n.id());
            }
        });
        return called;
    }

    private static Set<String> boundImportNames(PyModule module) {
        Set<String> names = new TreeSet<>();
        for (PyStmt stmt : topLevelStatements(module.body())) {
            if (stmt instanceof PyStmt.Import imp) {
                imp.names().forEach(a -> names.add(a.boundName()));
            } else if (stmt instanceof PyStmt.ImportFrom from) {
                from.names().forEach(a -> names.add(a.boundName()));
            }
        }
        return names;
    }

    /**
     * Module statements plus those nested in module-level {@code if}, {@code try}, {@code with} or
     * {@code match} blocks.
     */
    private static List<PyStmt> topLevelStatements(List<PyStmt> body) {
        List<PyStmt> out = new ArrayList<>();
        for (PyStmt stmt : body) {
            out.add(stmt);
            if (stmt instanceof PyStmt.If || stmt instanceof PyStmt.Try || stmt instanceof PyStmt.With
                    || stmt instanceof PyStmt.Match) {
                PyWalker.childBlocks(stmt).forEach(block -> out.addAll(topLevelStatements(block)));
            }
        }
        return out;
    }

    private static int importInsertLine(PyModule module) {
        int line = 0;
        for (PyStmt stmt : module.body()) {
            if (stmt instanceof PyStmt.ImportFrom from && "__future__".equals(from.module())) {
                line = Math.max(line, from.endLine());
            }
        }
        return line;
    }
}
