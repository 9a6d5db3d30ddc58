package com.scanforge.infrastructure.rendering;

import com.scanforge.infrastructure.parsing.PyExpr;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PyWalker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Names bound to price frames or rows. Only lookups rooted at one of these names follow the lowercase column
 * convention; other mappings ({@code os.environ}, module-level dicts) keep their keys.
 */
final class FrameNames {

    private FrameNames() {
    }

    /**
     * Extends {@code seeds} with every local assigned from an expression rooted at a known frame or row,
     * e.g. {@code m = df.copy()} or {@code r0, r1 = m.iloc[i], m.iloc[i - 1]}.
     */
    static Set<String> derive(Set<String> seeds, List<PyStmt> body) {
        Set<String> names = new LinkedHashSet<>(seeds);
        List<PyStmt> statements = PyWalker.statements(body);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (PyStmt stmt : statements) {
                if (stmt instanceof PyStmt.Assign a) {
                    for (PyExpr target : a.targets()) {
                        changed |= bind(target, a.value(), names);
                    }
                } else if (stmt instanceof PyStmt.AnnAssign a && a.value() != null) {
                    changed |= bind(a.target(), a.value(), names);
                }
            }
        }
        return names;
    }

    /**
     * Name at the bottom of an attribute, subscript or call chain: {@code m} for {@code m.iloc[i]["Close"]}.
     */
    static Optional<String> root(PyExpr expr) {
        PyExpr current = expr;
        while (true) {
            if (current instanceof PyExpr.Name n) {
                return Optional.of(n.id());
            } else if (current instanceof PyExpr.Attribute a) {
                current = a.value();
            } else if (current instanceof PyExpr.Subscript s) {
                current = s.value();
            } else if (current instanceof PyExpr.Call c) {
                current = c.func();
            } else {
                return Optional.empty();
            }
        }
    }

    static boolean rootedAt(PyExpr expr, Set<String> names) {
        return root(expr).filter(names::contains).isPresent();
    }

    private static boolean bind(PyExpr target, PyExpr value, Set<String> names) {
        if (target instanceof PyExpr.TupleExpr t && value instanceof PyExpr.TupleExpr v
                && t.elements().size() == v.elements().size()) {
            boolean changed = false;
            for (int i = 0; i < t.elements().size(); i++) {
                changed |= bind(t.elements().get(i), v.elements().get(i), names);
            }
            return changed;
        }
        return target instanceof PyExpr.Name n && rootedAt(value, names) && names.add(n.id());
    }
}
