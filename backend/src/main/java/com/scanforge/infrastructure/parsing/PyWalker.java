package com.scanforge.infrastructure.parsing;

import com.scanforge.infrastructure.parsing.PyExpr.*;
import com.scanforge.infrastructure.parsing.PyStmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal over statements and expressions.
 */
public final class PyWalker {

    private PyWalker() {
    }

    /**
     * All statements in {@code body}, including nested blocks, in source order.
     */
    public static List<PyStmt> statements(List<PyStmt> body) {
        List<PyStmt> out = new ArrayList<>();
        body.forEach(stmt -> collectStatements(stmt, out));
        return out;
    }

    private static void collectStatements(PyStmt stmt, List<PyStmt> out) {
        out.add(stmt);
        for (List<PyStmt> block : childBlocks(stmt)) {
            block.forEach(child -> collectStatements(child, out));
        }
    }

    /**
     * Nested statement blocks of a compound statement.
     */
    public static List<List<PyStmt>> childBlocks(PyStmt stmt) {
        if (stmt instanceof FunctionDef f) {
            return List.of(f.body());
        }
        if (stmt instanceof ClassDef c) {
            return List.of(c.body());
        }
        if (stmt instanceof If i) {
            return List.of(i.body(), i.orElse());
        }
        if (stmt instanceof For f) {
            return List.of(f.body(), f.orElse());
        }
        if (stmt instanceof While w) {
            return List.of(w.body(), w.orElse());
        }
        if (stmt instanceof With w) {
            return List.of(w.body());
        }
        if (stmt instanceof Match m) {
            return m.cases().stream().map(MatchCase::body).toList();
        }
        if (stmt instanceof Try t) {
            List<List<PyStmt>> blocks = new ArrayList<>();
            blocks.add(t.body());
            t.handlers().forEach(h -> blocks.add(h.body()));
            blocks.add(t.orElse());
            blocks.add(t.finalBody());
            return blocks;
        }
        return List.of();
    }

    /**
     * Expressions owned directly by a statement (not by its nested blocks).
     */
    public static List<PyExpr> ownExpressions(PyStmt stmt) {
        List<PyExpr> out = new ArrayList<>();
        if (stmt instanceof FunctionDef f) {
            out.addAll(f.decorators());
            f.params().forEach(p -> addParam(p, out));
            add(f.returns(), out);
        } else if (stmt instanceof ClassDef c) {
            out.addAll(c.decorators());
            out.addAll(c.bases());
        } else if (stmt instanceof If i) {
            out.add(i.test());
        } else if (stmt instanceof For f) {
            out.add(f.target());
            out.add(f.iter());
        } else if (stmt instanceof While w) {
            out.add(w.test());
        } else if (stmt instanceof With w) {
            w.items().forEach(item -> {
                out.add(item.context());
                add(item.target(), out);
            });
        } else if (stmt instanceof Match m) {
            out.add(m.subject());
            m.cases().forEach(mc -> {
                out.add(mc.pattern());
                add(mc.guard(), out);
            });
        } else if (stmt instanceof TypeAlias t) {
            out.add(t.value());
        } else if (stmt instanceof Try t) {
            t.handlers().forEach(h -> add(h.type(), out));
        } else if (stmt instanceof Return r) {
            add(r.value(), out);
        } else if (stmt instanceof Assign a) {
            out.addAll(a.targets());
            out.add(a.value());
        } else if (stmt instanceof AugAssign a) {
            out.add(a.target());
            out.add(a.value());
        } else if (stmt instanceof AnnAssign a) {
            out.add(a.target());
            out.add(a.annotation());
            add(a.value(), out);
        } else if (stmt instanceof ExprStmt e) {
            out.add(e.value());
        } else if (stmt instanceof Raise r) {
            add(r.exception(), out);
            add(r.cause(), out);
        } else if (stmt instanceof Assert a) {
            out.add(a.test());
            add(a.message(), out);
        } else if (stmt instanceof Delete d) {
            out.addAll(d.targets());
        }
        return out;
    }

    /**
     * Visits every expression in {@code body}, nested blocks included.
     */
    public static void forEachExpression(List<PyStmt> body, Consumer<PyExpr> visitor) {
        for (PyStmt stmt : statements(body)) {
            for (PyExpr expr : ownExpressions(stmt)) {
                walk(expr, visitor);
            }
        }
    }

    /**
     * Visits {@code expr} and all its sub-expressions, parents first.
     */
    public static void walk(PyExpr expr, Consumer<PyExpr> visitor) {
        if (expr == null) {
            return;
        }
        visitor.accept(expr);
        for (PyExpr child : children(expr)) {
            walk(child, visitor);
        }
    }

    public static List<PyExpr> children(PyExpr expr) {
        List<PyExpr> out = new ArrayList<>();
        if (expr instanceof Attribute a) {
            out.add(a.value());
        } else if (expr instanceof Subscript s) {
            out.add(s.value());
            out.add(s.index());
        } else if (expr instanceof Slice s) {
            add(s.lower(), out);
            add(s.upper(), out);
            add(s.step(), out);
        } else if (expr instanceof Call c) {
            out.add(c.func());
            out.addAll(c.args());
            c.keywords().forEach(k -> out.add(k.value()));
        } else if (expr instanceof Starred s) {
            out.add(s.value());
        } else if (expr instanceof TupleExpr t) {
            out.addAll(t.elements());
        } else if (expr instanceof ListExpr l) {
            out.addAll(l.elements());
        } else if (expr instanceof SetExpr s) {
            out.addAll(s.elements());
        } else if (expr instanceof DictExpr d) {
            d.keys().forEach(k -> add(k, out));
            out.addAll(d.values());
        } else if (expr instanceof BinOp b) {
            out.add(b.left());
            out.add(b.right());
        } else if (expr instanceof UnaryOp u) {
            out.add(u.operand());
        } else if (expr instanceof BoolOp b) {
            out.addAll(b.values());
        } else if (expr instanceof Compare c) {
            out.add(c.left());
            out.addAll(c.comparators());
        } else if (expr instanceof IfExp i) {
            out.add(i.test());
            out.add(i.body());
            out.add(i.orElse());
        } else if (expr instanceof Lambda l) {
            l.params().forEach(p -> add(p.defaultValue(), out));
            out.add(l.body());
        } else if (expr instanceof Comprehension c) {
            out.add(c.element());
            add(c.value(), out);
            c.generators().forEach(g -> {
                out.add(g.target());
                out.add(g.iter());
                out.addAll(g.conditions());
            });
        } else if (expr instanceof NamedExpr n) {
            out.add(n.target());
            out.add(n.value());
        } else if (expr instanceof Await a) {
            out.add(a.value());
        } else if (expr instanceof Yield y) {
            add(y.value(), out);
        } else if (expr instanceof MatchAs m) {
            out.add(m.pattern());
        }
        return out;
    }

    private static void addParam(Param p, List<PyExpr> out) {
        add(p.annotation(), out);
        add(p.defaultValue(), out);
    }

    private static void add(PyExpr expr, List<PyExpr> out) {
        if (expr != null) {
            out.add(expr);
        }
    }
}
