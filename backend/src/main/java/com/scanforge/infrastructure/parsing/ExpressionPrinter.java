package com.scanforge.infrastructure.parsing;

import com.scanforge.infrastructure.parsing.PyExpr.*;
import com.scanforge.infrastructure.parsing.PyStmt.Param;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Turns expression nodes back into Python source. Nested operators are always parenthesized, so the output may
 * carry more parentheses than the input but evaluates the same way.
 */
public final class ExpressionPrinter {

    private final UnaryOperator<PyExpr> rewriter;

    private ExpressionPrinter(UnaryOperator<PyExpr> rewriter) {
        this.rewriter = rewriter;
    }

    public static String print(PyExpr expr) {
        return new ExpressionPrinter(UnaryOperator.identity()).render(expr);
    }

    /**
     * Prints {@code expr}, letting {@code rewriter} replace any node before it is printed. Return the node
     * unchanged to keep it.
     */
    public static String print(PyExpr expr, UnaryOperator<PyExpr> rewriter) {
        return new ExpressionPrinter(rewriter).render(expr);
    }

    private String render(PyExpr original) {
        return format(rewriter.apply(original));
    }

    private String format(PyExpr expr) {
        if (expr instanceof Name n) {
            return n.id();
        }
        if (expr instanceof Constant c) {
            return c.text();
        }
        if (expr instanceof Attribute a) {
            return operand(a.value()) + "." + a.attr();
        }
        if (expr instanceof Subscript s) {
            return operand(s.value()) + "[" + index(s.index()) + "]";
        }
        if (expr instanceof Slice s) {
            String out = opt(s.lower()) + ":" + opt(s.upper());
            return s.step() == null ? out : out + ":" + render(s.step());
        }
        if (expr instanceof Call c) {
            List<String> parts = new ArrayList<>();
            c.args().forEach(a -> parts.add(render(a)));
            c.keywords().forEach(k -> parts.add(k.name() == null
                    ? "**" + render(k.value())
                    : k.name() + "=" + render(k.value())));
            return operand(c.func()) + "(" + String.join(", ", parts) + ")";
        }
        if (expr instanceof Starred s) {
            return "*" + operand(s.value());
        }
        if (expr instanceof TupleExpr t) {
            if (t.elements().size() == 1) {
                return "(" + render(t.elements().get(0)) + ",)";
            }
            return "(" + join(t.elements()) + ")";
        }
        if (expr instanceof ListExpr l) {
            return "[" + join(l.elements()) + "]";
        }
        if (expr instanceof SetExpr s) {
            return "{" + join(s.elements()) + "}";
        }
        if (expr instanceof DictExpr d) {
            List<String> entries = new ArrayList<>();
            for (int i = 0; i < d.keys().size(); i++) {
                PyExpr key = d.keys().get(i);
                entries.add(key == null
                        ? "**" + operand(d.values().get(i))
                        : render(key) + ": " + render(d.values().get(i)));
            }
            return "{" + String.join(", ", entries) + "}";
        }
        if (expr instanceof BinOp b) {
            return operand(b.left()) + " " + b.op() + " " + operand(b.right());
        }
        if (expr instanceof UnaryOp u) {
            String op = u.op().equals("not") ? "not " : u.op();
            return op + operand(u.operand());
        }
        if (expr instanceof BoolOp b) {
            return b.values().stream().map(this::operand).collect(Collectors.joining(" " + b.op() + " "));
        }
        if (expr instanceof Compare c) {
            StringBuilder out = new StringBuilder(operand(c.left()));
            for (int i = 0; i < c.ops().size(); i++) {
                out.append(' ').append(c.ops().get(i)).append(' ').append(operand(c.comparators().get(i)));
            }
            return out.toString();
        }
        if (expr instanceof IfExp i) {
            return operand(i.body()) + " if " + operand(i.test()) + " else " + operand(i.orElse());
        }
        if (expr instanceof Lambda l) {
            String params = l.params().stream().map(this::param).collect(Collectors.joining(", "));
            return params.isEmpty() ? "lambda: " + render(l.body()) : "lambda " + params + ": " + render(l.body());
        }
        if (expr instanceof Comprehension c) {
            return comprehension(c);
        }
        if (expr instanceof NamedExpr n) {
            return render(n.target()) + " := " + operand(n.value());
        }
        if (expr instanceof Await a) {
            return "await " + operand(a.value());
        }
        if (expr instanceof Yield y) {
            if (y.value() == null) {
                return "yield";
            }
            return (y.from() ? "yield from " : "yield ") + render(y.value());
        }
        if (expr instanceof MatchAs m) {
            return render(m.pattern()) + " as " + m.name();
        }
        throw new IllegalArgumentException("Unsupported expression node: " + expr.getClass().getSimpleName());
    }

    /**
     * Renders an operand, parenthesizing anything that is itself an operator expression.
     */
    private String operand(PyExpr original) {
        PyExpr expr = rewriter.apply(original);
        String text = format(expr);
        if (expr instanceof BinOp || expr instanceof UnaryOp || expr instanceof BoolOp || expr instanceof Compare
                || expr instanceof IfExp || expr instanceof Lambda || expr instanceof NamedExpr
                || expr instanceof Yield || expr instanceof Await) {
            return "(" + text + ")";
        }
        return text;
    }

    private String index(PyExpr original) {
        PyExpr expr = rewriter.apply(original);
        if (expr instanceof TupleExpr t && !t.elements().isEmpty()) {
            String joined = join(t.elements());
            return t.elements().size() == 1 ? joined + "," : joined;
        }
        return format(expr);
    }

    private String comprehension(Comprehension c) {
        StringBuilder out = new StringBuilder();
        if (c.kind() == ComprehensionKind.DICT) {
            out.append(render(c.element())).append(": ").append(render(c.value()));
        } else {
            out.append(render(c.element()));
        }
        for (ComprehensionFor g : c.generators()) {
            out.append(g.async() ? " async for " : " for ")
                    .append(target(g.target()))
                    .append(" in ")
                    .append(operand(g.iter()));
            g.conditions().forEach(cond -> out.append(" if ").append(operand(cond)));
        }
        return switch (c.kind()) {
            case LIST -> "[" + out + "]";
            case SET, DICT -> "{" + out + "}";
            case GENERATOR -> "(" + out + ")";
        };
    }

    private String target(PyExpr original) {
        PyExpr expr = rewriter.apply(original);
        if (expr instanceof TupleExpr t && !t.elements().isEmpty()) {
            return join(t.elements());
        }
        return format(expr);
    }

    private String param(Param p) {
        return switch (p.kind()) {
            case VAR_POSITIONAL -> "*" + p.name();
            case VAR_KEYWORD -> "**" + p.name();
            case KEYWORD_MARKER -> "*";
            case POSITIONAL_MARKER -> "/";
            case REGULAR -> p.defaultValue() == null ? p.name() : p.name() + "=" + render(p.defaultValue());
        };
    }

    private String opt(PyExpr expr) {
        return expr == null ? "" : render(expr);
    }

    private String join(List<PyExpr> elements) {
        return elements.stream().map(this::render).collect(Collectors.joining(", "));
    }
}
