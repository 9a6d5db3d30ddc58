package com.scanforge.infrastructure.parsing;

import java.util.List;

/**
 * Python expression nodes.
 */
public interface PyExpr {

    record Name(String id) implements PyExpr {
    }

    record Constant(Kind kind, String text) implements PyExpr {

        public enum Kind { NUMBER, STRING, TRUE, FALSE, NONE, ELLIPSIS }

        public boolean isString() {
            return kind == Kind.STRING;
        }

        /**
         * Decoded value of a plain (non f-, non bytes) string literal, or null for other constants.
         */
        public String stringValue() {
            if (kind != Kind.STRING) {
                return null;
            }
            return StringLiterals.decode(text);
        }
    }

    record Attribute(PyExpr value, String attr) implements PyExpr {
    }

    record Subscript(PyExpr value, PyExpr index) implements PyExpr {
    }

    record Slice(PyExpr lower, PyExpr upper, PyExpr step) implements PyExpr {
    }

    record Call(PyExpr func, List<PyExpr> args, List<Keyword> keywords) implements PyExpr {
    }

    /**
     * Keyword argument; {@code name} is null for {@code **mapping}.
     */
    record Keyword(String name, PyExpr value) {
    }

    record Starred(PyExpr value) implements PyExpr {
    }

    record TupleExpr(List<PyExpr> elements) implements PyExpr {
    }

    record ListExpr(List<PyExpr> elements) implements PyExpr {
    }

    record SetExpr(List<PyExpr> elements) implements PyExpr {
    }

    /**
     * Dict display; a null key marks a {@code **mapping} entry.
     */
    record DictExpr(List<PyExpr> keys, List<PyExpr> values) implements PyExpr {
    }

    record BinOp(PyExpr left, String op, PyExpr right) implements PyExpr {
    }

    record UnaryOp(String op, PyExpr operand) implements PyExpr {
    }

    record BoolOp(String op, List<PyExpr> values) implements PyExpr {
    }

    record Compare(PyExpr left, List<String> ops, List<PyExpr> comparators) implements PyExpr {
    }

    record IfExp(PyExpr test, PyExpr body, PyExpr orElse) implements PyExpr {
    }

    record Lambda(List<PyStmt.Param> params, PyExpr body) implements PyExpr {
    }

    /**
     * List/set/dict comprehension or generator expression. {@code value} is only set for dict comprehensions.
     */
    record Comprehension(ComprehensionKind kind, PyExpr element, PyExpr value,
                         List<ComprehensionFor> generators) implements PyExpr {
    }

    enum ComprehensionKind { LIST, SET, DICT, GENERATOR }

    record ComprehensionFor(PyExpr target, PyExpr iter, List<PyExpr> conditions, boolean async) {
    }

    record NamedExpr(PyExpr target, PyExpr value) implements PyExpr {
    }

    record Await(PyExpr value) implements PyExpr {
    }

    record Yield(PyExpr value, boolean from) implements PyExpr {
    }

    /**
     * Case pattern bound to a name: {@code [x, y] as point}.
     */
    record MatchAs(PyExpr pattern, String name) implements PyExpr {
    }
}
