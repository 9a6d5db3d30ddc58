package com.scanforge.infrastructure.parsing;

import java.util.List;

/**
 * Python statement nodes. Every statement knows the 1-based source lines it spans.
 */
public interface PyStmt {

    int line();

    int endLine();

    record FunctionDef(String name, int nameOffset, List<Param> params, List<PyExpr> decorators, PyExpr returns,
                       List<PyStmt> body, boolean async, int line, int endLine) implements PyStmt {

        public boolean hasParam(String paramName) {
            return params.stream().anyMatch(p -> p.name() != null && p.name().equals(paramName));
        }

        public String docstring() {
            return PyStmt.docstringOf(body);
        }
    }

    enum ParamKind { REGULAR, VAR_POSITIONAL, VAR_KEYWORD, KEYWORD_MARKER, POSITIONAL_MARKER }

    record Param(String name, PyExpr annotation, PyExpr defaultValue, ParamKind kind) {
    }

    record ClassDef(String name, List<PyExpr> bases, List<PyExpr> decorators, List<PyStmt> body,
                    int line, int endLine) implements PyStmt {

        public List<FunctionDef> methods() {
            return body.stream()
                    .filter(FunctionDef.class::isInstance)
                    .map(FunctionDef.class::cast)
                    .toList();
        }

        public String docstring() {
            return PyStmt.docstringOf(body);
        }
    }

    record If(PyExpr test, List<PyStmt> body, List<PyStmt> orElse, int line, int endLine) implements PyStmt {
    }

    record For(PyExpr target, PyExpr iter, List<PyStmt> body, List<PyStmt> orElse, boolean async,
               int line, int endLine) implements PyStmt {
    }

    record While(PyExpr test, List<PyStmt> body, List<PyStmt> orElse, int line, int endLine) implements PyStmt {
    }

    record Try(List<PyStmt> body, List<ExceptHandler> handlers, List<PyStmt> orElse, List<PyStmt> finalBody,
               int line, int endLine) implements PyStmt {
    }

    record ExceptHandler(PyExpr type, String name, List<PyStmt> body, int line) {
    }

    record With(List<WithItem> items, List<PyStmt> body, boolean async, int line, int endLine) implements PyStmt {
    }

    record WithItem(PyExpr context, PyExpr target) {
    }

    /**
     * {@code match} statement. Case patterns are held as expressions: alternatives as {@code |} binary
     * operations, class patterns as calls, captures as names.
     */
    record Match(PyExpr subject, List<MatchCase> cases, int line, int endLine) implements PyStmt {
    }

    record MatchCase(PyExpr pattern, PyExpr guard, List<PyStmt> body, int line) {
    }

    /**
     * {@code type Name = value}. Type parameters are not retained.
     */
    record TypeAlias(String name, PyExpr value, int line, int endLine) implements PyStmt {
    }

    record Return(PyExpr value, int line, int endLine) implements PyStmt {
    }

    record Assign(List<PyExpr> targets, PyExpr value, int line, int endLine) implements PyStmt {
    }

    record AugAssign(PyExpr target, String op, PyExpr value, int line, int endLine) implements PyStmt {
    }

    record AnnAssign(PyExpr target, PyExpr annotation, PyExpr value, int line, int endLine) implements PyStmt {
    }

    record ExprStmt(PyExpr value, int line, int endLine) implements PyStmt {
    }

    record Import(List<Alias> names, int line, int endLine) implements PyStmt {
    }

    record ImportFrom(String module, int level, List<Alias> names, int line, int endLine) implements PyStmt {
    }

    record Alias(String name, String asName) {

        public String boundName() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    /**
     * {@code pass}, {@code break} or {@code continue}.
     */
    record Keyword(String keyword, int line, int endLine) implements PyStmt {
    }

    record Global(List<String> names, boolean nonlocal, int line, int endLine) implements PyStmt {
    }

    record Raise(PyExpr exception, PyExpr cause, int line, int endLine) implements PyStmt {
    }

    record Assert(PyExpr test, PyExpr message, int line, int endLine) implements PyStmt {
    }

    record Delete(List<PyExpr> targets, int line, int endLine) implements PyStmt {
    }

    private static String docstringOf(List<PyStmt> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExprStmt expr
                && expr.value() instanceof PyExpr.Constant constant && constant.isString()) {
            return constant.stringValue();
        }
        return null;
    }
}
