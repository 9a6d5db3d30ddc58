package com.scanforge.infrastructure.parsing;

import com.scanforge.infrastructure.parsing.PyExpr.*;
import com.scanforge.infrastructure.parsing.PyStmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for Python 3 statements and expressions.
 * <p>
 * Covers the grammar used by scanner scripts: functions, classes, decorators, control flow, comprehensions,
 * lambdas, walrus, star-args and annotations, plus the newer forms: parenthesized {@code with} items,
 * {@code match} statements, {@code type} aliases and PEP 695 type parameters. {@code match} and {@code type}
 * are soft keywords and stay usable as ordinary names.
 * </p>
 */
public final class PythonParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield"
    );

    private static final Set<String> AUGMENTED_OPS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="
    );

    private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");

    public PyModule parse(String source) {
        List<PythonToken> tokens = PythonLexer.tokenize(source);
        Cursor c = new Cursor(tokens);
        List<PyStmt> body = new ArrayList<>();
        while (!c.atType(PythonTokenType.EOF)) {
            if (c.atType(PythonTokenType.NEWLINE)) {
                c.next();
                continue;
            }
            if (c.atType(PythonTokenType.INDENT)) {
                throw new SourceParseException("unexpected indent", c.peek().line());
            }
            body.addAll(parseStatement(c));
        }
        return new PyModule(source, tokens, List.copyOf(body));
    }

    // ===== Statements =====

    private List<PyStmt> parseStatement(Cursor c) {
        PythonToken t = c.peek();
        if (t.type() == PythonTokenType.NAME) {
            switch (t.text()) {
                case "if":
                    return List.of(parseIf(c));
                case "for":
                    return List.of(parseFor(c, false));
                case "while":
                    return List.of(parseWhile(c));
                case "try":
                    return List.of(parseTry(c));
                case "with":
                    return List.of(parseWith(c, false));
                case "def":
                    return List.of(parseFunction(c, List.of(), false));
                case "class":
                    return List.of(parseClass(c, List.of()));
                case "async":
                    return List.of(parseAsync(c, List.of()));
                case "match":
                    if (startsMatchStatement(c)) {
                        return List.of(parseMatch(c));
                    }
                    break;
                default:
                    break;
            }
        }
        if (t.isOp("@")) {
            return List.of(parseDecorated(c));
        }
        return parseSimpleStatements(c);
    }

    private PyStmt parseAsync(Cursor c, List<PyExpr> decorators) {
        c.expectName("async");
        PythonToken t = c.peek();
        if (t.isName("def")) {
            return parseFunction(c, decorators, true);
        }
        if (!decorators.isEmpty()) {
            throw c.error("invalid syntax");
        }
        if (t.isName("for")) {
            return parseFor(c, true);
        }
        if (t.isName("with")) {
            return parseWith(c, true);
        }
        throw c.error("invalid syntax");
    }

    private PyStmt parseDecorated(Cursor c) {
        List<PyExpr> decorators = new ArrayList<>();
        while (c.peek().isOp("@")) {
            c.next();
            decorators.add(parseNamedExprTest(c));
            c.expectType(PythonTokenType.NEWLINE, "newline after decorator");
        }
        PythonToken t = c.peek();
        if (t.isName("def")) {
            return parseFunction(c, decorators, false);
        }
        if (t.isName("class")) {
            return parseClass(c, decorators);
        }
        if (t.isName("async")) {
            return parseAsync(c, decorators);
        }
        throw c.error("invalid syntax");
    }

    private If parseIf(Cursor c) {
        PythonToken start = c.next();
        PyExpr test = parseNamedExprTest(c);
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        List<PyStmt> orElse = List.of();
        if (c.peek().isName("elif")) {
            orElse = List.of(parseIf(c));
        } else if (c.peek().isName("else")) {
            c.next();
            c.expectOp(":");
            orElse = parseSuite(c);
        }
        return new If(test, body, orElse, start.line(), endOf(body, orElse));
    }

    private For parseFor(Cursor c, boolean async) {
        PythonToken start = c.expectName("for");
        PyExpr target = parseTargetList(c);
        c.expectName("in");
        PyExpr iter = parseTestListStarExpr(c);
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        List<PyStmt> orElse = parseOptionalElse(c);
        return new For(target, iter, body, orElse, async, start.line(), endOf(body, orElse));
    }

    private While parseWhile(Cursor c) {
        PythonToken start = c.next();
        PyExpr test = parseNamedExprTest(c);
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        List<PyStmt> orElse = parseOptionalElse(c);
        return new While(test, body, orElse, start.line(), endOf(body, orElse));
    }

    private List<PyStmt> parseOptionalElse(Cursor c) {
        if (!c.peek().isName("else")) {
            return List.of();
        }
        c.next();
        c.expectOp(":");
        return parseSuite(c);
    }

    private Try parseTry(Cursor c) {
        PythonToken start = c.next();
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        List<ExceptHandler> handlers = new ArrayList<>();
        int end = lastLine(body);
        while (c.peek().isName("except")) {
            PythonToken exceptToken = c.next();
            if (c.peek().isOp("*")) {
                c.next();
            }
            PyExpr type = null;
            String name = null;
            if (!c.peek().isOp(":")) {
                type = parseTest(c);
                if (c.peek().isOp(",")) {
                    List<PyExpr> types = new ArrayList<>(List.of(type));
                    while (c.peek().isOp(",")) {
                        c.next();
                        types.add(parseTest(c));
                    }
                    type = new TupleExpr(List.copyOf(types));
                }
                if (c.peek().isName("as")) {
                    c.next();
                    name = c.expectIdentifier().text();
                }
            }
            c.expectOp(":");
            List<PyStmt> handlerBody = parseSuite(c);
            handlers.add(new ExceptHandler(type, name, handlerBody, exceptToken.line()));
            end = lastLine(handlerBody);
        }
        List<PyStmt> orElse = List.of();
        if (c.peek().isName("else")) {
            if (handlers.isEmpty()) {
                throw c.error("expected 'except' or 'finally' block");
            }
            c.next();
            c.expectOp(":");
            orElse = parseSuite(c);
            end = lastLine(orElse);
        }
        List<PyStmt> finalBody = List.of();
        if (c.peek().isName("finally")) {
            c.next();
            c.expectOp(":");
            finalBody = parseSuite(c);
            end = lastLine(finalBody);
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw c.error("expected 'except' or 'finally' block");
        }
        return new Try(body, List.copyOf(handlers), orElse, finalBody, start.line(), end);
    }

    private With parseWith(Cursor c, boolean async) {
        PythonToken start = c.expectName("with");
        List<WithItem> items;
        if (c.peek().isOp("(") && c.peekAt(c.closingOffset() + 1).isOp(":")) {
            c.next();
            items = parseWithItems(c, true);
            c.expectOp(")");
        } else {
            items = parseWithItems(c, false);
        }
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        return new With(items, body, async, start.line(), lastLine(body));
    }

    /**
     * {@code with (a as x, b as y,):} groups its items; a trailing comma is allowed only inside the parentheses.
     */
    private List<WithItem> parseWithItems(Cursor c, boolean parenthesized) {
        List<WithItem> items = new ArrayList<>();
        while (true) {
            PyExpr context = parseTest(c);
            PyExpr target = null;
            if (c.peek().isName("as")) {
                c.next();
                target = parseTarget(c);
            }
            items.add(new WithItem(context, target));
            if (!c.peek().isOp(",")) {
                return List.copyOf(items);
            }
            c.next();
            if (parenthesized && c.peek().isOp(")")) {
                return List.copyOf(items);
            }
        }
    }

    // ===== match =====

    /**
     * {@code match} opens a statement only when its logical line ends in a colon followed by an indented
     * {@code case}; otherwise it is an ordinary name.
     */
    private static boolean startsMatchStatement(Cursor c) {
        int end = c.offsetOf(PythonTokenType.NEWLINE);
        return end > 2 && c.peekAt(end - 1).isOp(":")
                && c.peekAt(end + 1).type() == PythonTokenType.INDENT && c.peekAt(end + 2).isName("case");
    }

    private Match parseMatch(Cursor c) {
        PythonToken start = c.expectName("match");
        PyExpr subject = parseTestListStarExpr(c);
        c.expectOp(":");
        c.expectType(PythonTokenType.NEWLINE, "newline");
        c.expectType(PythonTokenType.INDENT, "an indented block");
        List<MatchCase> cases = new ArrayList<>();
        while (c.peek().isName("case")) {
            PythonToken caseToken = c.next();
            PyExpr pattern = parseOpenPattern(c);
            PyExpr guard = null;
            if (c.peek().isName("if")) {
                c.next();
                guard = parseNamedExprTest(c);
            }
            c.expectOp(":");
            List<PyStmt> body = parseSuite(c);
            cases.add(new MatchCase(pattern, guard, body, caseToken.line()));
        }
        if (cases.isEmpty()) {
            throw c.error("expected 'case' block");
        }
        if (c.atType(PythonTokenType.DEDENT)) {
            c.next();
        } else if (!c.atType(PythonTokenType.EOF)) {
            throw c.error("expected 'case' block");
        }
        return new Match(subject, List.copyOf(cases), start.line(), lastLine(cases.get(cases.size() - 1).body()));
    }

    /**
     * Top-level case pattern, where {@code case a, *rest:} is an unparenthesized sequence.
     */
    private PyExpr parseOpenPattern(Cursor c) {
        PyExpr first = parseStarPattern(c);
        if (!c.peek().isOp(",")) {
            return first;
        }
        List<PyExpr> items = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (c.peek().isOp(":") || c.peek().isName("if")) {
                break;
            }
            items.add(parseStarPattern(c));
        }
        return new TupleExpr(List.copyOf(items));
    }

    private PyExpr parseStarPattern(Cursor c) {
        if (c.peek().isOp("*")) {
            c.next();
            return new Starred(new Name(c.expectIdentifier().text()));
        }
        return parsePattern(c);
    }

    private PyExpr parsePattern(Cursor c) {
        PyExpr pattern = parseClosedPattern(c);
        while (c.peek().isOp("|")) {
            c.next();
            pattern = new BinOp(pattern, "|", parseClosedPattern(c));
        }
        if (c.peek().isName("as")) {
            c.next();
            return new MatchAs(pattern, c.expectIdentifier().text());
        }
        return pattern;
    }

    private PyExpr parseClosedPattern(Cursor c) {
        PythonToken t = c.peek();
        if (t.isOp("(")) {
            c.next();
            List<PyExpr> items = parsePatternItems(c, ")");
            boolean group = items.size() == 1 && !c.peekAt(-1).isOp(",") && !(items.get(0) instanceof Starred);
            c.expectOp(")");
            return group ? items.get(0) : new TupleExpr(items);
        }
        if (t.isOp("[")) {
            c.next();
            List<PyExpr> items = parsePatternItems(c, "]");
            c.expectOp("]");
            return new ListExpr(items);
        }
        if (t.isOp("{")) {
            return parseMappingPattern(c);
        }
        if (t.type() == PythonTokenType.NUMBER || t.isOp("-")) {
            return parseNumberPattern(c);
        }
        if (t.type() == PythonTokenType.STRING || t.isName("None") || t.isName("True") || t.isName("False")) {
            return parseAtom(c);
        }
        PyExpr value = new Name(c.expectIdentifier().text());
        while (c.peek().isOp(".")) {
            c.next();
            value = new Attribute(value, c.expectIdentifier().text());
        }
        return c.peek().isOp("(") ? parseClassPattern(c, value) : value;
    }

    private List<PyExpr> parsePatternItems(Cursor c, String closing) {
        List<PyExpr> items = new ArrayList<>();
        while (!c.peek().isOp(closing)) {
            items.add(parseStarPattern(c));
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        return List.copyOf(items);
    }

    /**
     * Signed real or complex literal: {@code -1}, {@code 3.5}, {@code -1 + 2j}.
     */
    private PyExpr parseNumberPattern(Cursor c) {
        PyExpr number;
        if (c.peek().isOp("-")) {
            c.next();
            number = new UnaryOp("-", numberConstant(c));
        } else {
            number = numberConstant(c);
        }
        if (c.peek().isOp("+") || c.peek().isOp("-")) {
            String op = c.next().text();
            number = new BinOp(number, op, numberConstant(c));
        }
        return number;
    }

    private static Constant numberConstant(Cursor c) {
        return new Constant(Constant.Kind.NUMBER, c.expectType(PythonTokenType.NUMBER, "a number").text());
    }

    private PyExpr parseMappingPattern(Cursor c) {
        c.expectOp("{");
        List<PyExpr> keys = new ArrayList<>();
        List<PyExpr> values = new ArrayList<>();
        while (!c.peek().isOp("}")) {
            if (c.peek().isOp("**")) {
                c.next();
                keys.add(null);
                values.add(new Name(c.expectIdentifier().text()));
            } else {
                keys.add(parseClosedPattern(c));
                c.expectOp(":");
                values.add(parsePattern(c));
            }
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        c.expectOp("}");
        return new DictExpr(Collections.unmodifiableList(keys), List.copyOf(values));
    }

    private PyExpr parseClassPattern(Cursor c, PyExpr cls) {
        c.expectOp("(");
        List<PyExpr> args = new ArrayList<>();
        List<PyExpr.Keyword> keywords = new ArrayList<>();
        while (!c.peek().isOp(")")) {
            if (c.peek().type() == PythonTokenType.NAME && c.peekAt(1).isOp("=")) {
                String name = c.next().text();
                c.next();
                keywords.add(new PyExpr.Keyword(name, parsePattern(c)));
            } else {
                args.add(parsePattern(c));
            }
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        c.expectOp(")");
        return new Call(cls, List.copyOf(args), List.copyOf(keywords));
    }

    // ===== type parameters =====

    /**
     * {@code type} opens an alias only when followed by a name and then {@code =} or {@code [}.
     */
    private static boolean startsTypeAlias(Cursor c) {
        PythonToken name = c.peekAt(1);
        return name.type() == PythonTokenType.NAME && !KEYWORDS.contains(name.text())
                && (c.peekAt(2).isOp("=") || c.peekAt(2).isOp("["));
    }

    private TypeAlias parseTypeAlias(Cursor c) {
        PythonToken start = c.expectName("type");
        String name = c.expectIdentifier().text();
        skipTypeParameters(c);
        c.expectOp("=");
        PyExpr value = parseTest(c);
        return new TypeAlias(name, value, start.line(), c.lastLine());
    }

    /**
     * Consumes an optional {@code [T, *Ts, **P, U: bound = default]} list.
     */
    private void skipTypeParameters(Cursor c) {
        if (!c.peek().isOp("[")) {
            return;
        }
        c.next();
        while (!c.peek().isOp("]")) {
            if (c.peek().isOp("*") || c.peek().isOp("**")) {
                c.next();
            }
            c.expectIdentifier();
            if (c.peek().isOp(":")) {
                c.next();
                parseTest(c);
            }
            if (c.peek().isOp("=")) {
                c.next();
                parseTestOrStar(c);
            }
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        c.expectOp("]");
    }

    private FunctionDef parseFunction(Cursor c, List<PyExpr> decorators, boolean async) {
        PythonToken start = c.expectName("def");
        PythonToken name = c.expectIdentifier();
        skipTypeParameters(c);
        c.expectOp("(");
        List<Param> params = parseParameters(c, ")", true);
        c.expectOp(")");
        PyExpr returns = null;
        if (c.peek().isOp("->")) {
            c.next();
            returns = parseTest(c);
        }
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        return new FunctionDef(name.text(), name.start(), params, List.copyOf(decorators), returns, body, async,
                start.line(), lastLine(body));
    }

    private ClassDef parseClass(Cursor c, List<PyExpr> decorators) {
        PythonToken start = c.expectName("class");
        PythonToken name = c.expectIdentifier();
        skipTypeParameters(c);
        List<PyExpr> bases = List.of();
        if (c.peek().isOp("(")) {
            c.next();
            CallArguments arguments = parseArguments(c);
            c.expectOp(")");
            List<PyExpr> all = new ArrayList<>(arguments.args());
            arguments.keywords().forEach(k -> all.add(k.value()));
            bases = List.copyOf(all);
        }
        c.expectOp(":");
        List<PyStmt> body = parseSuite(c);
        return new ClassDef(name.text(), bases, List.copyOf(decorators), body, start.line(), lastLine(body));
    }

    /**
     * Parameter list up to (not including) {@code closing}. Annotations are only allowed in {@code def}.
     */
    private List<Param> parseParameters(Cursor c, String closing, boolean allowAnnotations) {
        List<Param> params = new ArrayList<>();
        while (!c.peek().isOp(closing)) {
            if (c.peek().isOp("**")) {
                c.next();
                String name = c.expectIdentifier().text();
                PyExpr annotation = parseOptionalAnnotation(c, allowAnnotations);
                params.add(new Param(name, annotation, null, ParamKind.VAR_KEYWORD));
            } else if (c.peek().isOp("*")) {
                c.next();
                if (c.peek().type() == PythonTokenType.NAME) {
                    String name = c.expectIdentifier().text();
                    PyExpr annotation = parseOptionalAnnotation(c, allowAnnotations);
                    params.add(new Param(name, annotation, null, ParamKind.VAR_POSITIONAL));
                } else {
                    params.add(new Param(null, null, null, ParamKind.KEYWORD_MARKER));
                }
            } else if (c.peek().isOp("/")) {
                c.next();
                params.add(new Param(null, null, null, ParamKind.POSITIONAL_MARKER));
            } else {
                String name = c.expectIdentifier().text();
                PyExpr annotation = parseOptionalAnnotation(c, allowAnnotations);
                PyExpr defaultValue = null;
                if (c.peek().isOp("=")) {
                    c.next();
                    defaultValue = parseTest(c);
                }
                params.add(new Param(name, annotation, defaultValue, ParamKind.REGULAR));
            }
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        return List.copyOf(params);
    }

    private PyExpr parseOptionalAnnotation(Cursor c, boolean allowAnnotations) {
        if (allowAnnotations && c.peek().isOp(":")) {
            c.next();
            return parseTest(c);
        }
        return null;
    }

    private List<PyStmt> parseSuite(Cursor c) {
        if (!c.atType(PythonTokenType.NEWLINE)) {
            return List.copyOf(parseSimpleStatements(c));
        }
        c.next();
        if (!c.atType(PythonTokenType.INDENT)) {
            throw c.error("expected an indented block");
        }
        c.next();
        List<PyStmt> body = new ArrayList<>();
        while (!c.atType(PythonTokenType.DEDENT) && !c.atType(PythonTokenType.EOF)) {
            if (c.atType(PythonTokenType.INDENT)) {
                throw c.error("unexpected indent");
            }
            body.addAll(parseStatement(c));
        }
        if (c.atType(PythonTokenType.DEDENT)) {
            c.next();
        }
        return List.copyOf(body);
    }

    private List<PyStmt> parseSimpleStatements(Cursor c) {
        List<PyStmt> statements = new ArrayList<>();
        statements.add(parseSmallStatement(c));
        while (c.peek().isOp(";")) {
            c.next();
            if (c.atType(PythonTokenType.NEWLINE)) {
                break;
            }
            statements.add(parseSmallStatement(c));
        }
        if (!c.atType(PythonTokenType.EOF)) {
            c.expectType(PythonTokenType.NEWLINE, "newline");
        }
        return statements;
    }

    private PyStmt parseSmallStatement(Cursor c) {
        PythonToken start = c.peek();
        if (start.type() == PythonTokenType.NAME) {
            switch (start.text()) {
                case "pass", "break", "continue" -> {
                    c.next();
                    return new PyStmt.Keyword(start.text(), start.line(), start.line());
                }
                case "return" -> {
                    c.next();
                    PyExpr value = atStatementEnd(c) ? null : parseTestListStarExpr(c);
                    return new Return(value, start.line(), c.lastLine());
                }
                case "raise" -> {
                    c.next();
                    PyExpr exception = null;
                    PyExpr cause = null;
                    if (!atStatementEnd(c)) {
                        exception = parseTest(c);
                        if (c.peek().isName("from")) {
                            c.next();
                            cause = parseTest(c);
                        }
                    }
                    return new Raise(exception, cause, start.line(), c.lastLine());
                }
                case "global", "nonlocal" -> {
                    c.next();
                    List<String> names = new ArrayList<>();
                    names.add(c.expectIdentifier().text());
                    while (c.peek().isOp(",")) {
                        c.next();
                        names.add(c.expectIdentifier().text());
                    }
                    return new Global(List.copyOf(names), start.text().equals("nonlocal"), start.line(), c.lastLine());
                }
                case "import" -> {
                    return parseImport(c);
                }
                case "from" -> {
                    return parseImportFrom(c);
                }
                case "assert" -> {
                    c.next();
                    PyExpr test = parseTest(c);
                    PyExpr message = null;
                    if (c.peek().isOp(",")) {
                        c.next();
                        message = parseTest(c);
                    }
                    return new Assert(test, message, start.line(), c.lastLine());
                }
                case "type" -> {
                    if (startsTypeAlias(c)) {
                        return parseTypeAlias(c);
                    }
                }
                case "del" -> {
                    c.next();
                    PyExpr targets = parseTargetList(c);
                    List<PyExpr> list = targets instanceof TupleExpr tuple ? tuple.elements() : List.of(targets);
                    return new Delete(list, start.line(), c.lastLine());
                }
                default -> {
                    // expression statement or assignment
                }
            }
        }
        return parseExpressionStatement(c);
    }

    private boolean atStatementEnd(Cursor c) {
        return c.atType(PythonTokenType.NEWLINE) || c.atType(PythonTokenType.EOF) || c.peek().isOp(";");
    }

    private PyStmt parseExpressionStatement(Cursor c) {
        PythonToken start = c.peek();
        PyExpr first = c.peek().isName("yield") ? parseYield(c) : parseTestListStarExpr(c);

        if (c.peek().isOp(":")) {
            c.next();
            PyExpr annotation = parseTest(c);
            PyExpr value = null;
            if (c.peek().isOp("=")) {
                c.next();
                value = c.peek().isName("yield") ? parseYield(c) : parseTestListStarExpr(c);
            }
            return new AnnAssign(first, annotation, value, start.line(), c.lastLine());
        }
        if (c.peek().type() == PythonTokenType.OP && AUGMENTED_OPS.contains(c.peek().text())) {
            String op = c.next().text();
            PyExpr value = c.peek().isName("yield") ? parseYield(c) : parseTestListStarExpr(c);
            return new AugAssign(first, op, value, start.line(), c.lastLine());
        }
        if (c.peek().isOp("=")) {
            List<PyExpr> targets = new ArrayList<>();
            PyExpr value = first;
            while (c.peek().isOp("=")) {
                c.next();
                targets.add(value);
                value = c.peek().isName("yield") ? parseYield(c) : parseTestListStarExpr(c);
            }
            return new Assign(List.copyOf(targets), value, start.line(), c.lastLine());
        }
        return new ExprStmt(first, start.line(), c.lastLine());
    }

    private Import parseImport(Cursor c) {
        PythonToken start = c.expectName("import");
        List<Alias> names = new ArrayList<>();
        do {
            if (!names.isEmpty()) {
                c.next();
            }
            String name = parseDottedName(c);
            String asName = null;
            if (c.peek().isName("as")) {
                c.next();
                asName = c.expectIdentifier().text();
            }
            names.add(new Alias(name, asName));
        } while (c.peek().isOp(","));
        return new Import(List.copyOf(names), start.line(), c.lastLine());
    }

    private ImportFrom parseImportFrom(Cursor c) {
        PythonToken start = c.expectName("from");
        int level = 0;
        while (c.peek().isOp(".") || c.peek().isOp("...")) {
            level += c.next().text().length();
        }
        String module = null;
        if (!c.peek().isName("import")) {
            module = parseDottedName(c);
        }
        if (module == null && level == 0) {
            throw c.error("invalid syntax");
        }
        c.expectName("import");
        List<Alias> names = new ArrayList<>();
        if (c.peek().isOp("*")) {
            c.next();
            names.add(new Alias("*", null));
        } else {
            boolean parenthesized = c.peek().isOp("(");
            if (parenthesized) {
                c.next();
            }
            while (true) {
                String name = c.expectIdentifier().text();
                String asName = null;
                if (c.peek().isName("as")) {
                    c.next();
                    asName = c.expectIdentifier().text();
                }
                names.add(new Alias(name, asName));
                if (!c.peek().isOp(",")) {
                    break;
                }
                c.next();
                if (parenthesized && c.peek().isOp(")")) {
                    break;
                }
            }
            if (parenthesized) {
                c.expectOp(")");
            }
        }
        return new ImportFrom(module, level, List.copyOf(names), start.line(), c.lastLine());
    }

    private String parseDottedName(Cursor c) {
        StringBuilder name = new StringBuilder(c.expectIdentifier().text());
        while (c.peek().isOp(".")) {
            c.next();
            name.append('.').append(c.expectIdentifier().text());
        }
        return name.toString();
    }

    // ===== Expressions =====

    private PyExpr parseYield(Cursor c) {
        c.expectName("yield");
        if (c.peek().isName("from")) {
            c.next();
            return new Yield(parseTest(c), true);
        }
        if (atStatementEnd(c) || c.peek().isOp(")") || c.peek().isOp("=")) {
            return new Yield(null, false);
        }
        return new Yield(parseTestListStarExpr(c), false);
    }

    /**
     * Comma-separated tests or starred expressions; a tuple when a comma is present.
     */
    private PyExpr parseTestListStarExpr(Cursor c) {
        PyExpr first = parseTestOrStar(c);
        if (!c.peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (!startsExpression(c.peek())) {
                break;
            }
            elements.add(parseTestOrStar(c));
        }
        return new TupleExpr(List.copyOf(elements));
    }

    private PyExpr parseTestOrStar(Cursor c) {
        if (c.peek().isOp("*")) {
            c.next();
            return new Starred(parseBitOr(c));
        }
        return parseNamedExprTest(c);
    }

    /**
     * Assignment/for targets: bitwise-level expressions so that {@code in} terminates the list.
     */
    private PyExpr parseTargetList(Cursor c) {
        PyExpr first = parseTarget(c);
        if (!c.peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (!startsExpression(c.peek())) {
                break;
            }
            elements.add(parseTarget(c));
        }
        return new TupleExpr(List.copyOf(elements));
    }

    private PyExpr parseTarget(Cursor c) {
        if (c.peek().isOp("*")) {
            c.next();
            return new Starred(parseBitOr(c));
        }
        return parseBitOr(c);
    }

    private PyExpr parseNamedExprTest(Cursor c) {
        PyExpr expr = parseTest(c);
        if (c.peek().isOp(":=")) {
            if (!(expr instanceof Name)) {
                throw c.error("cannot use assignment expressions with this target");
            }
            c.next();
            return new NamedExpr(expr, parseTest(c));
        }
        return expr;
    }

    private PyExpr parseTest(Cursor c) {
        if (c.peek().isName("lambda")) {
            return parseLambda(c, true);
        }
        PyExpr body = parseOr(c);
        if (c.peek().isName("if")) {
            c.next();
            PyExpr test = parseOr(c);
            c.expectName("else");
            PyExpr orElse = parseTest(c);
            return new IfExp(test, body, orElse);
        }
        return body;
    }

    /**
     * Test without a conditional expression, used after {@code if} inside comprehensions.
     */
    private PyExpr parseTestNoCond(Cursor c) {
        if (c.peek().isName("lambda")) {
            return parseLambda(c, false);
        }
        return parseOr(c);
    }

    private PyExpr parseLambda(Cursor c, boolean allowConditional) {
        c.expectName("lambda");
        List<Param> params = parseParameters(c, ":", false);
        c.expectOp(":");
        PyExpr body = allowConditional ? parseTest(c) : parseTestNoCond(c);
        return new Lambda(params, body);
    }

    private PyExpr parseOr(Cursor c) {
        PyExpr first = parseAnd(c);
        if (!c.peek().isName("or")) {
            return first;
        }
        List<PyExpr> values = new ArrayList<>(List.of(first));
        while (c.peek().isName("or")) {
            c.next();
            values.add(parseAnd(c));
        }
        return new BoolOp("or", List.copyOf(values));
    }

    private PyExpr parseAnd(Cursor c) {
        PyExpr first = parseNot(c);
        if (!c.peek().isName("and")) {
            return first;
        }
        List<PyExpr> values = new ArrayList<>(List.of(first));
        while (c.peek().isName("and")) {
            c.next();
            values.add(parseNot(c));
        }
        return new BoolOp("and", List.copyOf(values));
    }

    private PyExpr parseNot(Cursor c) {
        if (c.peek().isName("not")) {
            c.next();
            return new UnaryOp("not", parseNot(c));
        }
        return parseComparison(c);
    }

    private PyExpr parseComparison(Cursor c) {
        PyExpr left = parseBitOr(c);
        List<String> ops = new ArrayList<>();
        List<PyExpr> comparators = new ArrayList<>();
        while (true) {
            PythonToken t = c.peek();
            String op;
            if (t.type() == PythonTokenType.OP && COMPARISON_OPS.contains(t.text())) {
                op = c.next().text();
            } else if (t.isName("in")) {
                c.next();
                op = "in";
            } else if (t.isName("not") && c.peekAt(1).isName("in")) {
                c.next();
                c.next();
                op = "not in";
            } else if (t.isName("is")) {
                c.next();
                if (c.peek().isName("not")) {
                    c.next();
                    op = "is not";
                } else {
                    op = "is";
                }
            } else {
                break;
            }
            ops.add(op);
            comparators.add(parseBitOr(c));
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new Compare(left, List.copyOf(ops), List.copyOf(comparators));
    }

    private PyExpr parseBitOr(Cursor c) {
        PyExpr left = parseBitXor(c);
        while (c.peek().isOp("|")) {
            c.next();
            left = new BinOp(left, "|", parseBitXor(c));
        }
        return left;
    }

    private PyExpr parseBitXor(Cursor c) {
        PyExpr left = parseBitAnd(c);
        while (c.peek().isOp("^")) {
            c.next();
            left = new BinOp(left, "^", parseBitAnd(c));
        }
        return left;
    }

    private PyExpr parseBitAnd(Cursor c) {
        PyExpr left = parseShift(c);
        while (c.peek().isOp("&")) {
            c.next();
            left = new BinOp(left, "&", parseShift(c));
        }
        return left;
    }

    private PyExpr parseShift(Cursor c) {
        PyExpr left = parseArith(c);
        while (c.peek().isOp("<<") || c.peek().isOp(">>")) {
            String op = c.next().text();
            left = new BinOp(left, op, parseArith(c));
        }
        return left;
    }

    private PyExpr parseArith(Cursor c) {
        PyExpr left = parseTerm(c);
        while (c.peek().isOp("+") || c.peek().isOp("-")) {
            String op = c.next().text();
            left = new BinOp(left, op, parseTerm(c));
        }
        return left;
    }

    private PyExpr parseTerm(Cursor c) {
        PyExpr left = parseFactor(c);
        while (c.peek().isOp("*") || c.peek().isOp("/") || c.peek().isOp("//")
                || c.peek().isOp("%") || c.peek().isOp("@")) {
            String op = c.next().text();
            left = new BinOp(left, op, parseFactor(c));
        }
        return left;
    }

    private PyExpr parseFactor(Cursor c) {
        if (c.peek().isOp("+") || c.peek().isOp("-") || c.peek().isOp("~")) {
            String op = c.next().text();
            return new UnaryOp(op, parseFactor(c));
        }
        return parsePower(c);
    }

    private PyExpr parsePower(Cursor c) {
        PyExpr base;
        if (c.peek().isName("await")) {
            c.next();
            base = new Await(parseAtomExpr(c));
        } else {
            base = parseAtomExpr(c);
        }
        if (c.peek().isOp("**")) {
            c.next();
            return new BinOp(base, "**", parseFactor(c));
        }
        return base;
    }

    private PyExpr parseAtomExpr(Cursor c) {
        PyExpr expr = parseAtom(c);
        while (true) {
            PythonToken t = c.peek();
            if (t.isOp("(")) {
                c.next();
                CallArguments arguments = parseArguments(c);
                c.expectOp(")");
                expr = new Call(expr, arguments.args(), arguments.keywords());
            } else if (t.isOp("[")) {
                c.next();
                PyExpr index = parseSubscriptList(c);
                c.expectOp("]");
                expr = new Subscript(expr, index);
            } else if (t.isOp(".")) {
                c.next();
                expr = new Attribute(expr, c.expectIdentifier().text());
            } else {
                return expr;
            }
        }
    }

    private record CallArguments(List<PyExpr> args, List<PyExpr.Keyword> keywords) {
    }

    private CallArguments parseArguments(Cursor c) {
        List<PyExpr> args = new ArrayList<>();
        List<PyExpr.Keyword> keywords = new ArrayList<>();
        while (!c.peek().isOp(")")) {
            if (c.peek().isOp("**")) {
                c.next();
                keywords.add(new PyExpr.Keyword(null, parseTest(c)));
            } else if (c.peek().isOp("*")) {
                c.next();
                args.add(new Starred(parseTest(c)));
            } else if (c.peek().type() == PythonTokenType.NAME && c.peekAt(1).isOp("=")) {
                String name = c.expectIdentifier().text();
                c.next();
                keywords.add(new PyExpr.Keyword(name, parseTest(c)));
            } else {
                PyExpr arg = parseNamedExprTest(c);
                if (c.peek().isName("for") || c.peek().isName("async")) {
                    arg = new Comprehension(ComprehensionKind.GENERATOR, arg, null, parseComprehensionFors(c));
                }
                args.add(arg);
            }
            if (!c.peek().isOp(",")) {
                break;
            }
            c.next();
        }
        return new CallArguments(List.copyOf(args), List.copyOf(keywords));
    }

    private PyExpr parseSubscriptList(Cursor c) {
        PyExpr first = parseSubscript(c);
        if (!c.peek().isOp(",")) {
            return first;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (c.peek().isOp("]")) {
                break;
            }
            elements.add(parseSubscript(c));
        }
        return new TupleExpr(List.copyOf(elements));
    }

    private PyExpr parseSubscript(Cursor c) {
        PyExpr lower = null;
        if (!c.peek().isOp(":")) {
            lower = parseTestOrStar(c);
            if (!c.peek().isOp(":")) {
                return lower;
            }
        }
        c.expectOp(":");
        PyExpr upper = null;
        if (!c.peek().isOp(":") && !c.peek().isOp("]") && !c.peek().isOp(",")) {
            upper = parseTest(c);
        }
        PyExpr step = null;
        if (c.peek().isOp(":")) {
            c.next();
            if (!c.peek().isOp("]") && !c.peek().isOp(",")) {
                step = parseTest(c);
            }
        }
        return new Slice(lower, upper, step);
    }

    private List<ComprehensionFor> parseComprehensionFors(Cursor c) {
        List<ComprehensionFor> generators = new ArrayList<>();
        while (c.peek().isName("for") || c.peek().isName("async")) {
            boolean async = false;
            if (c.peek().isName("async")) {
                c.next();
                async = true;
            }
            c.expectName("for");
            PyExpr target = parseTargetList(c);
            c.expectName("in");
            PyExpr iter = parseOr(c);
            List<PyExpr> conditions = new ArrayList<>();
            while (c.peek().isName("if")) {
                c.next();
                conditions.add(parseTestNoCond(c));
            }
            generators.add(new ComprehensionFor(target, iter, List.copyOf(conditions), async));
        }
        return List.copyOf(generators);
    }

    private PyExpr parseAtom(Cursor c) {
        PythonToken t = c.peek();
        switch (t.type()) {
            case NUMBER -> {
                c.next();
                return new Constant(Constant.Kind.NUMBER, t.text());
            }
            case STRING -> {
                StringBuilder text = new StringBuilder(c.next().text());
                while (c.atType(PythonTokenType.STRING)) {
                    text.append(' ').append(c.next().text());
                }
                return new Constant(Constant.Kind.STRING, text.toString());
            }
            case NAME -> {
                switch (t.text()) {
                    case "True" -> {
                        c.next();
                        return new Constant(Constant.Kind.TRUE, "True");
                    }
                    case "False" -> {
                        c.next();
                        return new Constant(Constant.Kind.FALSE, "False");
                    }
                    case "None" -> {
                        c.next();
                        return new Constant(Constant.Kind.NONE, "None");
                    }
                    default -> {
                        return new Name(c.expectIdentifier().text());
                    }
                }
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> {
                        return parseParenthesized(c);
                    }
                    case "[" -> {
                        return parseListDisplay(c);
                    }
                    case "{" -> {
                        return parseBraceDisplay(c);
                    }
                    case "..." -> {
                        c.next();
                        return new Constant(Constant.Kind.ELLIPSIS, "...");
                    }
                    default -> throw c.error("invalid syntax");
                }
            }
            default -> throw c.error("invalid syntax");
        }
    }

    private PyExpr parseParenthesized(Cursor c) {
        c.expectOp("(");
        if (c.peek().isOp(")")) {
            c.next();
            return new TupleExpr(List.of());
        }
        if (c.peek().isName("yield")) {
            PyExpr yield = parseYield(c);
            c.expectOp(")");
            return yield;
        }
        PyExpr first = parseTestOrStar(c);
        if (c.peek().isName("for") || c.peek().isName("async")) {
            PyExpr generator = new Comprehension(ComprehensionKind.GENERATOR, first, null, parseComprehensionFors(c));
            c.expectOp(")");
            return generator;
        }
        if (!c.peek().isOp(",")) {
            c.expectOp(")");
            return first;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (c.peek().isOp(")")) {
                break;
            }
            elements.add(parseTestOrStar(c));
        }
        c.expectOp(")");
        return new TupleExpr(List.copyOf(elements));
    }

    private PyExpr parseListDisplay(Cursor c) {
        c.expectOp("[");
        if (c.peek().isOp("]")) {
            c.next();
            return new ListExpr(List.of());
        }
        PyExpr first = parseTestOrStar(c);
        if (c.peek().isName("for") || c.peek().isName("async")) {
            PyExpr comprehension = new Comprehension(ComprehensionKind.LIST, first, null, parseComprehensionFors(c));
            c.expectOp("]");
            return comprehension;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (c.peek().isOp("]")) {
                break;
            }
            elements.add(parseTestOrStar(c));
        }
        c.expectOp("]");
        return new ListExpr(List.copyOf(elements));
    }

    private PyExpr parseBraceDisplay(Cursor c) {
        c.expectOp("{");
        if (c.peek().isOp("}")) {
            c.next();
            return new DictExpr(List.of(), List.of());
        }
        if (c.peek().isOp("**")) {
            return parseDictRest(c, null, null);
        }
        PyExpr first = parseTestOrStar(c);
        if (c.peek().isOp(":")) {
            c.next();
            PyExpr value = parseTest(c);
            if (c.peek().isName("for") || c.peek().isName("async")) {
                PyExpr comprehension = new Comprehension(ComprehensionKind.DICT, first, value,
                        parseComprehensionFors(c));
                c.expectOp("}");
                return comprehension;
            }
            return parseDictRest(c, first, value);
        }
        if (c.peek().isName("for") || c.peek().isName("async")) {
            PyExpr comprehension = new Comprehension(ComprehensionKind.SET, first, null, parseComprehensionFors(c));
            c.expectOp("}");
            return comprehension;
        }
        List<PyExpr> elements = new ArrayList<>(List.of(first));
        while (c.peek().isOp(",")) {
            c.next();
            if (c.peek().isOp("}")) {
                break;
            }
            elements.add(parseTestOrStar(c));
        }
        c.expectOp("}");
        return new SetExpr(List.copyOf(elements));
    }

    /**
     * Remaining dict entries after an optional already-parsed first entry.
     */
    private PyExpr parseDictRest(Cursor c, PyExpr firstKey, PyExpr firstValue) {
        List<PyExpr> keys = new ArrayList<>();
        List<PyExpr> values = new ArrayList<>();
        boolean needComma = false;
        if (firstValue != null) {
            keys.add(firstKey);
            values.add(firstValue);
            needComma = true;
        }
        while (!c.peek().isOp("}")) {
            if (needComma) {
                c.expectOp(",");
                if (c.peek().isOp("}")) {
                    break;
                }
            }
            if (c.peek().isOp("**")) {
                c.next();
                keys.add(null);
                values.add(parseBitOr(c));
            } else {
                keys.add(parseTest(c));
                c.expectOp(":");
                values.add(parseTest(c));
            }
            needComma = true;
        }
        c.expectOp("}");
        return new DictExpr(Collections.unmodifiableList(keys), List.copyOf(values));
    }

    private static boolean startsExpression(PythonToken t) {
        if (t.type() == PythonTokenType.NAME) {
            return !KEYWORDS.contains(t.text()) || Set.of("True", "False", "None", "not", "lambda", "await")
                    .contains(t.text());
        }
        if (t.type() == PythonTokenType.NUMBER || t.type() == PythonTokenType.STRING) {
            return true;
        }
        return t.type() == PythonTokenType.OP && Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(t.text());
    }

    private static int endOf(List<PyStmt> body, List<PyStmt> orElse) {
        return orElse.isEmpty() ? lastLine(body) : lastLine(orElse);
    }

    private static int lastLine(List<PyStmt> body) {
        return body.get(body.size() - 1).endLine();
    }

    private static final class Cursor {
        private final List<PythonToken> tokens;
        private int index;

        Cursor(List<PythonToken> tokens) {
            this.tokens = tokens;
        }

        PythonToken peek() {
            return tokens.get(Math.min(index, tokens.size() - 1));
        }

        PythonToken peekAt(int offset) {
            return tokens.get(Math.max(0, Math.min(index + offset, tokens.size() - 1)));
        }

        /**
         * Distance to the next token of {@code type}, or to EOF when there is none.
         */
        int offsetOf(PythonTokenType type) {
            for (int i = index; i < tokens.size(); i++) {
                if (tokens.get(i).type() == type) {
                    return i - index;
                }
            }
            return tokens.size() - 1 - index;
        }

        /**
         * Distance from the current opening bracket to its matching close.
         */
        int closingOffset() {
            int depth = 0;
            for (int i = index; i < tokens.size(); i++) {
                PythonToken t = tokens.get(i);
                if (t.type() != PythonTokenType.OP) {
                    continue;
                }
                if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                    depth++;
                } else if ((t.isOp(")") || t.isOp("]") || t.isOp("}")) && --depth == 0) {
                    return i - index;
                }
            }
            return tokens.size() - 1 - index;
        }

        boolean atType(PythonTokenType type) {
            return peek().type() == type;
        }

        PythonToken next() {
            PythonToken t = peek();
            if (index < tokens.size() - 1) {
                index++;
            }
            return t;
        }

        /**
         * Last line touched by the previously consumed token.
         */
        int lastLine() {
            return index == 0 ? 1 : tokens.get(index - 1).endLine();
        }

        PythonToken expectOp(String op) {
            if (!peek().isOp(op)) {
                throw error("expected '" + op + "'");
            }
            return next();
        }

        PythonToken expectName(String keyword) {
            if (!peek().isName(keyword)) {
                throw error("expected '" + keyword + "'");
            }
            return next();
        }

        PythonToken expectIdentifier() {
            PythonToken t = peek();
            if (t.type() != PythonTokenType.NAME || KEYWORDS.contains(t.text())) {
                throw error("invalid syntax");
            }
            return next();
        }

        PythonToken expectType(PythonTokenType type, String what) {
            if (!atType(type)) {
                throw error("expected " + what);
            }
            return next();
        }

        SourceParseException error(String message) {
            PythonToken t = peek();
            String near = t.text().isEmpty() ? t.type().name().toLowerCase(Locale.ROOT) : "'" + t.text() + "'";
            return new SourceParseException(message + " near " + near, t.line());
        }
    }
}
