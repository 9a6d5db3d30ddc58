package com.scanforge.infrastructure.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Tokenizer for Python 3 source.
 * <p>
 * Emits NEWLINE at the end of each logical line and INDENT/DEDENT on indentation changes. Comments, blank lines
 * and line breaks inside brackets or after a backslash are skipped. f-strings are kept as single STRING tokens;
 * their replacement fields may nest any string literal, including one using the enclosing quote (PEP 701).
 * </p>
 */
public final class PythonLexer {

    private static final String[] OPERATORS_3 = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] OPERATORS_2 = {
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@="
    };
    private static final String OPERATORS_1 = "+-*/%@&|^~<>()[]{},:.;=";

    private static final int TAB_SIZE = 8;

    private final String src;
    private final List<PythonToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<PythonToken> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;

    private PythonLexer(String src) {
        this.src = src;
    }

    public static List<PythonToken> tokenize(String source) {
        return new PythonLexer(source).run();
    }

    private List<PythonToken> run() {
        indents.push(0);
        boolean atLineStart = true;

        while (true) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    break;
                }
                atLineStart = false;
            }
            if (pos >= src.length()) {
                break;
            }

            char c = src.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '#') {
                skipToLineEnd();
                continue;
            }
            if (c == '\\') {
                int next = pos + 1;
                if (next < src.length() && (src.charAt(next) == '\n' || src.charAt(next) == '\r')) {
                    pos = next;
                    consumeLineBreak();
                    continue;
                }
                throw error("unexpected character after line continuation character");
            }
            if (c == '\n' || c == '\r') {
                int breakLine = line;
                int breakColumn = pos - lineStart;
                int breakStart = pos;
                consumeLineBreak();
                if (brackets.isEmpty()) {
                    addNewline(breakLine, breakColumn, breakStart);
                    atLineStart = true;
                }
                continue;
            }
            if (isStringStart()) {
                readString();
                continue;
            }
            if (Character.isLetter(c) || c == '_' || (c > 127 && Character.isUnicodeIdentifierStart(c))) {
                readName();
                continue;
            }
            boolean leadingDot = c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1));
            if (Character.isDigit(c) || leadingDot) {
                readNumber();
                continue;
            }
            readOperator();
        }

        if (!brackets.isEmpty()) {
            PythonToken open = brackets.peek();
            throw new SourceParseException("'" + open.text() + "' was never closed", open.line());
        }
        addNewline(line, pos - lineStart, pos);
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new PythonToken(PythonTokenType.DEDENT, "", line, line, 0, pos, pos));
        }
        tokens.add(new PythonToken(PythonTokenType.EOF, "", line, line, 0, pos, pos));
        return tokens;
    }

    /**
     * Measures the indentation of the next non-blank line and emits INDENT/DEDENT tokens.
     * Returns false at end of input.
     */
    private boolean readIndentation() {
        while (true) {
            int column = 0;
            int i = pos;
            while (i < src.length()) {
                char c = src.charAt(i);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                i++;
            }
            if (i >= src.length()) {
                pos = i;
                return false;
            }
            char c = src.charAt(i);
            if (c == '#' || c == '\n' || c == '\r') {
                pos = i;
                skipToLineEnd();
                if (pos < src.length()) {
                    consumeLineBreak();
                }
                continue;
            }

            pos = i;
            int current = indents.peek();
            if (column > current) {
                indents.push(column);
                tokens.add(new PythonToken(PythonTokenType.INDENT, "", line, line, column, pos, pos));
            } else if (column < current) {
                while (column < indents.peek()) {
                    indents.pop();
                    tokens.add(new PythonToken(PythonTokenType.DEDENT, "", line, line, column, pos, pos));
                }
                if (column != indents.peek()) {
                    throw error("unindent does not match any outer indentation level");
                }
            }
            return true;
        }
    }

    private void addNewline(int atLine, int column, int offset) {
        if (tokens.isEmpty()) {
            return;
        }
        PythonTokenType last = tokens.get(tokens.size() - 1).type();
        if (last == PythonTokenType.NEWLINE || last == PythonTokenType.INDENT || last == PythonTokenType.DEDENT) {
            return;
        }
        tokens.add(new PythonToken(PythonTokenType.NEWLINE, "", atLine, atLine, column, offset, offset));
    }

    private void skipToLineEnd() {
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void consumeLineBreak() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
            pos += 2;
        } else {
            pos++;
        }
        line++;
        lineStart = pos;
    }

    private boolean isStringStart() {
        int i = pos;
        int prefix = 0;
        while (i < src.length() && prefix < 2 && "rRbBuUfF".indexOf(src.charAt(i)) >= 0) {
            i++;
            prefix++;
        }
        if (i >= src.length()) {
            return false;
        }
        char q = src.charAt(i);
        if (q != '"' && q != '\'') {
            return false;
        }
        if (prefix == 2) {
            String p = src.substring(pos, pos + 2).toLowerCase(Locale.ROOT);
            return p.equals("rb") || p.equals("br") || p.equals("rf") || p.equals("fr");
        }
        return true;
    }

    private void readString() {
        int start = pos;
        int startLine = line;
        int startColumn = pos - lineStart;
        scanString(startLine);
        tokens.add(new PythonToken(PythonTokenType.STRING, src.substring(start, pos),
                startLine, line, startColumn, start, pos));
    }

    private void scanString(int startLine) {
        boolean format = false;
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            format |= src.charAt(pos) == 'f' || src.charAt(pos) == 'F';
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= src.length()) {
                throw new SourceParseException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < src.length()) {
                    if (src.charAt(pos) == '\n' || src.charAt(pos) == '\r') {
                        consumeLineBreak();
                    } else {
                        pos++;
                    }
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new SourceParseException("unterminated string literal", startLine);
                }
                consumeLineBreak();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
            }
            if (format && (c == '{' || c == '}')) {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == c) {
                    pos += 2;
                } else if (c == '{') {
                    skipReplacementField(startLine);
                } else {
                    pos++;
                }
                continue;
            }
            pos++;
        }
    }

    /**
     * Skips {@code {expr!r:spec}} starting at its opening brace. Nested brackets, string literals and format
     * spec fields are balanced; line breaks are allowed anywhere inside the field.
     */
    private void skipReplacementField(int startLine) {
        pos++;
        int depth = 0;
        while (true) {
            if (pos >= src.length()) {
                throw new SourceParseException("f-string: expecting '}'", startLine);
            }
            char c = src.charAt(pos);
            if (c == '\n' || c == '\r') {
                consumeLineBreak();
            } else if (isStringStart()) {
                scanString(startLine);
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                    pos++;
                }
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                pos++;
            } else if (c == ')' || c == ']') {
                depth--;
                pos++;
            } else if (c == '}') {
                pos++;
                if (depth == 0) {
                    return;
                }
                depth--;
            } else if (c == ':' && depth == 0) {
                pos++;
                skipFormatSpec(startLine);
                return;
            } else if (c == '!' && depth == 0 && pos + 1 < src.length() && src.charAt(pos + 1) != '=') {
                pos += 2;
            } else {
                pos++;
            }
        }
    }

    private void skipFormatSpec(int startLine) {
        while (true) {
            if (pos >= src.length()) {
                throw new SourceParseException("f-string: expecting '}'", startLine);
            }
            char c = src.charAt(pos);
            if (c == '{') {
                skipReplacementField(startLine);
            } else if (c == '}') {
                pos++;
                return;
            } else if (c == '\n' || c == '\r') {
                consumeLineBreak();
            } else {
                pos++;
            }
        }
    }

    private void readName() {
        int start = pos;
        pos++;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || (c > 127 && Character.isUnicodeIdentifierPart(c))) {
                pos++;
            } else {
                break;
            }
        }
        add(PythonTokenType.NAME, start);
    }

    private void readNumber() {
        int start = pos;
        char first = src.charAt(pos);
        if (first == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            add(PythonTokenType.NUMBER, start);
            return;
        }
        skipDigits();
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            skipDigits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                skipDigits();
            } else {
                pos = mark;
            }
        }
        if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
            pos++;
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("invalid decimal literal");
        }
        add(PythonTokenType.NUMBER, start);
    }

    private void skipDigits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readOperator() {
        int start = pos;
        for (String op : OPERATORS_3) {
            if (src.startsWith(op, pos)) {
                pos += 3;
                add(PythonTokenType.OP, start);
                return;
            }
        }
        for (String op : OPERATORS_2) {
            if (src.startsWith(op, pos)) {
                pos += 2;
                add(PythonTokenType.OP, start);
                return;
            }
        }
        char c = src.charAt(pos);
        if (OPERATORS_1.indexOf(c) < 0) {
            throw error("invalid character '" + c + "'");
        }
        pos++;
        PythonToken token = add(PythonTokenType.OP, start);
        if (c == '(' || c == '[' || c == '{') {
            brackets.push(token);
        } else if (c == ')' || c == ']' || c == '}') {
            if (brackets.isEmpty()) {
                throw error("unmatched '" + c + "'");
            }
            PythonToken open = brackets.pop();
            if (!matches(open.text().charAt(0), c)) {
                throw error("closing parenthesis '" + c + "' does not match opening parenthesis '"
                        + open.text() + "'");
            }
        }
    }

    private static boolean matches(char open, char close) {
        return (open == '(' && close == ')') || (open == '[' && close == ']') || (open == '{' && close == '}');
    }

    private PythonToken add(PythonTokenType type, int start) {
        PythonToken token = new PythonToken(type, src.substring(start, pos), line, line, start - lineStart, start, pos);
        tokens.add(token);
        return token;
    }

    private SourceParseException error(String message) {
        return new SourceParseException(message, line);
    }
}
