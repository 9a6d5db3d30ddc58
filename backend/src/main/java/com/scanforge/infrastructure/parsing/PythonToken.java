package com.scanforge.infrastructure.parsing;

/**
 * Lexical token with its position in the source text.
 *
 * @param type    token kind
 * @param text    exact source text (empty for INDENT/DEDENT/EOF)
 * @param line    1-based line of the first character
 * @param endLine 1-based line of the last character (differs from line for multi-line strings)
 * @param column  0-based column of the first character
 * @param start   source offset of the first character
 * @param end     source offset one past the last character
 */
public record PythonToken(PythonTokenType type, String text, int line, int endLine, int column, int start, int end) {

    public boolean is(PythonTokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOp(String op) {
        return is(PythonTokenType.OP, op);
    }

    public boolean isName(String name) {
        return is(PythonTokenType.NAME, name);
    }
}
