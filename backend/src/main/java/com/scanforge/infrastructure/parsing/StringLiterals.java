package com.scanforge.infrastructure.parsing;

/**
 * Decoding and quoting of Python string literals.
 */
public final class StringLiterals {

    private StringLiterals() {
    }

    /**
     * Decodes one or more adjacent literals (as they appear in source) into their concatenated value.
     * f-string replacement fields are kept verbatim.
     */
    public static String decode(String literalText) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        int n = literalText.length();
        while (i < n) {
            char c = literalText.charAt(i);
            if (Character.isWhitespace(c) || c == '\\') {
                i++;
                continue;
            }
            boolean raw = false;
            while (i < n && "rRbBuUfF".indexOf(literalText.charAt(i)) >= 0) {
                if (literalText.charAt(i) == 'r' || literalText.charAt(i) == 'R') {
                    raw = true;
                }
                i++;
            }
            if (i >= n) {
                break;
            }
            char quote = literalText.charAt(i);
            boolean triple = i + 2 < n && literalText.charAt(i + 1) == quote && literalText.charAt(i + 2) == quote;
            i += triple ? 3 : 1;
            while (i < n) {
                char ch = literalText.charAt(i);
                if (ch == '\\' && i + 1 < n) {
                    char next = literalText.charAt(i + 1);
                    if (raw) {
                        out.append(ch).append(next);
                    } else {
                        appendEscape(out, next);
                    }
                    i += 2;
                    continue;
                }
                if (ch == quote) {
                    if (!triple) {
                        i++;
                        break;
                    }
                    if (i + 2 < n && literalText.charAt(i + 1) == quote && literalText.charAt(i + 2) == quote) {
                        i += 3;
                        break;
                    }
                }
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private static void appendEscape(StringBuilder out, char next) {
        switch (next) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case '0' -> out.append('\0');
            case '\\' -> out.append('\\');
            case '\'' -> out.append('\'');
            case '"' -> out.append('"');
            case '\n' -> {
                // line continuation inside a literal
            }
            default -> out.append('\\').append(next);
        }
    }

    /**
     * Double-quoted Python literal for {@code value}.
     */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
