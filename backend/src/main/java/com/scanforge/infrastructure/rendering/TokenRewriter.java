package com.scanforge.infrastructure.rendering;

import com.scanforge.infrastructure.parsing.PythonToken;
import com.scanforge.infrastructure.parsing.PythonTokenType;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-level rewrites shared by source preservation and fragment extraction. Every method only records edits
 * for tokens whose line lies within {@code [fromLine, toLine]}.
 */
final class TokenRewriter {

    private static final Pattern FORMAT_FIELD = Pattern.compile("\\{[^{}]*}");
    private static final Pattern STRING_PREFIX = Pattern.compile("^([A-Za-z]*)['\"]");

    private final List<PythonToken> tokens;
    private final SourceEdits edits;

    TokenRewriter(List<PythonToken> tokens, SourceEdits edits) {
        this.tokens = tokens;
        this.edits = edits;
    }

    /**
     * Renames free-standing identifiers. Attribute names ({@code x.name}) and keyword-argument names
     * ({@code f(name=1)}) are left alone; names inside f-string replacement fields are renamed too.
     */
    void renameNames(int fromLine, int toLine, Map<String, String> renames) {
        for (int i = 0; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (!inRange(token, fromLine, toLine)) {
                continue;
            }
            if (token.type() == PythonTokenType.NAME && renames.containsKey(token.text())
                    && !isAttributeName(i) && !isKeywordArgument(i)) {
                edits.replace(token.start(), token.end(), renames.get(token.text()));
            } else if (token.type() == PythonTokenType.STRING && isFormatString(token)) {
                String rewritten = renameInFormatFields(token.text(), renames);
                if (!rewritten.equals(token.text())) {
                    edits.replace(token.start(), token.end(), rewritten);
                }
            }
        }
    }

    /**
     * Inserts {@code argument} as the first argument of every call to one of {@code functions}.
     */
    void insertLeadingArgument(int fromLine, int toLine, Set<String> functions, String argument) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (!inRange(token, fromLine, toLine) || token.type() != PythonTokenType.NAME
                    || !functions.contains(token.text()) || isAttributeName(i) || isDefinitionName(i)) {
                continue;
            }
            PythonToken open = tokens.get(i + 1);
            if (!open.isOp("(")) {
                continue;
            }
            boolean empty = i + 2 < tokens.size() && tokens.get(i + 2).isOp(")");
            edits.insert(open.end(), empty ? argument : argument + ", ");
        }
    }

    /**
     * Inserts {@code parameter} as the first parameter of the function whose name token starts at
     * {@code nameOffset}.
     */
    void insertLeadingParameter(int nameOffset, String parameter) {
        for (int i = 0; i + 2 < tokens.size(); i++) {
            if (tokens.get(i).start() == nameOffset && tokens.get(i + 1).isOp("(")) {
                boolean empty = tokens.get(i + 2).isOp(")");
                edits.insert(tokens.get(i + 1).end(), empty ? parameter : parameter + ", ");
                return;
            }
        }
        throw new RenderException("No parameter list found for function at offset " + nameOffset);
    }

    /**
     * Lowercases string keys of {@code x["Key"]} subscripts and {@code x.get("Key")} lookups whose receiver chain
     * is rooted at one of {@code frames}; lookups on any other receiver keep their keys.
     */
    void lowercaseKeys(int fromLine, int toLine, Set<String> frames) {
        for (int i = 1; i + 1 < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (!inRange(token, fromLine, toLine) || token.type() != PythonTokenType.STRING
                    || isFormatString(token)) {
                continue;
            }
            PythonToken before = tokens.get(i - 1);
            PythonToken after = tokens.get(i + 1);
            int receiverEnd;
            if (before.isOp("[") && after.isOp("]")) {
                receiverEnd = i - 2;
            } else if (before.isOp("(") && (after.isOp(")") || after.isOp(",")) && i >= 3
                    && tokens.get(i - 2).isName("get") && tokens.get(i - 3).isOp(".")) {
                receiverEnd = i - 4;
            } else {
                continue;
            }
            String root = receiverRoot(receiverEnd);
            if (root == null || !frames.contains(root)) {
                continue;
            }
            String lowered = token.text().toLowerCase(Locale.ROOT);
            if (!lowered.equals(token.text())) {
                edits.replace(token.start(), token.end(), lowered);
            }
        }
    }

    /**
     * Walks back from the last token of a receiver expression through {@code .attr}, {@code [...]} and
     * {@code (...)} to the name it starts with; null when it starts with anything else.
     */
    private String receiverRoot(int index) {
        int i = index;
        while (i >= 0) {
            PythonToken token = tokens.get(i);
            if (token.isOp("]") || token.isOp(")")) {
                i = matchingOpen(i);
                if (i <= 0) {
                    return null;
                }
                i--;
            } else if (token.type() == PythonTokenType.NAME) {
                if (i > 0 && tokens.get(i - 1).isOp(".")) {
                    i -= 2;
                } else {
                    return token.text();
                }
            } else {
                return null;
            }
        }
        return null;
    }

    private int matchingOpen(int closeIndex) {
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            PythonToken token = tokens.get(i);
            if (token.isOp("]") || token.isOp(")") || token.isOp("}")) {
                depth++;
            } else if (token.isOp("[") || token.isOp("(") || token.isOp("{")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean inRange(PythonToken token, int fromLine, int toLine) {
        return token.line() >= fromLine && token.line() <= toLine;
    }

    private boolean isAttributeName(int index) {
        return index > 0 && tokens.get(index - 1).isOp(".");
    }

    private boolean isDefinitionName(int index) {
        return index > 0 && (tokens.get(index - 1).isName("def") || tokens.get(index - 1).isName("class"));
    }

    private boolean isKeywordArgument(int index) {
        if (index == 0 || index + 1 >= tokens.size() || !tokens.get(index + 1).isOp("=")) {
            return false;
        }
        PythonToken before = tokens.get(index - 1);
        return before.isOp("(") || before.isOp(",");
    }

    private static boolean isFormatString(PythonToken token) {
        Matcher prefix = STRING_PREFIX.matcher(token.text());
        return prefix.find() && prefix.group(1).toLowerCase(Locale.ROOT).contains("f");
    }

    private static String renameInFormatFields(String text, Map<String, String> renames) {
        if (renames.isEmpty()) {
            return text;
        }
        Pattern names = Pattern.compile("(?<![.\\w])(" + renames.keySet().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|")) + ")\\b");
        Matcher field = FORMAT_FIELD.matcher(text);
        StringBuilder out = new StringBuilder();
        while (field.find()) {
            Matcher name = names.matcher(field.group());
            StringBuilder replaced = new StringBuilder();
            while (name.find()) {
                name.appendReplacement(replaced, Matcher.quoteReplacement(renames.get(name.group(1))));
            }
            name.appendTail(replaced);
            field.appendReplacement(out, Matcher.quoteReplacement(replaced.toString()));
        }
        field.appendTail(out);
        return out.toString();
    }
}
