package com.scanforge.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes submitted source before classification:
 * - byte order mark and zero-width character removal
 * - control character removal (tabs and line breaks kept)
 * - {@code \r\n} and {@code \r} to {@code \n}
 * - tabs, spaces and blank lines are left as they are; indentation is significant
 */
@Component
public class SourceNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n, \r, \t and form feed
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0E-\\x1F\\x7F]"
    );

    /**
     * @param source raw submitted source
     * @return source ready for the tokenizer
     */
    public String normalize(String source) {
        if (source == null || source.isEmpty()) {
            return source;
        }

        // 1. Remove invisible characters (including a leading BOM)
        String result = INVISIBLE_CHARS.matcher(source).replaceAll("");

        // 2. Remove control characters
        result = CONTROL_CHARS.matcher(result).replaceAll("");

        // 3. Normalize line endings
        result = result.replace("\r\n", "\n").replace("\r", "\n");

        // 4. Single trailing newline
        return result.stripTrailing() + "\n";
    }
}
