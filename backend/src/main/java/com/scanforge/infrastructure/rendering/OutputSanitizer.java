package com.scanforge.infrastructure.rendering;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Final text boundary for generated code:
 * - markdown code fences removed
 * - narrative lines before the first code-opening line discarded
 * - line endings normalized, trailing blank lines trimmed
 */
@Component
public class OutputSanitizer {

    // ``` or ```python on a line of its own
    private static final Pattern FENCE = Pattern.compile("^\\s*```[\\w+-]*\\s*$");

    // Lines that can open a Python module
    private static final Pattern CODE_OPENING = Pattern.compile(
            "^(import\\s|from\\s|class\\s|def\\s|async\\s+def\\s|@|#|\"\"\"|''')"
    );

    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        // 1. Normalize line endings
        String normalized = text.replace("\r\n", "\n").replace("\r", "\n");

        // 2. Drop fence lines
        List<String> lines = normalized.lines()
                .filter(line -> !FENCE.matcher(line).matches())
                .toList();

        // 3. Skip narrative before the first code-opening line
        int first = 0;
        while (first < lines.size() && !CODE_OPENING.matcher(lines.get(first)).find()) {
            first++;
        }
        if (first == lines.size()) {
            first = 0;
        }

        // 4. Trim trailing blank lines
        return String.join("\n", lines.subList(first, lines.size())).stripTrailing() + "\n";
    }
}
