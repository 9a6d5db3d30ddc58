package com.scanforge.infrastructure.rendering;

import java.util.List;

/**
 * Block of Python statements placed inside the generated detection method, without leading indentation.
 *
 * @param code         statements, one per line, relative indentation preserved
 * @param origin       what produced it, e.g. {@code scan_symbol loop (lines 40-58)}
 * @param placeholder  true for the no-op stand-in
 * @param patternNames detection-rule column names defined by this fragment (PATTERN_RULES only)
 */
public record DetectionFragment(String code, String origin, boolean placeholder, List<String> patternNames) {

    public static final String PLACEHOLDER_COMMENT = "# Pattern logic preserved from original scanner";

    public DetectionFragment {
        patternNames = List.copyOf(patternNames);
    }

    public static DetectionFragment placeholder(String reason, List<String> notes) {
        StringBuilder code = new StringBuilder(PLACEHOLDER_COMMENT).append('\n');
        for (String note : notes) {
            code.append("# ").append(note.replace('\n', ' ').replace('\r', ' ')).append('\n');
        }
        code.append("pass");
        return new DetectionFragment(code.toString(), reason, true, List.of());
    }

    public int lineCount() {
        return (int) code.lines().count();
    }
}
