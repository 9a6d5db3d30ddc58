package com.scanforge.infrastructure.pipeline;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a free-form name into a PascalCase Python class name ending in {@code Scanner}.
 */
public final class ScannerNameFormatter {

    private static final String SUFFIX = "Scanner";
    private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z0-9])(?=[A-Z])");

    private ScannerNameFormatter() {
    }

    /**
     * @param proposedName caller-supplied name, may be blank
     * @param fallbackName specification name, used when no name was proposed
     */
    public static String format(String proposedName, String fallbackName) {
        String raw = proposedName != null && !proposedName.isBlank() ? proposedName : fallbackName;
        String name = raw == null ? "" : Arrays.stream(SEPARATORS.split(raw.strip()))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining());
        if (name.isEmpty()) {
            return "Generated" + SUFFIX;
        }
        if (Character.isDigit(name.charAt(0))) {
            name = SUFFIX + name;
        }
        return name.endsWith(SUFFIX) ? name : name + SUFFIX;
    }
}
