package com.scanforge.infrastructure.rendering;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Changes requested by self-correction, accumulated across attempts. Never touches extracted parameters.
 *
 * @param additionalImports import statements to add
 * @param methodStubs       method names to add as stubs on the scanner class
 * @param fragmentOverride  replacement detection fragment, or null
 */
public record ContextAdjustments(List<String> additionalImports, List<String> methodStubs,
                                 DetectionFragment fragmentOverride) {

    public ContextAdjustments {
        additionalImports = List.copyOf(additionalImports);
        methodStubs = List.copyOf(methodStubs);
    }

    public static ContextAdjustments none() {
        return new ContextAdjustments(List.of(), List.of(), null);
    }

    public static ContextAdjustments imports(List<String> statements) {
        return new ContextAdjustments(statements, List.of(), null);
    }

    public static ContextAdjustments stubs(List<String> methods) {
        return new ContextAdjustments(List.of(), methods, null);
    }

    public static ContextAdjustments fragment(DetectionFragment fragment) {
        return new ContextAdjustments(List.of(), List.of(), fragment);
    }

    public ContextAdjustments merge(ContextAdjustments other) {
        LinkedHashSet<String> imports = new LinkedHashSet<>(additionalImports);
        imports.addAll(other.additionalImports());
        LinkedHashSet<String> stubs = new LinkedHashSet<>(methodStubs);
        stubs.addAll(other.methodStubs());
        DetectionFragment fragment = other.fragmentOverride() != null ? other.fragmentOverride() : fragmentOverride;
        return new ContextAdjustments(new ArrayList<>(imports), new ArrayList<>(stubs), fragment);
    }

    public boolean isEmpty() {
        return additionalImports.isEmpty() && methodStubs.isEmpty() && fragmentOverride == null;
    }
}
