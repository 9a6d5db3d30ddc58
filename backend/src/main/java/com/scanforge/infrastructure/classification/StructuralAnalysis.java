package com.scanforge.infrastructure.classification;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;

import java.util.List;
import java.util.Optional;

/**
 * Parsed source plus everything the classifier found in it.
 */
public record StructuralAnalysis(
        PyModule module,
        ClassificationResult classification,
        Optional<ConfigLiteral> configLiteral,
        List<PatternAssignment> patternAssignments,
        Optional<PyStmt.If> entryGuard
) {
    public StructuralAnalysis {
        patternAssignments = List.copyOf(patternAssignments);
    }
}
