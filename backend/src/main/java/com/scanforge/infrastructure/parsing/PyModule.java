package com.scanforge.infrastructure.parsing;

import java.util.List;
import java.util.Optional;

/**
 * Parsed Python module together with the tokens and source it came from.
 */
public record PyModule(String source, List<PythonToken> tokens, List<PyStmt> body) {

    public List<PyStmt.FunctionDef> functions() {
        return body.stream()
                .filter(PyStmt.FunctionDef.class::isInstance)
                .map(PyStmt.FunctionDef.class::cast)
                .toList();
    }

    public List<PyStmt.ClassDef> classes() {
        return body.stream()
                .filter(PyStmt.ClassDef.class::isInstance)
                .map(PyStmt.ClassDef.class::cast)
                .toList();
    }

    public Optional<PyStmt.FunctionDef> function(String name) {
        return functions().stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * Source lines, without line terminators. Index 0 is line 1.
     */
    public List<String> lines() {
        return List.of(source.split("\\r?\\n", -1));
    }
}
