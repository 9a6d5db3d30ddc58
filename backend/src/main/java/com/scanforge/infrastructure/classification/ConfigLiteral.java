package com.scanforge.infrastructure.classification;

import com.scanforge.infrastructure.parsing.PyStmt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Module-level configuration dictionary, e.g. {@code P = {"price_min": 8.0, ...}}.
 *
 * @param name      variable the literal is bound to
 * @param statement the binding statement
 * @param entries   literal values by key; nested structures are kept as source text, None as null
 */
public record ConfigLiteral(String name, PyStmt.Assign statement, Map<String, Object> entries) {

    public ConfigLiteral {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public int line() {
        return statement.line();
    }
}
