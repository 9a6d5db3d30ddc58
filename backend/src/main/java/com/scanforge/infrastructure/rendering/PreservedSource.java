package com.scanforge.infrastructure.rendering;

import java.util.List;
import java.util.Set;

/**
 * Source module prepared for embedding.
 *
 * @param code               source with the entry guard removed and helpers rewritten
 * @param boundImportNames   names bound by the module's top-level imports
 * @param importInsertLine   0-based line index where missing imports go (after any __future__ imports)
 * @param rewrittenHelpers   helpers that now take the parameter object as first argument
 */
public record PreservedSource(String code, Set<String> boundImportNames, int importInsertLine,
                              List<String> rewrittenHelpers) {

    public PreservedSource {
        boundImportNames = Set.copyOf(boundImportNames);
        rewrittenHelpers = List.copyOf(rewrittenHelpers);
    }
}
