package com.scanforge.domain.transform.model;

public enum ValidationCategory {
    SYNTAX,
    STRUCTURE,
    IMPORTS,
    STYLE;

    /**
     * Style never fails an attempt.
     */
    public boolean isBlocking() {
        return this != STYLE;
    }
}
