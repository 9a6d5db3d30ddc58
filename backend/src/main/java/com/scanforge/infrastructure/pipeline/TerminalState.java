package com.scanforge.infrastructure.pipeline;

/**
 * How the generate/validate/correct loop ended.
 */
public enum TerminalState {
    /** The last artifact passed every blocking category. */
    SUCCESS,
    /** The attempt cap was reached while still failing. */
    EXHAUSTED,
    /** A failure no correction rule recognizes. */
    UNCORRECTABLE
}
