package com.scanforge.infrastructure.pipeline;

/**
 * What the pipeline does when semantic extraction fails for a given classification.
 */
public enum FallbackPolicy {
    /** Abort the transformation. */
    FAIL_FAST,
    /** Continue with a minimal synthesized specification. */
    FALLBACK
}
