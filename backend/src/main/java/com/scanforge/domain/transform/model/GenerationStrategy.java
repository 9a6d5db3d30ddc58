package com.scanforge.domain.transform.model;

public enum GenerationStrategy {
    /** Preserve a single-pattern standalone scanner. */
    HYBRID_PRESERVE,
    /** Preserve a multi-pattern scanner with label aggregation. */
    HYBRID_PRESERVE_MULTI,
    /** Minimal generic architecture around unrecognized code. */
    GENERIC_PRESERVE
}
