package com.scanforge.infrastructure.rendering;

/**
 * How the detection fragment is taken from the source.
 */
public enum ExtractionRule {
    /** Body of the per-row loop in the scan function. */
    DETECTION_LOOP,
    /** One named column per detection-rule assignment. */
    PATTERN_RULES,
    /** Call to a recognized detector function with the ticker frame. */
    DETECTOR_CALL
}
