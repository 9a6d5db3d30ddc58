package com.scanforge.domain.transform.model;

/**
 * Structural shape of an input scanner script.
 */
public enum PatternType {
    STANDALONE,
    MULTI,
    GENERIC
}
