package com.scanforge.domain.transform.model;

/**
 * A single extracted threshold.
 *
 * @param value      number, boolean, string or null
 * @param units      optional units label
 * @param provenance where the value came from, e.g. {@code extractor:primary} or {@code source:line 31}
 */
public record ParameterValue(Object value, String units, String provenance) {
}
