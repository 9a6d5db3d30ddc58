package com.scanforge.domain.transform.model;

public enum ParameterCategory {
    PRICE("price_thresholds"),
    VOLUME("volume_thresholds"),
    GAP("gap_thresholds"),
    PERIOD("period_thresholds"),
    OTHER("other_parameters");

    private final String jsonKey;

    ParameterCategory(String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String jsonKey() {
        return jsonKey;
    }
}
