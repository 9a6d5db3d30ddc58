package com.scanforge.domain.transform.model;

import java.util.Arrays;
import java.util.Locale;

public enum StrategyType {
    TREND_FOLLOWING,
    MEAN_REVERSION,
    MOMENTUM,
    GAP,
    BREAKOUT,
    LIQUIDITY,
    PATTERN,
    OTHER;

    /**
     * Lenient lookup for labels such as "mean_reversion" or "Mean Reversion". Unknown labels map to OTHER.
     */
    public static StrategyType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst()
                .orElse(OTHER);
    }
}
