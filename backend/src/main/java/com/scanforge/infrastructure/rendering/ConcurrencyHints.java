package com.scanforge.infrastructure.rendering;

/**
 * Worker pool sizes baked into the generated scanner.
 */
public record ConcurrencyHints(int fetchWorkers, int detectWorkers) {

    public ConcurrencyHints {
        if (fetchWorkers < 1 || detectWorkers < 1) {
            throw new IllegalArgumentException("worker counts must be positive");
        }
    }
}
