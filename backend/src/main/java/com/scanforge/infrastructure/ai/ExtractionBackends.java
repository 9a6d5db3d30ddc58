package com.scanforge.infrastructure.ai;

import java.util.List;

/**
 * Backends in the order they are tried.
 */
public record ExtractionBackends(LlmBackend primary, LlmBackend fallback) {

    public List<LlmBackend> inOrder() {
        return fallback == null ? List.of(primary) : List.of(primary, fallback);
    }
}
