package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.PatternType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pipeline settings, bound from {@code transform.*}.
 */
@Data
@Validated
@ConfigurationProperties("transform")
public class TransformProperties {

    /** Generation attempts, first one included. */
    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private int maxSourceLength = 500_000;

    @NotNull
    private Map<PatternType, FallbackPolicy> fallbackPolicy = defaultPolicy();

    @Min(1)
    private int fetchWorkers = 4;

    @Min(1)
    private int detectWorkers = 4;

    @Min(1)
    private int lookbackDays = 1000;

    @Min(0)
    private int lookbackBufferDays = 50;

    @Valid
    private Generic generic = new Generic();

    @Data
    public static class Generic {
        /** Embed the source module for the generic strategy; false renders the bare template. */
        private boolean preserveSource = true;
    }

    public FallbackPolicy policyFor(PatternType type) {
        return fallbackPolicy.getOrDefault(type, FallbackPolicy.FAIL_FAST);
    }

    private static Map<PatternType, FallbackPolicy> defaultPolicy() {
        Map<PatternType, FallbackPolicy> policy = new EnumMap<>(PatternType.class);
        policy.put(PatternType.STANDALONE, FallbackPolicy.FALLBACK);
        policy.put(PatternType.MULTI, FallbackPolicy.FALLBACK);
        policy.put(PatternType.GENERIC, FallbackPolicy.FAIL_FAST);
        return policy;
    }
}
