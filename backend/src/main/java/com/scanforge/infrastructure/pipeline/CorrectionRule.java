package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.ValidationResult;
import com.scanforge.infrastructure.rendering.ContextAdjustments;
import com.scanforge.infrastructure.rendering.GenerationContext;
import com.scanforge.infrastructure.rendering.RenderedArtifact;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One entry of the correction table: recognizes a failure and produces the context change that fixes it.
 *
 * @param name   error type recorded in the correction record
 * @param action returns a correction when the rule applies to the failed attempt
 */
public record CorrectionRule(String name, Function<FailedAttempt, Optional<Correction>> action) {

    /**
     * Everything a rule may inspect about a failed attempt.
     */
    public record FailedAttempt(int attemptNumber, GenerationContext context, RenderedArtifact artifact,
                                List<ValidationResult> results, List<String> errors) {
    }

    /**
     * @param adjustments context change for the next attempt
     * @param trigger     the error the rule reacted to
     * @param fix         human-readable description of the change
     */
    public record Correction(ContextAdjustments adjustments, String trigger, String fix) {
    }

    public Optional<Correction> apply(FailedAttempt attempt) {
        return action.apply(attempt);
    }
}
