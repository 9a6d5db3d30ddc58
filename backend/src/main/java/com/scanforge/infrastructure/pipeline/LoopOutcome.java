package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.CorrectionRecord;
import com.scanforge.domain.transform.model.ValidationResult;
import com.scanforge.infrastructure.rendering.GenerationContext;
import com.scanforge.infrastructure.rendering.RenderedArtifact;

import java.util.List;

/**
 * Result of the self-correction loop. The artifact is the last one rendered, valid or not.
 *
 * @param attemptContexts the context each attempt rendered from, in order
 */
public record LoopOutcome(
        TerminalState state,
        RenderedArtifact artifact,
        List<ValidationResult> validationResults,
        List<CorrectionRecord> corrections,
        int attempts,
        List<GenerationContext> attemptContexts
) {
    public LoopOutcome {
        validationResults = List.copyOf(validationResults);
        corrections = List.copyOf(corrections);
        attemptContexts = List.copyOf(attemptContexts);
    }

    public boolean succeeded() {
        return state == TerminalState.SUCCESS;
    }
}
