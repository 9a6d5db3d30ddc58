package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.CorrectionRecord;
import com.scanforge.domain.transform.model.ValidationResult;
import com.scanforge.infrastructure.rendering.CodeRenderer;
import com.scanforge.infrastructure.rendering.ContextAdjustments;
import com.scanforge.infrastructure.rendering.DetectionFragment;
import com.scanforge.infrastructure.rendering.GenerationContext;
import com.scanforge.infrastructure.rendering.RenderedArtifact;
import com.scanforge.infrastructure.validation.CodeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bounded generate, validate, correct loop.
 * <p>
 * Generating → Validating → (Success | Correcting → Generating) until the attempt cap. Failures are matched
 * against {@link #RULES} in order; the first rule that produces a correction is applied, and a failure no rule
 * recognizes stops the loop at once.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SelfCorrectionController {

    private static final Pattern SYNTAX_LINE = Pattern.compile("^Syntax error at line (\\d+):");

    // Module -> import statement binding the alias the skeleton uses
    private static final Map<String, String> IMPORT_STATEMENTS = Map.of(
            "pandas", "import pandas as pd",
            "numpy", "import numpy as np",
            "pandas_market_calendars", "import pandas_market_calendars as mcal"
    );

    static final List<CorrectionRule> RULES = List.of(
            new CorrectionRule("missing_imports", SelfCorrectionController::missingImports),
            new CorrectionRule("missing_methods", SelfCorrectionController::missingMethods),
            new CorrectionRule("fragment_syntax", SelfCorrectionController::fragmentSyntax)
    );

    private final CodeRenderer renderer;
    private final CodeValidator validator;
    private final TransformProperties properties;

    public LoopOutcome run(GenerationContext base) {
        int maxAttempts = properties.getMaxAttempts();
        List<CorrectionRecord> corrections = new ArrayList<>();
        List<GenerationContext> contexts = new ArrayList<>();
        GenerationContext context = base;

        for (int attempt = 1; ; attempt++) {
            // 1. Generate
            contexts.add(context);
            RenderedArtifact artifact = renderer.render(context);

            // 2. Validate
            List<ValidationResult> results = validator.validate(artifact.code(), artifact.className());
            if (CodeValidator.isValid(results)) {
                log.debug("[Correction] attempt {} passed validation", attempt);
                return new LoopOutcome(TerminalState.SUCCESS, artifact, results, corrections, attempt, contexts);
            }
            List<String> errors = results.stream().flatMap(r -> r.errors().stream()).toList();
            if (attempt >= maxAttempts) {
                log.warn("[Correction] attempt cap {} reached, errors={}", maxAttempts, errors);
                return new LoopOutcome(TerminalState.EXHAUSTED, artifact, results, corrections, attempt, contexts);
            }

            // 3. Correct
            CorrectionRule.FailedAttempt failed =
                    new CorrectionRule.FailedAttempt(attempt, context, artifact, results, errors);
            Optional<CorrectionRecord> applied = Optional.empty();
            for (CorrectionRule rule : RULES) {
                Optional<CorrectionRule.Correction> correction = rule.apply(failed);
                if (correction.isPresent()) {
                    CorrectionRule.Correction c = correction.get();
                    context = context.withAdjustments(c.adjustments());
                    applied = Optional.of(new CorrectionRecord(attempt, rule.name(), c.trigger(), c.fix()));
                    break;
                }
            }
            if (applied.isEmpty()) {
                log.warn("[Correction] attempt {} failed with no applicable correction: {}", attempt, errors);
                return new LoopOutcome(TerminalState.UNCORRECTABLE, artifact, results, corrections, attempt, contexts);
            }
            corrections.add(applied.get());
            log.info("[Correction] attempt {}: {} -> {}", attempt, applied.get().errorType(), applied.get().fix());
        }
    }

    // ===== Correction rules =====

    private static Optional<CorrectionRule.Correction> missingImports(CorrectionRule.FailedAttempt attempt) {
        return firstError(attempt, CodeValidator.MISSING_IMPORTS_PREFIX).map(error -> {
            List<String> statements = Arrays.stream(error.substring(CodeValidator.MISSING_IMPORTS_PREFIX.length())
                            .split(","))
                    .map(String::strip)
                    .filter(m -> !m.isEmpty())
                    .map(m -> IMPORT_STATEMENTS.getOrDefault(m, "import " + m))
                    .toList();
            return new CorrectionRule.Correction(ContextAdjustments.imports(statements), error,
                    "Added " + String.join("; ", statements));
        });
    }

    private static Optional<CorrectionRule.Correction> missingMethods(CorrectionRule.FailedAttempt attempt) {
        return firstError(attempt, CodeValidator.MISSING_METHODS_PREFIX).map(error -> {
            List<String> methods = Arrays.stream(error.substring(CodeValidator.MISSING_METHODS_PREFIX.length())
                            .split(","))
                    .map(String::strip)
                    .filter(m -> !m.isEmpty())
                    .toList();
            return new CorrectionRule.Correction(ContextAdjustments.stubs(methods), error,
                    "Added stub methods: " + String.join(", ", methods));
        });
    }

    private static Optional<CorrectionRule.Correction> fragmentSyntax(CorrectionRule.FailedAttempt attempt) {
        for (String error : attempt.errors()) {
            Matcher matcher = SYNTAX_LINE.matcher(error);
            if (matcher.find() && attempt.artifact().isFragmentLine(Integer.parseInt(matcher.group(1)))) {
                DetectionFragment placeholder = DetectionFragment.placeholder(
                        "replaced after syntax error", List.of(error));
                return Optional.of(new CorrectionRule.Correction(ContextAdjustments.fragment(placeholder), error,
                        "Replaced detection fragment with a no-op placeholder"));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstError(CorrectionRule.FailedAttempt attempt, String prefix) {
        return attempt.errors().stream().filter(e -> e.startsWith(prefix)).findFirst();
    }
}
