package com.scanforge.infrastructure.pipeline;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.GenerationStrategy;
import com.scanforge.domain.transform.model.PatternType;
import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.infrastructure.classification.StructuralClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Picks the generation strategy from the structural indicators. First matching rule wins; standalone shape is
 * checked before multi-pattern shape so a recognized standalone scanner keeps its own detection loop.
 */
@Slf4j
@Component
public class StrategySelector {

    private static final int MULTI_PATTERN_THRESHOLD = 3;

    private record Rule(String name, Predicate<ClassificationResult> matches, GenerationStrategy strategy) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule("standalone", c -> StructuralClassifier.isStandalone(c.indicators()),
                    GenerationStrategy.HYBRID_PRESERVE),
            new Rule("multi", c -> c.indicator(ClassificationResult.PATTERN_COUNT) >= MULTI_PATTERN_THRESHOLD
                    || c.patternType() == PatternType.MULTI, GenerationStrategy.HYBRID_PRESERVE_MULTI)
    );

    /**
     * The specification and source are accepted for future rules; the current rules read only the
     * classification.
     */
    public GenerationStrategy select(ClassificationResult classification,
                                     StrategySpecification specification,
                                     String source) {
        for (Rule rule : RULES) {
            if (rule.matches().test(classification)) {
                log.debug("[Selector] rule '{}' -> {}", rule.name(), rule.strategy());
                return rule.strategy();
            }
        }
        log.debug("[Selector] no shape recognized -> {}", GenerationStrategy.GENERIC_PRESERVE);
        return GenerationStrategy.GENERIC_PRESERVE;
    }
}
