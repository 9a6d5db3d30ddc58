package com.scanforge.infrastructure.ai;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.DataSourceFlags;
import com.scanforge.infrastructure.parsing.PyModule;
import com.scanforge.infrastructure.parsing.PyStmt;
import com.scanforge.infrastructure.parsing.PythonParser;
import com.scanforge.infrastructure.parsing.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@Component
public class ExtractionPromptBuilder {

    static final String SYSTEM_PROMPT = """
            You analyze Python stock-scanner scripts and describe the trading strategy they implement.
            Answer with a single JSON object and nothing else, using exactly this shape:

            {
              "strategy": {
                "name": "short_snake_case_name",
                "description": "one or two sentences",
                "strategy_type": "one of the strategy types listed below",
                "entry_conditions": ["plain-language condition", "..."],
                "exit_conditions": ["..."],
                "timeframe": "daily | intraday | weekly",
                "rationale": "why the setup is expected to work",
                "scan_kind": "scanner | backtest | screener"
              },
              "parameters": {
                "price_thresholds": {"name": {"value": 0.75, "units": "usd"}},
                "volume_thresholds": {},
                "gap_thresholds": {},
                "period_thresholds": {},
                "other_parameters": {}
              }
            }

            Strategy types: trend_following, mean_reversion, momentum, gap, breakout, liquidity, pattern, other.

            Rules:
            - Use the parameter names exactly as they appear in the script's configuration.
            - Copy numeric values exactly. Never round, rescale or invent values.
            - Leave a category empty when the script has no such threshold.""";

    private final PythonParser parser = new PythonParser();

    @Value("${openai.code-preview-chars:3000}")
    private int codePreviewChars = 3000;

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserMessage(String sourceText, ClassificationResult classification) {
        StringBuilder sb = new StringBuilder();

        sb.append("## Classification\n");
        sb.append("- pattern type: ").append(classification.patternType().name().toLowerCase(Locale.ROOT)).append('\n');
        sb.append("- confidence: ").append(classification.confidence()).append('\n');
        DataSourceFlags flags = classification.dataSourceFlags();
        sb.append("- data source: ").append(flags.primarySource().name().toLowerCase(Locale.ROOT)).append('\n');
        classification.indicators().forEach((name, count) ->
                sb.append("- ").append(name).append(": ").append(count).append('\n'));
        if (!classification.patternNames().isEmpty()) {
            sb.append("- pattern names: ").append(String.join(", ", classification.patternNames())).append('\n');
        }

        List<String> inventory = functionInventory(sourceText);
        if (!inventory.isEmpty()) {
            sb.append("\n## Functions\n");
            inventory.forEach(signature -> sb.append("- ").append(signature).append('\n'));
        }

        sb.append("\n## Code preview\n```python\n");
        sb.append(preview(sourceText));
        sb.append("\n```");
        return sb.toString();
    }

    String preview(String sourceText) {
        if (sourceText.length() <= codePreviewChars) {
            return sourceText;
        }
        return sourceText.substring(0, codePreviewChars) + "\n# ... (truncated)";
    }

    List<String> functionInventory(String sourceText) {
        PyModule module;
        try {
            module = parser.parse(sourceText);
        } catch (SourceParseException e) {
            log.debug("[Extractor] Function inventory unavailable: {}", e.describe());
            return List.of();
        }
        List<String> signatures = module.functions().stream()
                .map(ExtractionPromptBuilder::signature)
                .collect(Collectors.toList());
        for (PyStmt.ClassDef classDef : module.classes()) {
            classDef.methods().forEach(method -> signatures.add(classDef.name() + "." + signature(method)));
        }
        return signatures;
    }

    private static String signature(PyStmt.FunctionDef function) {
        String params = function.params().stream()
                .map(PyStmt.Param::name)
                .filter(name -> name != null)
                .collect(Collectors.joining(", "));
        return function.name() + "(" + params + ")";
    }
}
