package com.scanforge.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.ParameterCategory;
import com.scanforge.domain.transform.model.ParameterSpecification;
import com.scanforge.domain.transform.model.ParameterValue;
import com.scanforge.domain.transform.model.SemanticExtraction;
import com.scanforge.domain.transform.model.StrategySpecification;
import com.scanforge.domain.transform.model.StrategyType;
import com.scanforge.domain.transform.service.SemanticExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic extraction over an OpenAI-compatible chat API. The primary backend is tried first and the
 * fallback backend only when the primary call or its response fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiSemanticExtractor implements SemanticExtractor {

    private static final String DEFAULT_NAME = "Extracted_Scanner";

    private final ExtractionBackends backends;
    private final AiCompletionService completionService;
    private final ExtractionPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    @Override
    public SemanticExtraction extract(String sourceText, ClassificationResult classification) {
        String systemPrompt = promptBuilder.getSystemPrompt();
        String userMessage = promptBuilder.buildUserMessage(sourceText, classification);

        ExtractionException lastFailure = null;
        for (LlmBackend backend : backends.inOrder()) {
            long startTime = System.currentTimeMillis();
            try {
                LlmCallResult result = completionService.complete(backend, systemPrompt, userMessage);
                SemanticExtraction extraction = parse(result.content(), backend.name());
                log.info("[Extractor] {} backend answered in {}ms - strategy: {}, parameters: {}",
                        backend.name(), System.currentTimeMillis() - startTime,
                        extraction.specification().name(), extraction.parameters().size());
                return extraction;
            } catch (ExtractionException e) {
                log.warn("[Extractor] {} backend failed: {}", backend.name(), e.getMessage());
                lastFailure = e;
            }
        }
        throw new ExtractionException("Semantic extraction failed: "
                + (lastFailure == null ? "no backend configured" : lastFailure.getMessage()), lastFailure);
    }

    SemanticExtraction parse(String content, String backendName) {
        if (content == null || content.isBlank()) {
            throw new ExtractionException("Empty response from " + backendName + " backend");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(content));
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Non-JSON response from " + backendName + " backend", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionException("Non-JSON response from " + backendName + " backend");
        }
        JsonNode strategy = root.path("strategy");
        if (!strategy.isObject()) {
            throw new ExtractionException("Response from " + backendName + " backend has no strategy object");
        }

        ParameterSpecification parameters = parseParameters(root.path("parameters"), "extractor:" + backendName);
        StrategySpecification specification = new StrategySpecification(
                text(strategy, "name", DEFAULT_NAME),
                text(strategy, "description", ""),
                StrategyType.fromLabel(text(strategy, "strategy_type", null)),
                textList(strategy.path("entry_conditions")),
                textList(strategy.path("exit_conditions")),
                parameters,
                text(strategy, "timeframe", "daily"),
                text(strategy, "rationale", ""),
                text(strategy, "scan_kind", "scanner")
        );
        return new SemanticExtraction(specification, parameters);
    }

    private ParameterSpecification parseParameters(JsonNode node, String provenance) {
        Map<ParameterCategory, Map<String, ParameterValue>> categories = new EnumMap<>(ParameterCategory.class);
        if (!node.isObject()) {
            return ParameterSpecification.empty();
        }
        for (ParameterCategory category : ParameterCategory.values()) {
            JsonNode entries = node.path(category.jsonKey());
            if (!entries.isObject()) {
                continue;
            }
            Map<String, ParameterValue> values = new LinkedHashMap<>();
            entries.fields().forEachRemaining(field ->
                    values.put(field.getKey(), parameterValue(field.getValue(), provenance)));
            categories.put(category, values);
        }
        return new ParameterSpecification(categories);
    }

    private ParameterValue parameterValue(JsonNode node, String provenance) {
        if (node.isObject() && node.has("value")) {
            JsonNode units = node.get("units");
            String unitLabel = units == null || units.isNull() ? null : units.asText();
            return new ParameterValue(scalar(node.get("value")), unitLabel, provenance);
        }
        return new ParameterValue(scalar(node), null, provenance);
    }

    private Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return defaultValue;
        }
        return value.asText().trim();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (!item.isNull() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            });
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    // Some models wrap JSON mode output in a markdown fence anyway.
    private static String stripFences(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int lastFence = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, lastFence).trim();
    }
}
