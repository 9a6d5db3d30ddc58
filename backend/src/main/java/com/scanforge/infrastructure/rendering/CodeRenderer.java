package com.scanforge.infrastructure.rendering;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.ParameterValue;
import com.scanforge.infrastructure.parsing.StringLiterals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders the generated scanner module for one {@link GenerationContext}. The same skeleton serves every
 * strategy; the {@link RenderPlan} picks the per-ticker method, the aggregation step and whether the source
 * module is embedded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeRenderer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\s+");

    private final OutputSanitizer sanitizer;

    public RenderedArtifact render(GenerationContext context) {
        RenderPlan plan = context.plan();
        if (plan.keepOriginalModule() && context.preservedSource() == null) {
            throw new RenderException("Plan " + plan.strategy() + " keeps the source module but none was prepared");
        }
        DetectionFragment fragment = context.effectiveFragment();
        if (fragment == null) {
            throw new RenderException("No detection fragment for plan " + plan.strategy());
        }

        // 1. Fill the skeleton, leaving the prelude and fragment markers in place
        Map<String, String> values = new HashMap<>();
        values.put("header", header(context));
        values.put(SkeletonTemplates.PRELUDE, TemplateEngine.marker(SkeletonTemplates.PRELUDE));
        values.put("class_name", context.scannerName());
        values.put("class_doc", docLine(context.specification().description(), context.scannerName()));
        values.put("pattern_names", tuple(patternNames(context).stream().map(StringLiterals::quote).toList()));
        values.put("feature_functions", tuple(context.featureFunctions()));
        values.put("default_params", dictLiteral(defaultParams(context)));
        values.put("smart_filters", dictLiteral(new LinkedHashMap<>(context.smartFilters())));
        values.put("window_start", context.outputWindow().start().toString());
        values.put("window_end", context.outputWindow().end().toString());
        values.put("lookback_days", Integer.toString(context.lookbackDays()));
        values.put("lookback_buffer", Integer.toString(context.lookbackBuffer()));
        values.put("fetch_workers", Integer.toString(context.concurrency().fetchWorkers()));
        values.put("detect_workers", Integer.toString(context.concurrency().detectWorkers()));
        values.put("source_params", usesConfigLiteral(context) ? "P" : "{}");
        values.put("aggregation", plan.aggregatePatterns()
                ? SkeletonTemplates.AGGREGATE_LABELS
                : SkeletonTemplates.AGGREGATE_ROWS);
        values.put("process_ticker", switch (plan.extractionRule()) {
            case DETECTION_LOOP -> SkeletonTemplates.PROCESS_ROWS;
            case PATTERN_RULES -> SkeletonTemplates.PROCESS_RULES;
            case DETECTOR_CALL -> SkeletonTemplates.PROCESS_FRAME;
        });
        values.put("stub_methods", stubMethods(context.adjustments().methodStubs()));
        values.put(SkeletonTemplates.FRAGMENT, TemplateEngine.marker(SkeletonTemplates.FRAGMENT));
        String skeleton = sanitizer.sanitize(TemplateEngine.fill(SkeletonTemplates.MODULE, values));
        List<String> lines = new ArrayList<>(skeleton.lines().toList());

        // 2. Embed imports and source module after sanitizing; preserved text is never rewritten
        int preludeIndex = lines.indexOf(TemplateEngine.marker(SkeletonTemplates.PRELUDE));
        if (preludeIndex < 0) {
            throw new RenderException("Prelude marker missing from skeleton");
        }
        String prelude = prelude(context);
        lines.remove(preludeIndex);
        lines.addAll(preludeIndex, prelude.isEmpty() ? List.of("") : prelude.lines().toList());

        // 3. Splice the fragment at the marker, indented to the marker's column
        int markerIndex = -1;
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).strip().equals(TemplateEngine.marker(SkeletonTemplates.FRAGMENT))) {
                markerIndex = i;
                break;
            }
        }
        if (markerIndex < 0) {
            throw new RenderException("Detection fragment marker missing from skeleton");
        }
        String marker = lines.get(markerIndex);
        String indent = marker.substring(0, marker.length() - marker.stripLeading().length());
        List<String> fragmentLines = fragment.code().lines()
                .map(l -> l.isBlank() ? "" : indent + l)
                .toList();
        if (fragmentLines.isEmpty()) {
            fragmentLines = List.of(indent + "pass");
        }
        lines.remove(markerIndex);
        lines.addAll(markerIndex, fragmentLines);

        String code = String.join("\n", lines).stripTrailing() + "\n";
        int start = markerIndex + 1;
        int end = markerIndex + fragmentLines.size();
        log.debug("[Renderer] strategy={}, class={}, fragment lines {}-{}", plan.strategy(),
                context.scannerName(), start, end);
        return new RenderedArtifact(code, context.scannerName(), start, end);
    }

    private static String header(GenerationContext context) {
        return String.join("\n",
                "# " + context.scannerName() + ": generated five-stage scanner",
                "# Strategy: " + singleLine(context.specification().name()) + " ("
                        + context.specification().strategyType() + "), " + context.plan().strategy(),
                "# Source shape: " + context.classification().patternType() + " (confidence "
                        + context.classification().confidence() + ")");
    }

    /**
     * Missing imports go after any {@code __future__} imports of the embedded source.
     */
    private static String prelude(GenerationContext context) {
        PreservedSource preserved = context.plan().keepOriginalModule() ? context.preservedSource() : null;
        Set<String> bound = preserved == null ? Set.of() : preserved.boundImportNames();
        Set<String> imports = new LinkedHashSet<>();
        for (RenderPlan.RequiredImport required : context.plan().requiredImports()) {
            if (!bound.containsAll(required.boundNames())) {
                imports.add(required.statement());
            }
        }
        imports.addAll(context.adjustments().additionalImports());
        String importBlock = String.join("\n", imports);
        if (preserved == null) {
            return importBlock;
        }
        List<String> sourceLines = preserved.code().lines().toList();
        int split = Math.min(preserved.importInsertLine(), sourceLines.size());
        List<String> out = new ArrayList<>(sourceLines.subList(0, split));
        if (!importBlock.isEmpty()) {
            out.add(importBlock);
        }
        out.add("");
        out.addAll(sourceLines.subList(split, sourceLines.size()));
        return String.join("\n", out).stripTrailing();
    }

    private static boolean usesConfigLiteral(GenerationContext context) {
        return context.plan().keepOriginalModule()
                && context.classification().indicator(ClassificationResult.CONFIG_LITERAL) > 0;
    }

    private static List<String> patternNames(GenerationContext context) {
        if (!context.plan().aggregatePatterns()) {
            return List.of();
        }
        List<String> fromFragment = context.effectiveFragment().patternNames();
        if (!fromFragment.isEmpty()) {
            return fromFragment;
        }
        return context.classification().patternNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    /**
     * Scalar extracted parameters; nested values stay out of the generated defaults.
     */
    private static Map<String, Object> defaultParams(GenerationContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        context.parameters().categories().values().forEach(entries -> entries.forEach((name, value) -> {
            if (isScalar(value) && !params.containsKey(name)) {
                params.put(name, value.value());
            }
        }));
        return params;
    }

    private static boolean isScalar(ParameterValue value) {
        Object v = value.value();
        return v == null || v instanceof Number || v instanceof Boolean || v instanceof String;
    }

    private static String stubMethods(List<String> methods) {
        StringBuilder out = new StringBuilder();
        for (String method : methods) {
            out.append(TemplateEngine.fill(SkeletonTemplates.STUB_METHOD, Map.of("method", method)));
        }
        return out.toString().stripTrailing();
    }

    static String tuple(List<String> items) {
        if (items.isEmpty()) {
            return "()";
        }
        if (items.size() == 1) {
            return "(" + items.get(0) + ",)";
        }
        StringBuilder out = new StringBuilder("(\n");
        items.forEach(item -> out.append("        ").append(item).append(",\n"));
        return out.append("    )").toString();
    }

    static String dictLiteral(Map<String, ?> entries) {
        if (entries.isEmpty()) {
            return "{}";
        }
        StringBuilder out = new StringBuilder("{\n");
        entries.forEach((key, value) -> out.append("        ")
                .append(StringLiterals.quote(key))
                .append(": ")
                .append(pythonLiteral(value))
                .append(",\n"));
        return out.append("    }").toString();
    }

    static String pythonLiteral(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Double d) {
            if (d.isNaN()) {
                return "float(\"nan\")";
            }
            if (d.isInfinite()) {
                return d > 0 ? "float(\"inf\")" : "float(\"-inf\")";
            }
            return d.toString();
        }
        if (value instanceof Float f) {
            return pythonLiteral(f.doubleValue());
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        return StringLiterals.quote(value.toString());
    }

    private static String docLine(String description, String fallback) {
        String text = singleLine(description);
        return text.isEmpty() ? fallback + " scanner." : text;
    }

    private static String singleLine(String text) {
        if (text == null) {
            return "";
        }
        return LINE_BREAKS.matcher(text.replace("\\", "/").replace("\"\"\"", "'''")).replaceAll(" ").strip();
    }
}
