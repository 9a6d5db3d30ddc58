package com.scanforge.application.transform;

import com.scanforge.application.transform.exception.InvalidTransformRequestException;
import com.scanforge.domain.transform.model.OutputWindow;
import com.scanforge.domain.transform.model.TransformationResult;
import com.scanforge.infrastructure.pipeline.TransformProperties;
import com.scanforge.infrastructure.pipeline.TransformationPipeline;
import com.scanforge.infrastructure.preprocessing.SourceNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransformAppService {

    private final SourceNormalizer sourceNormalizer;
    private final TransformationPipeline transformationPipeline;
    private final TransformProperties properties;

    /**
     * Validates the raw request, normalizes the source and runs the pipeline. Invalid requests come back as
     * failed results rather than exceptions.
     *
     * @param source       scanner script
     * @param proposedName optional scanner name
     * @param windowStart  ISO date, first day of the output window
     * @param windowEnd    ISO date, last day of the output window
     * @param verbose      log stage progress at INFO
     */
    public TransformationResult transform(String source, String proposedName, String windowStart,
                                          String windowEnd, boolean verbose) {
        OutputWindow window;
        try {
            window = validateTransformRequest(source, windowStart, windowEnd);
        } catch (InvalidTransformRequestException e) {
            log.warn("[Transform] Rejected request: {}", e.getMessage());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("output_window", windowStart + ".." + windowEnd);
            return TransformationResult.failure(e.getMessage(), metadata);
        }

        String normalized = sourceNormalizer.normalize(source);
        log.info("[Transform] Transforming {} chars, name: {}, window: {}",
                normalized.length(), proposedName, window);
        return transformationPipeline.transform(normalized, proposedName, window, verbose);
    }

    public OutputWindow validateTransformRequest(String source, String windowStart, String windowEnd) {
        if (source == null || source.isBlank()) {
            throw new InvalidTransformRequestException("Source code is required");
        }
        if (source.length() > properties.getMaxSourceLength()) {
            throw new InvalidTransformRequestException(String.format(
                    "Source code exceeds the maximum length of %d characters", properties.getMaxSourceLength()));
        }
        try {
            return OutputWindow.parse(windowStart, windowEnd);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransformRequestException(e.getMessage());
        }
    }
}
