package com.scanforge.domain.transform.service;

import com.scanforge.domain.transform.model.ClassificationResult;
import com.scanforge.domain.transform.model.SemanticExtraction;

/**
 * Turns a source script and its structural classification into a strategy and parameter specification.
 * Implementations call an external service and throw an unchecked extraction error on timeout or malformed
 * responses.
 */
public interface SemanticExtractor {

    SemanticExtraction extract(String sourceText, ClassificationResult classification);
}
