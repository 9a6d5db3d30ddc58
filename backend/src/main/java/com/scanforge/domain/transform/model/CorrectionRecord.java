package com.scanforge.domain.transform.model;

/**
 * One automatic fix applied after a failed attempt.
 *
 * @param attemptNumber the failed attempt this correction reacted to (1-based)
 * @param errorType     rule identifier, e.g. {@code missing_imports}
 * @param description   the error that triggered the rule
 * @param fix           what was changed for the next attempt
 */
public record CorrectionRecord(int attemptNumber, String errorType, String description, String fix) {
}
