package com.scanforge.domain.transform.model;

/**
 * Response of the semantic extraction collaborator.
 */
public record SemanticExtraction(StrategySpecification specification, ParameterSpecification parameters) {
}
