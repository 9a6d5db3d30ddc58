package com.scanforge.infrastructure.ai;

/**
 * Result of an LLM API call including token usage for cost tracking.
 */
public record LlmCallResult(String content, String backend, long promptTokens, long completionTokens) {}
