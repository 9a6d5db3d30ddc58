package com.scanforge.infrastructure.ai;

import com.openai.client.OpenAIClient;

/**
 * One OpenAI-compatible endpoint and the model it is asked for.
 */
public record LlmBackend(String name, OpenAIClient client, String model) {
}
