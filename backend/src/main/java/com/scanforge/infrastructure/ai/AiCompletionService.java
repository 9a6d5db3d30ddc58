package com.scanforge.infrastructure.ai;

import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Pure LLM call wrapper. Prompt construction and response parsing live in the extractor.
 */
@Slf4j
@Service
public class AiCompletionService {

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.max-tokens:4096}")
    private int maxTokens;

    /**
     * JSON-mode chat completion against one backend.
     *
     * @throws ExtractionException on transport failures, timeouts or an empty response
     */
    public LlmCallResult complete(LlmBackend backend, String systemPrompt, String userMessage) {
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(backend.model())
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build());

            ChatCompletion completion = backend.client().chat().completions().create(builder.build());

            long promptTokens = 0;
            long completionTokens = 0;

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("[Extraction] Token usage [{}:{}] - prompt: {}, completion: {}, total: {}",
                        backend.name(), backend.model(), promptTokens, completionTokens, usage.totalTokens());
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .filter(text -> !text.isBlank())
                    .orElseThrow(() -> new ExtractionException(
                            "Empty response from " + backend.name() + " backend"));

            return new LlmCallResult(content.trim(), backend.name(), promptTokens, completionTokens);
        } catch (ExtractionException e) {
            throw e;
        } catch (Exception e) {
            log.error("[Extraction] LLM call failed [{}:{}]", backend.name(), backend.model(), e);
            throw new ExtractionException(backend.name() + " backend call failed: " + e.getMessage(), e);
        }
    }
}
