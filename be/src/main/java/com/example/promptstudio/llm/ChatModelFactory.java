package com.example.promptstudio.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds a {@link ChatModel} for a model name.
 * <p>
 * With {@code studio.ai.api-key} set, returns an OpenAI-compatible model against {@code studio.ai.base-url};
 * without it, returns a {@link SimulatedChatModel} so the studio works offline.
 * </p>
 */
@Component
@Slf4j
public class ChatModelFactory {

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final Duration timeout;

    public ChatModelFactory(
            @Value("${studio.ai.api-key:}") String apiKey,
            @Value("${studio.ai.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
            @Value("${studio.ai.model:" + DEFAULT_MODEL + "}") String defaultModel,
            @Value("${studio.ai.timeout:120s}") Duration timeout) {
        this.apiKey = apiKey != null ? apiKey.trim() : "";
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.defaultModel = defaultModel != null && !defaultModel.isBlank() ? defaultModel.trim() : DEFAULT_MODEL;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(120);
        if (this.apiKey.isEmpty()) {
            log.info("No studio.ai.api-key configured; model calls are simulated");
        }
    }

    public boolean isSimulated() {
        return apiKey.isEmpty();
    }

    /**
     * Builds a ChatModel for the given model name; blank falls back to the configured default.
     */
    public ChatModel build(String modelName) {
        String model = modelName != null && !modelName.isBlank() ? modelName.trim() : defaultModel;
        if (isSimulated()) {
            return new SimulatedChatModel(model);
        }
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .modelName(model)
                .timeout(timeout)
                .build();
    }
}
