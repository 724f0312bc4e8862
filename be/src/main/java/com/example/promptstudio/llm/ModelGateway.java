package com.example.promptstudio.llm;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for model calls (chat replies, experiment comparisons).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelGateway {

    private final ChatModelFactory chatModelFactory;

    public ModelCompletion complete(String model, String prompt) {
        ChatModel chatModel = chatModelFactory.build(model);
        long start = System.nanoTime();
        ChatResponse response = chatModel.chat(List.of(UserMessage.from(prompt)));
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        String text = response.aiMessage() != null && response.aiMessage().text() != null ? response.aiMessage().text() : "";
        TokenUsage usage = response.tokenUsage();
        int tokensIn = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : SimulatedChatModel.wordCount(prompt);
        int tokensOut = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : SimulatedChatModel.wordCount(text);
        log.debug("Model call model={} tokensIn={} tokensOut={} latencyMs={}", model, tokensIn, tokensOut, latencyMs);
        return new ModelCompletion(text, tokensIn, tokensOut, latencyMs);
    }
}
