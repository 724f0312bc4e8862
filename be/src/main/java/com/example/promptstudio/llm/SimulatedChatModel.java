package com.example.promptstudio.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;

import java.util.List;
import java.util.Objects;

/**
 * Deterministic offline {@link ChatModel}: echoes the last user message in a placeholder reply
 * and reports word counts as token usage.
 */
public class SimulatedChatModel implements ChatModel {

    private final String modelName;

    public SimulatedChatModel(String modelName) {
        this.modelName = Objects.requireNonNull(modelName, "modelName");
    }

    public String modelName() {
        return modelName;
    }

    @Override
    public ChatResponse chat(List<ChatMessage> messages) {
        String prompt = lastUserText(messages);
        String reply = "I received your message: \"" + prompt + "\". This is a placeholder response using " + modelName + ".";
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(reply))
                .tokenUsage(new TokenUsage(wordCount(prompt), wordCount(reply)))
                .finishReason(FinishReason.STOP)
                .build();
    }

    private static String lastUserText(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i) instanceof UserMessage user && user.hasSingleText()) {
                return user.singleText();
            }
        }
        return "";
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
