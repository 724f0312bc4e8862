package com.example.promptstudio.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.response.ChatResponse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SimulatedChatModel")
class SimulatedChatModelTest {

    @Test
    @DisplayName("echoes the last user message with the model name")
    void echoesLastUserMessage() {
        SimulatedChatModel model = new SimulatedChatModel("gpt-4o-mini");
        List<ChatMessage> messages = List.of(UserMessage.from("first"), AiMessage.from("ignored"), UserMessage.from("hello there"));

        ChatResponse response = model.chat(messages);

        assertEquals("I received your message: \"hello there\". This is a placeholder response using gpt-4o-mini.",
                response.aiMessage().text());
        assertEquals(2, response.tokenUsage().inputTokenCount());
        assertEquals(13, response.tokenUsage().outputTokenCount());
    }

    @Test
    @DisplayName("counts words on whitespace runs")
    void wordCount() {
        assertEquals(0, SimulatedChatModel.wordCount("   "));
        assertEquals(3, SimulatedChatModel.wordCount(" one  two\tthree "));
    }
}
