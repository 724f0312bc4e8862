package com.example.promptstudio.llm;

/**
 * Text returned by a model call with its token usage and wall-clock latency.
 */
public record ModelCompletion(String text, int tokensIn, int tokensOut, long latencyMs) {

    public int totalTokens() {
        return tokensIn + tokensOut;
    }
}
