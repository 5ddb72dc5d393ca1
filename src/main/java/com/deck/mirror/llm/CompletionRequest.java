package com.deck.mirror.llm;

import java.util.Objects;

/**
 * A single-message chat completion request.
 *
 * @param model       provider model id
 * @param prompt      user message
 * @param temperature sampling temperature (0 for evaluative tasks)
 * @param maxTokens   upper bound on the response length
 */
public record CompletionRequest(String model, String prompt, double temperature, int maxTokens) {

    public static final int DEFAULT_MAX_TOKENS = 1024;

    public CompletionRequest {
        Objects.requireNonNull(model, "model is required");
        Objects.requireNonNull(prompt, "prompt is required");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static CompletionRequest of(String model, String prompt, double temperature) {
        return new CompletionRequest(model, prompt, temperature, DEFAULT_MAX_TOKENS);
    }
}
