package com.deck.mirror.llm;

/**
 * Transport or response-shape failure from a model provider.
 */
public class LLMException extends RuntimeException {

    public LLMException(String message) {
        super(message);
    }

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
