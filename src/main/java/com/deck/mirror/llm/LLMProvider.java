package com.deck.mirror.llm;

import java.util.List;

/**
 * Interface to the chat-completion and embedding endpoints.
 * Both methods fail with {@link LLMException}; callers decide how to degrade.
 */
public interface LLMProvider {

    /**
     * Runs a chat completion and returns the assistant message text.
     */
    String complete(CompletionRequest request);

    /**
     * Embeds a batch of texts. The result has one vector per input, in input order.
     */
    List<float[]> embed(String model, List<String> texts);

    /**
     * Returns the name/identifier of this provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is configured.
     */
    boolean isAvailable();
}
