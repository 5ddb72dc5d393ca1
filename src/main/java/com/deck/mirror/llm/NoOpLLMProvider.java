package com.deck.mirror.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Provider used when no model API key is configured. Every call fails, so the
 * curation pipelines degrade to their sentinel results.
 */
public class NoOpLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMProvider.class);

    @Override
    public String complete(CompletionRequest request) {
        log.debug("llm.noop operation=complete model={}", request.model());
        throw new LLMException("No model provider configured");
    }

    @Override
    public List<float[]> embed(String model, List<String> texts) {
        log.debug("llm.noop operation=embed model={} texts={}", model, texts.size());
        throw new LLMException("No model provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
