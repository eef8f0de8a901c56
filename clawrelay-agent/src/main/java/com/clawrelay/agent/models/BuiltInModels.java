package com.clawrelay.agent.models;

import java.util.List;

/**
 * Models the relay knows about without any provider configuration.
 */
public final class BuiltInModels implements ModelCatalog {

    private static final List<ModelCatalogEntry> ENTRIES = List.of(
            new ModelCatalogEntry("anthropic", "claude-opus-4-5", "Claude Opus 4.5", true),
            new ModelCatalogEntry("anthropic", "claude-sonnet-4-5", "Claude Sonnet 4.5", true),
            new ModelCatalogEntry("anthropic", "claude-haiku-4-5", "Claude Haiku 4.5", false),
            new ModelCatalogEntry("openai", "gpt-5", "GPT-5", true),
            new ModelCatalogEntry("openai", "gpt-4.1", "GPT-4.1", false),
            new ModelCatalogEntry("openai", "gpt-4.1-mini", "GPT-4.1 mini", false),
            new ModelCatalogEntry("google", "gemini-2.5-pro", "Gemini 2.5 Pro", true),
            new ModelCatalogEntry("google", "gemini-2.5-flash", "Gemini 2.5 Flash", true));

    @Override
    public List<ModelCatalogEntry> entries() {
        return ENTRIES;
    }
}
