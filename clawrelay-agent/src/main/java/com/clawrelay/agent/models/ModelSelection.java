package com.clawrelay.agent.models;

/**
 * A resolved model choice, optionally pinned to an auth profile.
 */
public record ModelSelection(String provider, String model, String alias, String authProfile, boolean isDefault) {

    public String key() {
        return provider + "/" + model;
    }

    public ModelRef ref() {
        return new ModelRef(provider, model);
    }

    /** {@code "Opus (anthropic/claude-opus-4-5)"} or just the key. */
    public String label() {
        return alias != null ? alias + " (" + key() + ")" : key();
    }

    public ModelSelection withAuthProfile(String profile) {
        return new ModelSelection(provider, model, alias, profile, isDefault);
    }
}
