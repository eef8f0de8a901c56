package com.clawrelay.agent.models;

/**
 * A model known to the relay, with the capability metadata the directives
 * and the run coordinator need.
 */
public record ModelCatalogEntry(String provider, String id, String name, boolean reasoning) {

    public String key() {
        return provider + "/" + id;
    }

    public ModelRef ref() {
        return new ModelRef(provider, id);
    }

    /** Display name, falling back to the id. */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
