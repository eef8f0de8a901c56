package com.clawrelay.agent.models;

import com.clawrelay.common.config.RelayConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two-way index of the aliases declared in {@code agents.defaults.models}.
 * Alias lookup is case-sensitive on the trimmed alias.
 */
public final class ModelAliasIndex {

    private static final ModelAliasIndex EMPTY = new ModelAliasIndex(Map.of(), Map.of());

    private final Map<String, ModelRef> byAlias;
    private final Map<String, String> byKey;

    private ModelAliasIndex(Map<String, ModelRef> byAlias, Map<String, String> byKey) {
        this.byAlias = byAlias;
        this.byKey = byKey;
    }

    public static ModelAliasIndex empty() {
        return EMPTY;
    }

    public static ModelAliasIndex fromConfig(RelayConfig cfg, String defaultProvider) {
        if (cfg == null || cfg.getAgents() == null || cfg.getAgents().getDefaults() == null) {
            return EMPTY;
        }
        Map<String, RelayConfig.ModelAllowEntry> models = cfg.getAgents().getDefaults().getModels();
        if (models == null || models.isEmpty()) {
            return EMPTY;
        }
        Map<String, ModelRef> byAlias = new LinkedHashMap<>();
        Map<String, String> byKey = new LinkedHashMap<>();
        for (Map.Entry<String, RelayConfig.ModelAllowEntry> e : models.entrySet()) {
            RelayConfig.ModelAllowEntry value = e.getValue();
            if (value == null || value.getAlias() == null || value.getAlias().isBlank()) {
                continue;
            }
            ModelRef ref = ModelRef.parse(e.getKey(), defaultProvider);
            if (ref == null) {
                continue;
            }
            String alias = value.getAlias().trim();
            byAlias.putIfAbsent(alias, ref);
            byKey.putIfAbsent(ref.key(), alias);
        }
        return new ModelAliasIndex(Collections.unmodifiableMap(byAlias), Collections.unmodifiableMap(byKey));
    }

    /** Target of an alias, or null. */
    public ModelRef resolve(String alias) {
        if (alias == null) {
            return null;
        }
        return byAlias.get(alias.trim());
    }

    /** Alias declared for a {@code provider/model} key, or null. */
    public String aliasFor(String key) {
        return key != null ? byKey.get(key) : null;
    }

    public Map<String, ModelRef> aliases() {
        return byAlias;
    }
}
