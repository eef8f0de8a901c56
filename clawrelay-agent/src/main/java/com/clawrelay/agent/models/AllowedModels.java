package com.clawrelay.agent.models;

import com.clawrelay.common.config.RelayConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The models a session may switch to, in {@code /model list} order. Always
 * contains the default model. With no configured allowlist every catalog entry
 * is allowed.
 */
public record AllowedModels(Set<String> keys, List<ModelCatalogEntry> entries, boolean allowAny) {

    public boolean allows(String key) {
        return key != null && keys.contains(key);
    }

    public static AllowedModels build(RelayConfig cfg, List<ModelCatalogEntry> catalog, ModelRef defaultRef) {
        Map<String, RelayConfig.ModelAllowEntry> configured = cfg != null && cfg.getAgents() != null
                && cfg.getAgents().getDefaults() != null
                        ? cfg.getAgents().getDefaults().getModels()
                        : null;
        boolean allowAny = configured == null || configured.isEmpty();

        Set<String> wanted = new LinkedHashSet<>();
        if (!allowAny) {
            for (String rawKey : configured.keySet()) {
                ModelRef ref = ModelRef.parse(rawKey, ModelRef.DEFAULT_PROVIDER);
                if (ref != null) {
                    wanted.add(ref.key());
                }
            }
            wanted.add(defaultRef.key());
        }

        List<ModelCatalogEntry> entries = new ArrayList<>();
        Set<String> keys = new LinkedHashSet<>();
        for (ModelCatalogEntry entry : catalog) {
            if ((allowAny || wanted.contains(entry.key())) && keys.add(entry.key())) {
                entries.add(entry);
            }
        }
        if (keys.add(defaultRef.key())) {
            entries.add(0, new ModelCatalogEntry(defaultRef.provider(), defaultRef.model(), defaultRef.model(), false));
        }
        for (String key : wanted) {
            if (keys.add(key)) {
                ModelRef ref = ModelRef.parse(key, ModelRef.DEFAULT_PROVIDER);
                entries.add(new ModelCatalogEntry(ref.provider(), ref.model(), ref.model(), false));
            }
        }
        return new AllowedModels(Collections.unmodifiableSet(keys), List.copyOf(entries), allowAny);
    }
}
