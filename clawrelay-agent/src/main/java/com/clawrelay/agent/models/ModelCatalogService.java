package com.clawrelay.agent.models;

import com.clawrelay.common.config.RelayConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the model catalog for a config snapshot. Merges, first key wins:
 * <ol>
 * <li>models declared under {@code models.providers}</li>
 * <li>the base catalog (built-in models by default)</li>
 * <li>allowlist keys from {@code agents.defaults.models} not known otherwise</li>
 * </ol>
 */
@Slf4j
public class ModelCatalogService {

    private final ModelCatalog baseCatalog;

    public ModelCatalogService() {
        this(new BuiltInModels());
    }

    public ModelCatalogService(ModelCatalog baseCatalog) {
        this.baseCatalog = baseCatalog;
    }

    public List<ModelCatalogEntry> loadCatalog(RelayConfig config) {
        List<ModelCatalogEntry> models = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        // 1. Provider configs
        if (config != null && config.getModels() != null && config.getModels().getProviders() != null) {
            for (Map.Entry<String, RelayConfig.ProviderConfig> pe : config.getModels().getProviders().entrySet()) {
                String providerId = ModelRef.normalizeProviderId(pe.getKey());
                RelayConfig.ProviderConfig pc = pe.getValue();
                if (providerId.isEmpty() || pc == null || pc.getModels() == null) {
                    continue;
                }
                for (RelayConfig.ModelDefinition def : pc.getModels()) {
                    if (def == null || def.getId() == null || def.getId().isBlank()) {
                        continue;
                    }
                    String id = def.getId().trim();
                    if (seen.add(providerId + "/" + id)) {
                        models.add(new ModelCatalogEntry(providerId, id,
                                def.getName() != null ? def.getName() : id,
                                Boolean.TRUE.equals(def.getReasoning())));
                    }
                }
            }
        }

        // 2. Base catalog
        try {
            for (ModelCatalogEntry entry : baseCatalog.entries()) {
                if (seen.add(entry.key())) {
                    models.add(entry);
                }
            }
        } catch (RuntimeException e) {
            log.warn("[model-catalog] Failed to list base models: {}", e.getMessage());
        }

        // 3. Allowlist keys
        if (config != null && config.getAgents() != null && config.getAgents().getDefaults() != null
                && config.getAgents().getDefaults().getModels() != null) {
            for (String rawKey : config.getAgents().getDefaults().getModels().keySet()) {
                ModelRef ref = ModelRef.parse(rawKey, ModelRef.DEFAULT_PROVIDER);
                if (ref != null && seen.add(ref.key())) {
                    models.add(new ModelCatalogEntry(ref.provider(), ref.model(), ref.model(), false));
                }
            }
        }

        models.sort(Comparator.comparing(ModelCatalogEntry::provider)
                .thenComparing(ModelCatalogEntry::displayName));
        return models;
    }

    /**
     * Find a specific model in the catalog.
     */
    public static ModelCatalogEntry findModel(List<ModelCatalogEntry> catalog, String provider, String modelId) {
        if (catalog == null || provider == null || modelId == null) {
            return null;
        }
        String normalizedProvider = ModelRef.normalizeProviderId(provider);
        for (ModelCatalogEntry entry : catalog) {
            if (entry.provider().equals(normalizedProvider) && entry.id().equalsIgnoreCase(modelId.trim())) {
                return entry;
            }
        }
        return null;
    }
}
