package com.clawrelay.agent.models;

import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.session.SessionEntry;
import lombok.Getter;

import java.util.List;

/**
 * Everything model selection needs for one config snapshot: the default
 * model, the merged catalog, the alias index and the allowlist.
 */
@Getter
public final class ModelSelectionState {

    private final ModelRef defaultRef;
    private final List<ModelCatalogEntry> catalog;
    private final ModelAliasIndex aliases;
    private final AllowedModels allowed;

    public ModelSelectionState(ModelRef defaultRef, List<ModelCatalogEntry> catalog,
            ModelAliasIndex aliases, AllowedModels allowed) {
        this.defaultRef = defaultRef;
        this.catalog = catalog;
        this.aliases = aliases;
        this.allowed = allowed;
    }

    public static ModelSelectionState create(RelayConfig cfg, ModelCatalogService catalogService) {
        ModelAliasIndex aliases = ModelAliasIndex.fromConfig(cfg, ModelRef.DEFAULT_PROVIDER);
        ModelRef defaultRef = resolveConfiguredModel(cfg, aliases);
        List<ModelCatalogEntry> catalog = catalogService.loadCatalog(cfg);
        return new ModelSelectionState(defaultRef, catalog, aliases, AllowedModels.build(cfg, catalog, defaultRef));
    }

    /**
     * {@code agents.defaults.model}, which may name an alias, or the built-in
     * default.
     */
    static ModelRef resolveConfiguredModel(RelayConfig cfg, ModelAliasIndex aliases) {
        String raw = cfg != null && cfg.getAgents() != null && cfg.getAgents().getDefaults() != null
                ? cfg.getAgents().getDefaults().getModel()
                : null;
        if (raw == null || raw.isBlank()) {
            return ModelRef.defaultRef();
        }
        ModelRef aliased = aliases.resolve(raw);
        if (aliased != null) {
            return aliased;
        }
        ModelRef parsed = ModelRef.parse(raw, ModelRef.DEFAULT_PROVIDER);
        return parsed != null ? parsed : ModelRef.defaultRef();
    }

    /** The stored override if it is still allowed, else the default. */
    public ModelRef effectiveModel(SessionEntry entry) {
        ModelRef stored = storedOverride(entry);
        return stored != null && allowed.allows(stored.key()) ? stored : defaultRef;
    }

    /** The stored model override as a ref, or null when unset. */
    public ModelRef storedOverride(SessionEntry entry) {
        if (entry == null || !entry.hasModelOverride()) {
            return null;
        }
        String provider = entry.getProviderOverride() != null && !entry.getProviderOverride().isBlank()
                ? entry.getProviderOverride()
                : defaultRef.provider();
        return ModelRef.parse(provider + "/" + entry.getModelOverride().trim(), defaultRef.provider());
    }

    public ModelCatalogEntry find(ModelRef ref) {
        return ref != null ? ModelCatalogService.findModel(catalog, ref.provider(), ref.model()) : null;
    }

    public boolean isReasoning(ModelRef ref) {
        ModelCatalogEntry entry = find(ref);
        return entry != null && entry.reasoning();
    }

    public String aliasFor(ModelRef ref) {
        return ref != null ? aliases.aliasFor(ref.key()) : null;
    }
}
