package com.clawrelay.agent.runtime;

import com.clawrelay.common.config.RelayConfig;
import com.clawrelay.common.model.ElevatedLevel;
import com.clawrelay.common.model.ReasoningLevel;
import com.clawrelay.common.model.ThinkLevel;
import com.clawrelay.common.model.VerboseLevel;
import com.clawrelay.common.session.SessionEntry;

/**
 * Effective level resolution: one-turn override, then the stored session
 * value, then the configured default, then the built-in fallback.
 */
public final class EffectiveSettings {

    private EffectiveSettings() {
    }

    public static ThinkLevel think(SessionEntry entry, ThinkLevel turnOverride, RelayConfig cfg,
            boolean reasoningModel) {
        if (turnOverride != null) {
            return turnOverride;
        }
        if (entry != null && entry.getThinkingLevel() != null) {
            return entry.getThinkingLevel();
        }
        ThinkLevel configured = ThinkLevel.normalize(defaults(cfg).getThinkingDefault());
        if (configured != null) {
            return configured;
        }
        return reasoningModel ? ThinkLevel.LOW : ThinkLevel.OFF;
    }

    public static VerboseLevel verbose(SessionEntry entry, VerboseLevel turnOverride, RelayConfig cfg) {
        if (turnOverride != null) {
            return turnOverride;
        }
        if (entry != null && entry.getVerboseLevel() != null) {
            return entry.getVerboseLevel();
        }
        VerboseLevel configured = VerboseLevel.normalize(defaults(cfg).getVerboseDefault());
        return configured != null ? configured : VerboseLevel.OFF;
    }

    public static ReasoningLevel reasoning(SessionEntry entry, ReasoningLevel turnOverride, RelayConfig cfg) {
        if (turnOverride != null) {
            return turnOverride;
        }
        if (entry != null && entry.getReasoningLevel() != null) {
            return entry.getReasoningLevel();
        }
        ReasoningLevel configured = ReasoningLevel.normalize(defaults(cfg).getReasoningDefault());
        return configured != null ? configured : ReasoningLevel.OFF;
    }

    /**
     * Override, stored, configured default, else on. Always off unless the
     * sender passed every elevated gate.
     */
    public static ElevatedLevel elevated(SessionEntry entry, ElevatedLevel turnOverride, RelayConfig cfg,
            boolean approved) {
        if (!approved) {
            return ElevatedLevel.OFF;
        }
        ElevatedLevel explicit = explicitElevated(entry, turnOverride, cfg);
        return explicit != null ? explicit : ElevatedLevel.ON;
    }

    /** Elevated level somebody actually asked for, or null when only the fallback applies. */
    public static ElevatedLevel explicitElevated(SessionEntry entry, ElevatedLevel turnOverride, RelayConfig cfg) {
        if (turnOverride != null) {
            return turnOverride;
        }
        if (entry != null && entry.getElevatedLevel() != null) {
            return entry.getElevatedLevel();
        }
        return ElevatedLevel.normalize(defaults(cfg).getElevatedDefault());
    }

    private static RelayConfig.AgentDefaults defaults(RelayConfig cfg) {
        if (cfg == null || cfg.getAgents() == null || cfg.getAgents().getDefaults() == null) {
            return new RelayConfig.AgentDefaults();
        }
        return cfg.getAgents().getDefaults();
    }
}
