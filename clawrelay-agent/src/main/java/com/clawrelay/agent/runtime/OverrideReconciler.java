package com.clawrelay.agent.runtime;

import com.clawrelay.agent.models.AuthProfile;
import com.clawrelay.agent.models.AuthProfileStore;
import com.clawrelay.agent.models.ModelRef;
import com.clawrelay.agent.models.ModelSelectionState;
import com.clawrelay.common.session.SessionEntry;

import java.util.Optional;

/**
 * Clears stored overrides that no longer apply: a model that left the
 * allowlist, or an auth profile that is gone or belongs to another provider.
 */
final class OverrideReconciler {

    private OverrideReconciler() {
    }

    static SessionEntry reconcile(SessionEntry entry, ModelSelectionState state, AuthProfileStore profiles) {
        SessionEntry out = entry;
        if (entry.hasModelOverride()) {
            ModelRef stored = state.storedOverride(entry);
            if (stored == null || !state.getAllowed().allows(stored.key())) {
                out = out.toBuilder().modelOverride(null).providerOverride(null).build();
            }
        } else if (entry.getProviderOverride() != null) {
            out = out.toBuilder().providerOverride(null).build();
        }

        String profileName = out.getAuthProfileOverride();
        if (profileName != null) {
            String provider = state.effectiveModel(out).provider();
            Optional<AuthProfile> profile = profiles.find(profileName);
            if (profile.isEmpty() || !provider.equals(ModelRef.normalizeProviderId(profile.get().getProvider()))) {
                out = out.toBuilder().authProfileOverride(null).build();
            }
        }
        return out;
    }
}
