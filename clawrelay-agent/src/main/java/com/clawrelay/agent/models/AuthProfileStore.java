package com.clawrelay.agent.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the configured auth profiles, keyed by profile name
 * (for example {@code anthropic:work}).
 */
@FunctionalInterface
public interface AuthProfileStore {

    Map<String, AuthProfile> profiles();

    default Optional<AuthProfile> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles().get(name.trim()));
    }

    /** Profile names whose provider matches, in declaration order. */
    default List<String> profilesFor(String provider) {
        String wanted = ModelRef.normalizeProviderId(provider);
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, AuthProfile> e : profiles().entrySet()) {
            if (e.getValue() != null && wanted.equals(ModelRef.normalizeProviderId(e.getValue().getProvider()))) {
                names.add(e.getKey());
            }
        }
        return names;
    }

    static AuthProfileStore empty() {
        return Map::of;
    }
}
