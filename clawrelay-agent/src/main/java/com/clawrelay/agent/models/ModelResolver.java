package com.clawrelay.agent.models;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves a user-supplied model reference against the allowlist.
 *
 * <p>
 * Order: exact {@code provider/model} (or bare model under the default
 * provider), exact alias, then case-insensitive substring matching over the
 * allowed models. An optional {@code @profile} suffix pins an auth profile.
 * Failures come back as user-facing text, never as exceptions.
 * </p>
 */
@Slf4j
public class ModelResolver {

    static final int AMBIGUOUS_LIST_LIMIT = 5;

    private final ModelSelectionState state;
    private final AuthProfileStore authProfiles;

    public ModelResolver(ModelSelectionState state, AuthProfileStore authProfiles) {
        this.state = state;
        this.authProfiles = authProfiles != null ? authProfiles : AuthProfileStore.empty();
    }

    // ── Resolution ─────────────────────────────────────────────────────

    public ModelResolution resolve(String raw) {
        String ref = raw != null ? raw.trim() : "";
        String profile = null;
        int at = ref.lastIndexOf('@');
        if (at > 0) {
            String suffix = ref.substring(at + 1).trim();
            ref = ref.substring(0, at).trim();
            profile = suffix.isEmpty() ? null : suffix;
        }
        if (ref.isEmpty()) {
            return ModelResolution.failed(unrecognized(raw != null ? raw.trim() : ""));
        }
        ModelResolution resolved = resolveModel(ref);
        if (!resolved.isOk() || profile == null) {
            return resolved;
        }
        return applyAuthProfile(resolved.selection(), profile);
    }

    /**
     * Select by 1-based position in the allowed list.
     */
    public ModelResolution resolveIndex(int index) {
        List<ModelCatalogEntry> entries = state.getAllowed().entries();
        if (index < 1 || index > entries.size()) {
            return ModelResolution.failed("Invalid model index " + index + ". Use /model to list available models.");
        }
        return ModelResolution.ok(selectionFor(entries.get(index - 1).ref()));
    }

    private ModelResolution resolveModel(String ref) {
        AllowedModels allowed = state.getAllowed();

        // 1. Exact provider/model
        ModelRef exact = ModelRef.parse(ref, state.getDefaultRef().provider());
        if (exact != null && isKnown(exact)) {
            if (allowed.allows(exact.key())) {
                return ModelResolution.ok(selectionFor(exact));
            }
            List<ModelCatalogEntry> scoped = fuzzyCandidates(exact.provider(), exact.model());
            if (scoped.size() == 1) {
                return ModelResolution.ok(selectionFor(scoped.get(0).ref()));
            }
            return ModelResolution.failed(notAllowed(exact.key()));
        }

        // 2. Exact alias
        ModelRef aliased = state.getAliases().resolve(ref);
        if (aliased != null) {
            if (!allowed.allows(aliased.key())) {
                return ModelResolution.failed(notAllowed(aliased.key()));
            }
            return ModelResolution.ok(selectionFor(aliased));
        }

        // 3. Fuzzy
        String provider = null;
        String fragment = ref;
        int slash = ref.indexOf('/');
        if (slash > 0) {
            provider = ModelRef.normalizeProviderId(ref.substring(0, slash));
            fragment = ref.substring(slash + 1).trim();
        }
        if (fragment.isEmpty()) {
            return ModelResolution.failed(unrecognized(ref));
        }
        List<ModelCatalogEntry> candidates = fuzzyCandidates(provider, fragment);
        if (candidates.isEmpty()) {
            return ModelResolution.failed(unrecognized(ref));
        }
        if (candidates.size() == 1) {
            return ModelResolution.ok(selectionFor(candidates.get(0).ref()));
        }
        log.debug("ambiguous model reference: ref={} candidates={}", ref, candidates.size());
        return ModelResolution.failed(ambiguous(ref, candidates));
    }

    private boolean isKnown(ModelRef ref) {
        return state.getAllowed().allows(ref.key()) || state.find(ref) != null;
    }

    private List<ModelCatalogEntry> fuzzyCandidates(String provider, String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        List<ModelCatalogEntry> out = new ArrayList<>();
        for (ModelCatalogEntry entry : state.getAllowed().entries()) {
            if (provider != null && !provider.equals(entry.provider())) {
                continue;
            }
            String alias = state.getAliases().aliasFor(entry.key());
            boolean match = entry.id().toLowerCase(Locale.ROOT).contains(needle)
                    || (provider == null && entry.key().toLowerCase(Locale.ROOT).contains(needle))
                    || (alias != null && alias.toLowerCase(Locale.ROOT).contains(needle));
            if (match) {
                out.add(entry);
            }
        }
        return out;
    }

    private ModelSelection selectionFor(ModelRef ref) {
        boolean isDefault = ref.key().equals(state.getDefaultRef().key());
        return new ModelSelection(ref.provider(), ref.model(), state.aliasFor(ref), null, isDefault);
    }

    // ── Auth profiles ──────────────────────────────────────────────────

    private ModelResolution applyAuthProfile(ModelSelection selection, String profile) {
        Optional<AuthProfile> found = authProfiles.find(profile);
        if (found.isEmpty()) {
            return ModelResolution.failed("Auth profile \"" + profile + "\" not found.");
        }
        String profileProvider = ModelRef.normalizeProviderId(found.get().getProvider());
        if (!profileProvider.equals(selection.provider())) {
            return ModelResolution.failed("Auth profile \"" + profile + "\" is for " + profileProvider
                    + ", not " + selection.provider() + ".");
        }
        return ModelResolution.ok(selection.withAuthProfile(profile));
    }

    // ── Messages ───────────────────────────────────────────────────────

    static String unrecognized(String ref) {
        return "Unrecognized model \"" + ref + "\". Use /model to list available models.";
    }

    static String notAllowed(String key) {
        return "Model \"" + key + "\" is not allowed. Use /model to list available models.";
    }

    static String ambiguous(String ref, List<ModelCatalogEntry> candidates) {
        String shown = candidates.stream()
                .limit(AMBIGUOUS_LIST_LIMIT)
                .map(ModelCatalogEntry::key)
                .collect(Collectors.joining(", "));
        int remainder = candidates.size() - AMBIGUOUS_LIST_LIMIT;
        String more = remainder > 0 ? " (+" + remainder + " more)" : "";
        return "Ambiguous model \"" + ref + "\". Matches: " + shown + more
                + ". Use /model to list or specify provider/model.";
    }
}
