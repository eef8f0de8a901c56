package com.clawrelay.agent.models;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auth profiles read from {@code auth-profiles.json}:
 *
 * <pre>
 * { "version": 1, "profiles": { "anthropic:work": { "type": "api_key", "provider": "anthropic", "key": "..." } } }
 * </pre>
 *
 * The file is re-read after a short TTL so edits are picked up without a
 * restart. A missing or unreadable file yields no profiles.
 */
@Slf4j
public class FileAuthProfileStore implements AuthProfileStore {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(1);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Path storePath;
    private final Cache<Path, Map<String, AuthProfile>> cache;

    @Data
    static class StoreFile {
        private int version = 1;
        private Map<String, AuthProfile> profiles = new LinkedHashMap<>();
    }

    public FileAuthProfileStore(Path storePath) {
        this(storePath, DEFAULT_CACHE_TTL);
    }

    public FileAuthProfileStore(Path storePath, Duration cacheTtl) {
        this.storePath = storePath;
        this.cache = Caffeine.newBuilder().expireAfterWrite(cacheTtl).maximumSize(1).build();
    }

    @Override
    public Map<String, AuthProfile> profiles() {
        return cache.get(storePath, this::load);
    }

    public Path getStorePath() {
        return storePath;
    }

    private Map<String, AuthProfile> load(Path path) {
        if (!Files.exists(path)) {
            return Collections.emptyMap();
        }
        try {
            StoreFile file = mapper.readValue(path.toFile(), StoreFile.class);
            if (file == null || file.getProfiles() == null) {
                return Collections.emptyMap();
            }
            return Collections.unmodifiableMap(new LinkedHashMap<>(file.getProfiles()));
        } catch (IOException e) {
            log.warn("Failed to load auth profiles from {}: {}", path, e.getMessage());
            return Collections.emptyMap();
        }
    }
}
