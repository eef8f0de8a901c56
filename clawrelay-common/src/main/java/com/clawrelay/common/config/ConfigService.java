package com.clawrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the relay configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, RelayConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public RelayConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public RelayConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Resolve the session store path from config, expanding {@code ~}.
     */
    public Path resolveSessionStorePath(RelayConfig config) {
        String raw = config.getSession() != null ? config.getSession().getStore() : null;
        if (raw == null || raw.isBlank()) {
            raw = new RelayConfig.SessionConfig().getStore();
        }
        return expandHome(raw.trim());
    }

    private RelayConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new RelayConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            RelayConfig config = objectMapper.readValue(raw, RelayConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new RelayConfig());
        } catch (IOException e) {
            log.error("Failed to load config from {}: {}", configPath, e.getMessage());
            return applyDefaults(new RelayConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in sections that JSON explicitly nulled out.
     */
    RelayConfig applyDefaults(RelayConfig config) {
        if (config.getAgents() == null) {
            config.setAgents(new RelayConfig.AgentsConfig());
        }
        if (config.getAgents().getDefaults() == null) {
            config.getAgents().setDefaults(new RelayConfig.AgentDefaults());
        }
        if (config.getAgents().getDefaults().getModels() == null) {
            config.getAgents().getDefaults().setModels(new LinkedHashMap<>());
        }
        if (config.getModels() == null) {
            config.setModels(new RelayConfig.ModelsConfig());
        }
        if (config.getTools() == null) {
            config.setTools(new RelayConfig.ToolsConfig());
        }
        if (config.getTools().getElevated() == null) {
            config.getTools().setElevated(new RelayConfig.ElevatedConfig());
        }
        if (config.getMessages() == null) {
            config.setMessages(new RelayConfig.MessagesConfig());
        }
        if (config.getMessages().getQueue() == null) {
            config.getMessages().setQueue(new RelayConfig.QueueConfig());
        }
        if (config.getWeb() == null) {
            config.setWeb(new RelayConfig.WebConfig());
        }
        if (config.getSession() == null) {
            config.setSession(new RelayConfig.SessionConfig());
        }
        return config;
    }

    private static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
