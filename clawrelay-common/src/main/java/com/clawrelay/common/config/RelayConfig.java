package com.clawrelay.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for the relay, bound from {@code clawrelay.json}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayConfig {

    private AgentsConfig agents = new AgentsConfig();
    private ModelsConfig models = new ModelsConfig();
    private ToolsConfig tools = new ToolsConfig();
    private MessagesConfig messages = new MessagesConfig();
    private WebConfig web = new WebConfig();
    private SessionConfig session = new SessionConfig();

    // --- Agents ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgentsConfig {
        private AgentDefaults defaults = new AgentDefaults();
        private List<AgentEntry> list = new ArrayList<>();

        /**
         * Per-agent entry by id (case-insensitive), or {@code null}.
         */
        public AgentEntry find(String agentId) {
            if (agentId == null || list == null) {
                return null;
            }
            for (AgentEntry entry : list) {
                if (entry != null && entry.getId() != null && entry.getId().trim().equalsIgnoreCase(agentId)) {
                    return entry;
                }
            }
            return null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgentDefaults {
        /** Primary model, "provider/model". */
        private String model;
        /** Allowlist keyed by "provider/model"; values may carry an alias. */
        private Map<String, ModelAllowEntry> models = new LinkedHashMap<>();
        private String thinkingDefault;
        private String verboseDefault;
        private String reasoningDefault;
        private String elevatedDefault;
        /** Agent CLI kind: claude, opencode, gemini, pi or codex. */
        private String kind = "claude";
        /** argv template; "{{Body}}" marks the prompt position. */
        private List<String> command = new ArrayList<>();
        private String workspace;
        private int timeoutSeconds = 600;
        /** Whether steering messages may be written to the agent's stdin. */
        private boolean steerViaStdin;

        /**
         * Accepts either {@code "provider/model"} or {@code {"primary": "provider/model"}}.
         */
        @JsonSetter("model")
        public void setModelSpec(Object value) {
            if (value instanceof Map<?, ?> map) {
                Object primary = map.get("primary");
                this.model = primary != null ? primary.toString() : null;
            } else {
                this.model = value != null ? value.toString() : null;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelAllowEntry {
        private String alias;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgentEntry {
        private String id;
        private String name;
        private AgentToolsConfig tools;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AgentToolsConfig {
        private ElevatedConfig elevated;
    }

    // --- Models ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelsConfig {
        /** Custom providers keyed by provider id. */
        private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String baseUrl;
        private String api;
        private List<ModelDefinition> models = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelDefinition {
        private String id;
        private String name;
        /** Whether the model supports reasoning/thinking. */
        private Boolean reasoning;
    }

    // --- Tools ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolsConfig {
        private ElevatedConfig elevated = new ElevatedConfig();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ElevatedConfig {
        /** Unset means enabled. */
        private Boolean enabled;
        /** Sender allowlists keyed by transport name ("*" admits everyone). */
        private Map<String, List<String>> allowFrom;
    }

    // --- Messages ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagesConfig {
        private QueueConfig queue = new QueueConfig();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueueConfig {
        private String mode;
        private Integer debounceMs;
        private Integer cap;
        private String drop;
        /** Mode override per transport. */
        private Map<String, String> byTransport = new LinkedHashMap<>();
    }

    // --- Web transport ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebConfig {
        private Integer heartbeatSeconds;
        private ReconnectConfig reconnect = new ReconnectConfig();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReconnectConfig {
        private Long initialMs;
        private Long maxMs;
        private Double factor;
        private Double jitter;
        /** 0 = unlimited. */
        private Integer maxAttempts;
    }

    // --- Session ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionConfig {
        /** Path to sessions.json. */
        private String store = "~/.clawrelay/sessions.json";
    }
}
