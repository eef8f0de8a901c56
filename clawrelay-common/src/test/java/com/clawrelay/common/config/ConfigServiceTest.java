package com.clawrelay.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("clawrelay.json");
    }

    @Test
    void loadConfig_validJson_bindsSections() throws IOException {
        Files.writeString(configPath, """
                {
                  "agents": {
                    "defaults": {
                      "model": "anthropic/claude-opus-4-5",
                      "thinkingDefault": "high",
                      "models": {
                        "anthropic/claude-opus-4-5": { "alias": "Opus" },
                        "openai/gpt-4.1-mini": {}
                      }
                    },
                    "list": [
                      { "id": "restricted", "tools": { "elevated": { "enabled": false } } }
                    ]
                  },
                  "tools": { "elevated": { "allowFrom": { "whatsapp": ["+1222"] } } },
                  "messages": { "queue": { "mode": "collect", "debounceMs": 1500, "cap": 9 } },
                  "web": { "heartbeatSeconds": 45, "reconnect": { "maxAttempts": 0 } },
                  "unknownSection": { "ignored": true }
                }
                """);

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertEquals("anthropic/claude-opus-4-5", config.getAgents().getDefaults().getModel());
        assertEquals("Opus", config.getAgents().getDefaults().getModels().get("anthropic/claude-opus-4-5").getAlias());
        assertNull(config.getAgents().getDefaults().getModels().get("openai/gpt-4.1-mini").getAlias());
        assertFalse(config.getAgents().find("RESTRICTED").getTools().getElevated().getEnabled());
        assertEquals(List.of("+1222"), config.getTools().getElevated().getAllowFrom().get("whatsapp"));
        assertEquals(1500, config.getMessages().getQueue().getDebounceMs());
        assertEquals(45, config.getWeb().getHeartbeatSeconds());
        assertEquals(0, config.getWeb().getReconnect().getMaxAttempts());
    }

    @Test
    void loadConfig_modelAsPrimaryObject() throws IOException {
        Files.writeString(configPath, """
                { "agents": { "defaults": { "model": { "primary": "openai/gpt-4.1-mini" } } } }
                """);

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertEquals("openai/gpt-4.1-mini", config.getAgents().getDefaults().getModel());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        RelayConfig config = new ConfigService(tempDir.resolve("nope.json")).loadConfig();

        assertNotNull(config.getAgents().getDefaults());
        assertEquals("claude", config.getAgents().getDefaults().getKind());
        assertNotNull(config.getMessages().getQueue());
    }

    @Test
    void loadConfig_invalidJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ broken");

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getTools().getElevated());
    }

    @Test
    void loadConfig_nullSections_areFilled() throws IOException {
        Files.writeString(configPath, """
                { "tools": null, "messages": { "queue": null }, "session": null }
                """);

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getTools().getElevated());
        assertNotNull(config.getMessages().getQueue());
        assertNotNull(config.getSession().getStore());
    }

    @Test
    void loadConfig_isCachedUntilReload() throws IOException {
        Files.writeString(configPath, """
                { "agents": { "defaults": { "model": "a/one" } } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), System::getenv);
        assertEquals("a/one", service.loadConfig().getAgents().getDefaults().getModel());

        Files.writeString(configPath, """
                { "agents": { "defaults": { "model": "a/two" } } }
                """);

        assertEquals("a/one", service.loadConfig().getAgents().getDefaults().getModel());
        assertEquals("a/two", service.reloadConfig().getAgents().getDefaults().getModel());
    }

    @Test
    void substituteEnvVars_usesEnvThenDefault() {
        Map<String, String> env = Map.of("CLAW_MODEL", "openai/gpt-4.1-mini");
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), env::get);

        assertEquals("openai/gpt-4.1-mini", service.substituteEnvVars("${CLAW_MODEL}"));
        assertEquals("fallback", service.substituteEnvVars("${MISSING:-fallback}"));
        assertEquals("x--y", service.substituteEnvVars("x-${MISSING}-y"));
    }

    @Test
    void resolveSessionStorePath_expandsHome() throws IOException {
        Files.writeString(configPath, """
                { "session": { "store": "~/relay/sessions.json" } }
                """);
        ConfigService service = new ConfigService(configPath);

        Path resolved = service.resolveSessionStorePath(service.loadConfig());

        assertEquals(Path.of(System.getProperty("user.home"), "relay", "sessions.json"), resolved);
    }
}
