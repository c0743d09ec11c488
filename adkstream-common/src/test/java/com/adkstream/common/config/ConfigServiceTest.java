package com.adkstream.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "appName": "demo-app",
                  "agentModel": "gemini-2.0-flash",
                  "approval": {
                    "executionTimeoutMs": 5000,
                    "confirmationTimeoutMs": 9000
                  },
                  "chunkLogger": { "enabled": true, "outputDir": "/tmp/chunks" }
                }
                """;
        Files.writeString(configPath, json);

        ConfigService service = new ConfigService(configPath);
        StreamConfig config = service.loadConfig();

        assertEquals("demo-app", config.getAppName());
        assertEquals("gemini-2.0-flash", config.getAgentModel());
        assertEquals(5000, config.getApproval().getExecutionTimeoutMs());
        assertEquals(9000, config.getApproval().getConfirmationTimeoutMs());
        assertEquals(10_000, config.getApproval().getFrontendToolTimeoutMs());
        assertTrue(config.getChunkLogger().isEnabled());
        assertEquals("/tmp/chunks", config.getChunkLogger().getOutputDir());
        assertEquals("adk_request_confirmation", config.getConfirmationToolName());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"));
        StreamConfig config = service.loadConfig();

        assertEquals("adk-stream-protocol", config.getAppName());
        assertEquals(30_000, config.getApproval().getExecutionTimeoutMs());
        assertEquals(60_000, config.getApproval().getConfirmationTimeoutMs());
        assertFalse(config.getChunkLogger().isEnabled());
    }

    @Test
    void loadConfig_malformedJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        StreamConfig config = new ConfigService(configPath).loadConfig();

        assertEquals("adk-stream-protocol", config.getAppName());
    }

    @Test
    void loadConfig_nullSections_restoresDefaults() throws IOException {
        Files.writeString(configPath, """
                { "approval": null, "chunkLogger": null, "confirmationToolName": "" }
                """);

        StreamConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getApproval());
        assertNotNull(config.getChunkLogger());
        assertEquals("adk_request_confirmation", config.getConfirmationToolName());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "appName": "${APP_NAME}", "agentName": "${AGENT:-fallback_agent}" }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofSeconds(1),
                Map.of("APP_NAME", "from-env"));
        StreamConfig config = service.loadConfig();

        assertEquals("from-env", config.getAppName());
        assertEquals("fallback_agent", config.getAgentName());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "appName": "first" }
                """);

        ConfigService service = new ConfigService(configPath);
        StreamConfig first = service.loadConfig();
        Files.writeString(configPath, """
                { "appName": "second" }
                """);
        StreamConfig second = service.loadConfig();

        assertSame(first, second);
        assertEquals("second", service.reloadConfig().getAppName());
    }
}
