package com.adkstream.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the stream bridge configuration.
 * <p>
 * The file is JSON with {@code ${VAR}} and {@code ${VAR:-default}}
 * environment substitution. A missing or unreadable file falls back to
 * {@link StreamConfig} defaults.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, StreamConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        this.configPath = expandHome(configPath);
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
    public StreamConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public StreamConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private StreamConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.info("Config file not found: {}, using defaults", configPath);
            return new StreamConfig();
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            StreamConfig config = objectMapper.readValue(raw, StreamConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return new StreamConfig();
        }
    }

    /**
     * Nested sections written as {@code null} in the file get their defaults
     * back.
     */
    private StreamConfig applyDefaults(StreamConfig config) {
        if (config.getApproval() == null) {
            config.setApproval(new StreamConfig.ApprovalConfig());
        }
        if (config.getChunkLogger() == null) {
            config.setChunkLogger(new StreamConfig.ChunkLoggerConfig());
        }
        if (config.getConfirmationToolName() == null || config.getConfirmationToolName().isBlank()) {
            config.setConfirmationToolName(new StreamConfig().getConfirmationToolName());
        }
        return config;
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
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
