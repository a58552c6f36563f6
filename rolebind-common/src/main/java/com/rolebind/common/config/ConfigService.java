package com.rolebind.common.config;

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
 * Loads and caches the RoleBind configuration file.
 */
@Slf4j
public class ConfigService {

    public static final String CONFIG_PATH_ENV = "ROLEBIND_CONFIG";
    public static final String DEFAULT_CONFIG_PATH = "~/.rolebind/rolebind.json";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, RoleBindConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this.configPath = expandHome(configPath.toString());
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Resolve the config path from {@code ROLEBIND_CONFIG}, falling back to the
     * default location in the user's home directory.
     */
    public static Path resolveDefaultPath(Map<String, String> env) {
        String fromEnv = env.get(CONFIG_PATH_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return expandHome(fromEnv.trim());
        }
        return expandHome(DEFAULT_CONFIG_PATH);
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    /**
     * Load config with caching.
     */
    public RoleBindConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public RoleBindConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private RoleBindConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new RoleBindConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            RoleBindConfig config = applyDefaults(objectMapper.readValue(raw, RoleBindConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new RoleBindConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
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

    /**
     * Apply default values to missing config sections.
     */
    RoleBindConfig applyDefaults(RoleBindConfig config) {
        if (config.getDiscord() == null) {
            config.setDiscord(new RoleBindConfig.DiscordConfig());
        }
        if (config.getDiscord().getWorkerThreads() < 1) {
            config.getDiscord().setWorkerThreads(1);
        }
        if (config.getStorage() == null) {
            config.setStorage(new RoleBindConfig.StorageConfig());
        }
        RoleBindConfig.StorageConfig storage = config.getStorage();
        if (storage.getPath() == null || storage.getPath().isBlank()) {
            storage.setPath(new RoleBindConfig.StorageConfig().getPath());
        }
        if (storage.getFlushIntervalMs() <= 0) {
            storage.setFlushIntervalMs(new RoleBindConfig.StorageConfig().getFlushIntervalMs());
        }
        return config;
    }
}
