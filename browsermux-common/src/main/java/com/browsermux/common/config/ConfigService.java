package com.browsermux.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the browsermux configuration file.
 *
 * <p>The file is JSON. {@code ${VAR}} and {@code ${VAR:-default}} references
 * are substituted from the environment before parsing. A missing or unreadable
 * file yields a config with empty sections rather than an error.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BrowserMuxConfig> cache;
    private final Path configPath;
    private final Function<String, String> envLookup;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> envLookup) {
        this.configPath = expandHome(configPath);
        this.envLookup = envLookup;
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
    public BrowserMuxConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    private BrowserMuxConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new BrowserMuxConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            BrowserMuxConfig config = objectMapper.readValue(raw, BrowserMuxConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new BrowserMuxConfig());
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new BrowserMuxConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns. Unknown variables
     * without a default become empty strings.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = envLookup.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static BrowserMuxConfig applyDefaults(BrowserMuxConfig config) {
        if (config.getBrowser() == null) {
            config.setBrowser(new BrowserMuxConfig.BrowserConfig());
        }
        if (config.getRelay() == null) {
            config.setRelay(new BrowserMuxConfig.RelayConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new BrowserMuxConfig.LoggingConfig());
        }
        return config;
    }

    private static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
