package de.mirkosertic.filequality.config;

import de.mirkosertic.filequality.model.AggregateMode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the file quality analysis.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. Project config file ({@code --config} or {@code <root>/.filequality.yaml})
 * 4. User config file (~/.filequality/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 * <p>
 * Once loaded the configuration is immutable and can be shared between concurrent runs.
 */
public final class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_ROOT = "FILEQUALITY_ROOT";
    private static final String ENV_CACHE_DIR = "FILEQUALITY_CACHE_DIR";
    private static final String PROP_CACHE_DIR = "filequality.cache.dir";
    private static final String CONFIG_DIR = ".filequality";
    private static final String USER_CONFIG_FILE = "config.yaml";
    public static final String PROJECT_CONFIG_FILE = ".filequality.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Analysis settings
    private @Nullable String root;
    private List<String> includePatterns = new ArrayList<>();
    private List<String> excludePatterns = List.of(
            "**/.git/**", "**/node_modules/**",
            "**/target/**", "**/build/**"
    );
    private int maxDepth = 64;
    private int threadPoolSize = 4;
    private long fileTimeoutMs = 30000;
    private int passThreshold = 80;
    private AggregateMode aggregateMode = AggregateMode.MEAN;
    private int worstOffenders = 10;
    private long progressIntervalMs = 10000;

    // Cache settings
    private boolean cacheEnabled = true;
    private @Nullable String cachePath;
    private long cacheMemoryEntries = 10000;

    // Rule settings, merged per rule across all sources
    private final Map<String, Map<String, Object>> rawRules = new LinkedHashMap<>();
    private Map<String, RuleSettings> rules = Map.of();

    private ApplicationConfig() {
    }

    /**
     * Load configuration from classpath defaults, the user config file and the environment.
     */
    public static ApplicationConfig load() {
        return load(null);
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param projectConfig optional project configuration file; ignored if it does not exist
     */
    public static ApplicationConfig load(final @Nullable Path projectConfig) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(getUserConfigPath());

        // Step 3: Load project config file
        if (projectConfig != null) {
            config.loadFromFile(projectConfig);
        }

        // Step 4: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        config.freeze();

        logger.info("Configuration loaded: root={}, rules={}, cacheEnabled={}, cachePath={}",
                config.root, config.rules.keySet(), config.cacheEnabled, config.cachePath);

        return config;
    }

    /**
     * Classpath defaults overlaid with the given YAML document. Neither the user config
     * file nor the environment is consulted, which makes the result reproducible.
     */
    public static ApplicationConfig fromYaml(final String yamlDocument) {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        final Map<String, Object> yaml = new Yaml().load(yamlDocument);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        config.applyDefaultCachePath();
        config.freeze();
        return config;
    }

    /**
     * Classpath defaults only.
     */
    public static ApplicationConfig defaults() {
        return fromYaml("");
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded config from: {}", configPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load config from: {}", configPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to quality section
        final Map<String, Object> qualityConfig = (Map<String, Object>) config.get("quality");
        if (qualityConfig == null) {
            return;
        }

        final Map<String, Object> analysisConfig = (Map<String, Object>) qualityConfig.get("analysis");
        if (analysisConfig != null) {
            applyAnalysisConfig(analysisConfig);
        }

        final Map<String, Object> cacheConfig = (Map<String, Object>) qualityConfig.get("cache");
        if (cacheConfig != null) {
            applyCacheConfig(cacheConfig);
        }

        final Map<String, Object> rulesConfig = (Map<String, Object>) qualityConfig.get("rules");
        if (rulesConfig != null) {
            for (final Map.Entry<String, Object> entry : rulesConfig.entrySet()) {
                final Map<String, Object> merged = rawRules.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>());
                if (entry.getValue() instanceof Map<?, ?> ruleConfig) {
                    merged.putAll((Map<String, Object>) ruleConfig);
                } else if (entry.getValue() instanceof Boolean enabled) {
                    // Short form: "naming: false"
                    merged.put("enabled", enabled);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAnalysisConfig(final Map<String, Object> analysisConfig) {
        if (analysisConfig.containsKey("root")) {
            final Object value = analysisConfig.get("root");
            this.root = value != null ? resolveVariables(value.toString()) : null;
        }
        if (analysisConfig.containsKey("include-patterns")) {
            final Object patterns = analysisConfig.get("include-patterns");
            if (patterns instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (analysisConfig.containsKey("exclude-patterns")) {
            final Object patterns = analysisConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (analysisConfig.containsKey("max-depth")) {
            this.maxDepth = ((Number) analysisConfig.get("max-depth")).intValue();
        }
        if (analysisConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) analysisConfig.get("thread-pool-size")).intValue();
        }
        if (analysisConfig.containsKey("file-timeout-ms")) {
            this.fileTimeoutMs = ((Number) analysisConfig.get("file-timeout-ms")).longValue();
        }
        if (analysisConfig.containsKey("pass-threshold")) {
            this.passThreshold = ((Number) analysisConfig.get("pass-threshold")).intValue();
        }
        if (analysisConfig.containsKey("aggregate-mode")) {
            this.aggregateMode = AggregateMode.parse(analysisConfig.get("aggregate-mode").toString());
        }
        if (analysisConfig.containsKey("worst-offenders")) {
            this.worstOffenders = ((Number) analysisConfig.get("worst-offenders")).intValue();
        }
        if (analysisConfig.containsKey("progress-interval-ms")) {
            this.progressIntervalMs = ((Number) analysisConfig.get("progress-interval-ms")).longValue();
        }
    }

    private void applyCacheConfig(final Map<String, Object> cacheConfig) {
        if (cacheConfig.containsKey("enabled")) {
            this.cacheEnabled = (Boolean) cacheConfig.get("enabled");
        }
        if (cacheConfig.containsKey("path")) {
            final Object path = cacheConfig.get("path");
            if (path != null) {
                this.cachePath = resolveVariables(path.toString());
            }
        }
        if (cacheConfig.containsKey("memory-entries")) {
            this.cacheMemoryEntries = ((Number) cacheConfig.get("memory-entries")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envRoot = System.getenv(ENV_ROOT);
        if (envRoot != null && !envRoot.trim().isEmpty()) {
            this.root = envRoot.trim();
            logger.info("Analysis root from environment: {}", this.root);
        }

        final String envCacheDir = System.getenv(ENV_CACHE_DIR);
        if (envCacheDir != null && !envCacheDir.trim().isEmpty()) {
            this.cachePath = envCacheDir.trim();
            logger.info("Cache directory from environment: {}", this.cachePath);
        }

        // System property for cache path
        final String propCacheDir = System.getProperty(PROP_CACHE_DIR);
        if (propCacheDir != null && !propCacheDir.isEmpty()) {
            this.cachePath = propCacheDir;
        }

        applyDefaultCachePath();
    }

    private void applyDefaultCachePath() {
        if (this.cachePath == null || this.cachePath.isEmpty()) {
            this.cachePath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "cache").toString();
        }
    }

    private void freeze() {
        this.includePatterns = List.copyOf(includePatterns);
        this.excludePatterns = List.copyOf(excludePatterns);
        final Map<String, RuleSettings> settings = new LinkedHashMap<>();
        for (final Map.Entry<String, Map<String, Object>> entry : rawRules.entrySet()) {
            settings.put(entry.getKey(), RuleSettings.fromMap(entry.getKey(), entry.getValue()));
        }
        this.rules = Collections.unmodifiableMap(settings);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public @Nullable String getRoot() {
        return root;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public long getFileTimeoutMs() {
        return fileTimeoutMs;
    }

    public int getPassThreshold() {
        return passThreshold;
    }

    public AggregateMode getAggregateMode() {
        return aggregateMode;
    }

    public int getWorstOffenders() {
        return worstOffenders;
    }

    public long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public String getCachePath() {
        return cachePath;
    }

    public long getCacheMemoryEntries() {
        return cacheMemoryEntries;
    }

    /**
     * Settings of all configured rules, in configuration order.
     */
    public Map<String, RuleSettings> getRules() {
        return rules;
    }

    /**
     * Settings of one rule; defaults if the rule is not configured.
     */
    public RuleSettings getRuleSettings(final String ruleName) {
        final RuleSettings settings = rules.get(ruleName);
        return settings != null ? settings : RuleSettings.defaults(ruleName);
    }
}
