package de.mirkosertic.pwstrength.config;

import de.mirkosertic.pwstrength.MatcherEnsemble;
import de.mirkosertic.pwstrength.dictionary.DictionarySource;
import de.mirkosertic.pwstrength.dictionary.RankedDictionaryCache;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration of the password strength estimator.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.pwstrength/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class EstimatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(EstimatorConfig.class);

    static final String ENV_DICTIONARIES = "PWSTRENGTH_DICTIONARIES";
    static final String ENV_DICTIONARY_LIMIT = "PWSTRENGTH_DICTIONARY_LIMIT";
    static final String PROP_DICTIONARIES = "pwstrength.dictionaries";
    static final String PROP_DICTIONARY_LIMIT = "pwstrength.dictionary-length-limit";
    private static final String CONFIG_DIR = ".pwstrength";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Map<String, String> environment;
    private final Properties systemProperties;

    private List<DictionarySource> dictionaries = new ArrayList<>();
    private @Nullable Integer dictionaryLengthLimit;
    private List<String> userWords = new ArrayList<>();
    private int dictionaryCacheSize = RankedDictionaryCache.DEFAULT_MAX_DICTIONARIES;
    private int threadPoolSize = 0;
    private long evaluationTimeoutMs = 0;

    EstimatorConfig(final Map<String, String> environment, final Properties systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static EstimatorConfig load() {
        return load(getUserConfigPath(), System.getenv(), System.getProperties());
    }

    static EstimatorConfig load(final Path userConfigPath, final Map<String, String> environment,
                                final Properties systemProperties) {
        final EstimatorConfig config = new EstimatorConfig(environment, systemProperties);

        config.loadFromClasspath();
        config.loadFromFile(userConfigPath);
        config.applyOverrides();
        config.validate();

        logger.info("Configuration loaded: dictionaries={}, dictionaryLengthLimit={}, userWords={}, threadPoolSize={}",
                config.dictionaries.size(), config.dictionaryLengthLimit, config.userWords.size(),
                config.threadPoolSize);

        return config;
    }

    /**
     * Defaults without any file or environment lookup.
     */
    public static EstimatorConfig defaults() {
        return new EstimatorConfig(Map.of(), new Properties());
    }

    /**
     * Apply a YAML document on top of the current values. A document that cannot be read, or that holds a
     * value of the wrong type, is logged and ignored as a whole.
     *
     * @throws IllegalArgumentException if the resulting values are out of range
     */
    public EstimatorConfig apply(final InputStream yamlDocument) {
        try {
            final Map<String, Object> config = new Yaml().load(yamlDocument);
            if (config != null) {
                applyYamlConfig(config);
            }
        } catch (final YAMLException | ClassCastException | IllegalStateException e) {
            logger.warn("Ignoring malformed configuration document", e);
        }
        validate();
        return this;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                apply(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                apply(is);
                logger.debug("Loaded user config from: {}", configPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            }
        }
    }

    /**
     * Reads every key into locals first and assigns them only once the whole document has been parsed,
     * so a bad value leaves the configuration untouched. Keys with an empty value are treated as absent,
     * except {@code dictionary-length-limit} where an empty value removes the limit.
     */
    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Object rootValue = config.get("pwstrength");
        if (rootValue == null) {
            return;
        }
        if (!(rootValue instanceof Map)) {
            throw new IllegalStateException("Expected a mapping below 'pwstrength', got " + rootValue);
        }
        final Map<String, Object> root = (Map<String, Object>) rootValue;

        List<DictionarySource> newDictionaries = this.dictionaries;
        final Object entries = root.get("dictionaries");
        if (entries instanceof List) {
            newDictionaries = parseDictionaries((List<Object>) entries);
        } else if (entries != null) {
            throw new IllegalStateException("Expected a list for 'dictionaries', got " + entries);
        }

        Integer newLimit = this.dictionaryLengthLimit;
        if (root.containsKey("dictionary-length-limit")) {
            final Object limit = root.get("dictionary-length-limit");
            newLimit = limit == null ? null : (int) numberValue("dictionary-length-limit", limit);
        }

        List<String> newUserWords = this.userWords;
        final Object words = root.get("user-words");
        if (words instanceof List) {
            final List<String> parsed = new ArrayList<>();
            for (final Object word : (List<Object>) words) {
                if (word != null) {
                    parsed.add(String.valueOf(word));
                }
            }
            newUserWords = parsed;
        } else if (words != null) {
            throw new IllegalStateException("Expected a list for 'user-words', got " + words);
        }

        final Object cacheSize = root.get("dictionary-cache-size");
        final int newCacheSize = cacheSize == null
                ? this.dictionaryCacheSize : (int) numberValue("dictionary-cache-size", cacheSize);
        final Object poolSize = root.get("thread-pool-size");
        final int newPoolSize = poolSize == null
                ? this.threadPoolSize : (int) numberValue("thread-pool-size", poolSize);
        final Object timeout = root.get("evaluation-timeout-ms");
        final long newTimeout = timeout == null
                ? this.evaluationTimeoutMs : numberValue("evaluation-timeout-ms", timeout);

        this.dictionaries = newDictionaries;
        this.dictionaryLengthLimit = newLimit;
        this.userWords = newUserWords;
        this.dictionaryCacheSize = newCacheSize;
        this.threadPoolSize = newPoolSize;
        this.evaluationTimeoutMs = newTimeout;
    }

    private static long numberValue(final String key, final Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new IllegalStateException("Expected a number for '" + key + "', got " + value);
    }

    @SuppressWarnings("unchecked")
    private List<DictionarySource> parseDictionaries(final List<Object> entries) {
        final List<DictionarySource> result = new ArrayList<>();
        for (final Object entry : entries) {
            if (entry instanceof Map) {
                final Map<String, Object> map = (Map<String, Object>) entry;
                final Object path = map.get("path");
                if (path == null) {
                    logger.warn("Dictionary entry without path ignored: {}", map);
                    continue;
                }
                final Path location = Paths.get(resolveVariables(path.toString()));
                final Object name = map.get("name");
                result.add(name != null
                        ? new DictionarySource(name.toString(), location)
                        : DictionarySource.of(location));
            } else if (entry != null) {
                result.add(DictionarySource.of(Paths.get(resolveVariables(entry.toString()))));
            }
        }
        return result;
    }

    private void applyOverrides() {
        // System properties first so that the environment wins
        applyDictionaryOverride(systemProperties.getProperty(PROP_DICTIONARIES), "system property");
        applyLimitOverride(systemProperties.getProperty(PROP_DICTIONARY_LIMIT), "system property");
        applyDictionaryOverride(environment.get(ENV_DICTIONARIES), "environment");
        applyLimitOverride(environment.get(ENV_DICTIONARY_LIMIT), "environment");
    }

    private void applyDictionaryOverride(final @Nullable String value, final String origin) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        final List<DictionarySource> sources = new ArrayList<>();
        for (final String path : value.split(",")) {
            final String trimmed = path.trim();
            if (!trimmed.isEmpty()) {
                sources.add(DictionarySource.of(Paths.get(resolveVariables(trimmed))));
            }
        }
        this.dictionaries = sources;
        logger.info("Dictionaries from {}: {}", origin, sources);
    }

    private void applyLimitOverride(final @Nullable String value, final String origin) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            this.dictionaryLengthLimit = Integer.parseInt(value.trim());
            logger.info("Dictionary length limit from {}: {}", origin, this.dictionaryLengthLimit);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("The dictionary length limit must be a number, got " + value, e);
        }
    }

    private void validate() {
        if (dictionaryLengthLimit != null && dictionaryLengthLimit <= 0) {
            throw new IllegalArgumentException(
                    "The dictionary length limit must be a positive value, got " + dictionaryLengthLimit);
        }
        if (dictionaryCacheSize <= 0) {
            throw new IllegalArgumentException("The dictionary cache size must be positive, got " + dictionaryCacheSize);
        }
        if (threadPoolSize < 0) {
            throw new IllegalArgumentException("The thread pool size must not be negative, got " + threadPoolSize);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    String resolveVariables(final String value) {
        if (!value.contains("${")) {
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

            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    /**
     * Ensemble builder preconfigured with the dictionaries, user words, word limit and cache size of this
     * configuration. The built ensemble owns its dictionary cache.
     */
    public MatcherEnsemble.Builder toEnsembleBuilder() {
        return MatcherEnsemble.builder()
                .dictionaries(dictionaries)
                .userWords(userWords)
                .dictionaryLengthLimit(dictionaryLengthLimit)
                .dictionaryCacheSize(dictionaryCacheSize);
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public List<DictionarySource> getDictionaries() {
        return List.copyOf(dictionaries);
    }

    public @Nullable Integer getDictionaryLengthLimit() {
        return dictionaryLengthLimit;
    }

    public List<String> getUserWords() {
        return List.copyOf(userWords);
    }

    public int getDictionaryCacheSize() {
        return dictionaryCacheSize;
    }

    /**
     * @return the configured pool size, 0 meaning one thread per matcher capped at the processor count
     */
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * @return the per password timeout in milliseconds, 0 for none
     */
    public long getEvaluationTimeoutMs() {
        return evaluationTimeoutMs;
    }
}
