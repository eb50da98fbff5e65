package com.exformatter.config;

import com.exformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads formatter configuration from YAML. Missing or invalid values are
 * replaced by defaults, so every loaded configuration is complete.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String ELIXIR_PLUGIN = "elixir";
    public static final String LINE_LENGTH = "lineLength";
    public static final String IGNORE_FILES = "ignoreFiles";
    public static final String LOCALS_WITHOUT_PARENS = "localsWithoutParens";
    public static final String RENAME_DEPRECATED_AT = "renameDeprecatedAt";
    public static final String CHECK_EQUIVALENT = "checkEquivalent";

    public static final int DEFAULT_LINE_LENGTH = 98;
    public static final int MIN_LINE_LENGTH = 20;
    public static final int MAX_LINE_LENGTH = 500;

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from {@code configPath}, falling back to the
     * defaults when the file is missing or unreadable.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            @SuppressWarnings("unchecked")
            Map<String, Object> config = YAML.readValue(configPath.toFile(), Map.class);

            return _createConfigFromMap(config == null ? Map.of() : config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the configuration bundled with the formatter. The result is cached.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> config = YAML.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey("plugins")) {
            logger.warning("Invalid 'plugins' section in config, using defaults");
        }

        _validateIntRange(generalConfig, LINE_LENGTH, MIN_LINE_LENGTH, MAX_LINE_LENGTH);
        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Drops an integer value outside {@code [min, max]} so that the default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get(LINE_LENGTH) instanceof Number)) {
            generalConfig.put(LINE_LENGTH, DEFAULT_LINE_LENGTH);
        }
        if (!(generalConfig.get(IGNORE_FILES) instanceof List)) {
            generalConfig.put(IGNORE_FILES, new ArrayList<String>());
        }
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> elixirConfig = pluginConfigs.computeIfAbsent(ELIXIR_PLUGIN, k -> new HashMap<>());
        if (!(elixirConfig.get(LOCALS_WITHOUT_PARENS) instanceof List)) {
            elixirConfig.put(LOCALS_WITHOUT_PARENS, new ArrayList<String>());
        }
        if (!(elixirConfig.get(CHECK_EQUIVALENT) instanceof Boolean)) {
            elixirConfig.put(CHECK_EQUIVALENT, true);
        }
        // renameDeprecatedAt stays absent unless configured
        if (elixirConfig.containsKey(RENAME_DEPRECATED_AT) && elixirConfig.get(RENAME_DEPRECATED_AT) == null) {
            elixirConfig.remove(RENAME_DEPRECATED_AT);
        }
    }

    /**
     * Writes {@code config} as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            Map<String, Object> plugins = new TreeMap<>();
            config.getPluginConfigsMap().forEach((plugin, values) -> plugins.put(plugin, new TreeMap<>(values)));
            configMap.put("plugins", plugins);

            YAML.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
