package com.beautifier.config;

import com.beautifier.util.LoggerUtil;
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
 * Loads the YAML configuration, validating values and filling in defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String HTML_PLUGIN = "html";
    public static final String CSS_PLUGIN = "css";
    public static final String JAVASCRIPT_PLUGIN = "javascript";

    public static final int MIN_INDENT_SIZE = 0;
    public static final int MAX_INDENT_SIZE = 16;
    public static final int MIN_LINE_LENGTH = 20;
    public static final int MAX_LINE_LENGTH = 400;

    public static final List<String> DEFAULT_VOID_ELEMENTS = List.of("meta", "link", "img", "br", "hr");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using defaults");
                config = new HashMap<>();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.fine("Configuration loaded with " +
                    formatterConfig.getPluginConfigsMap().size() + " plugin sections");

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
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

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
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
        } else {
            logger.warning("Missing or invalid 'plugins' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Drops values outside their acceptable ranges so the defaults take their place.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, FormatterConfig.INDENT_SIZE, MIN_INDENT_SIZE, MAX_INDENT_SIZE);
        _validateIntRange(generalConfig, FormatterConfig.LINE_LENGTH, MIN_LINE_LENGTH, MAX_LINE_LENGTH);

        if (pluginConfigs.containsKey(CSS_PLUGIN)) {
            _validateIntRange(pluginConfigs.get(CSS_PLUGIN), "compactDeclarationLimit", 1, 20);
        }

        if (pluginConfigs.containsKey(JAVASCRIPT_PLUGIN)) {
            Map<String, Object> jsConfig = pluginConfigs.get(JAVASCRIPT_PLUGIN);
            _validateIntRange(jsConfig, "bracketRunLength", 2, 10);
            _validateIntRange(jsConfig, "bracketLineLimit", 20, 400);
        }
    }

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
        if (!(generalConfig.get(FormatterConfig.INDENT_SIZE) instanceof Number)) {
            generalConfig.put(FormatterConfig.INDENT_SIZE, FormatterConfig.DEFAULT_INDENT_SIZE);
        }
        if (!(generalConfig.get(FormatterConfig.LINE_LENGTH) instanceof Number)) {
            generalConfig.put(FormatterConfig.LINE_LENGTH, FormatterConfig.DEFAULT_LINE_LENGTH);
        }
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> htmlConfig = pluginConfigs.computeIfAbsent(HTML_PLUGIN, k -> new HashMap<>());
        if (!(htmlConfig.get("voidElements") instanceof List)) {
            htmlConfig.put("voidElements", new ArrayList<>(DEFAULT_VOID_ELEMENTS));
        }

        Map<String, Object> cssConfig = pluginConfigs.computeIfAbsent(CSS_PLUGIN, k -> new HashMap<>());
        if (!(cssConfig.get("compactDeclarationLimit") instanceof Number)) {
            cssConfig.put("compactDeclarationLimit", 3);
        }

        Map<String, Object> jsConfig = pluginConfigs.computeIfAbsent(JAVASCRIPT_PLUGIN, k -> new HashMap<>());
        if (!(jsConfig.get("bracketRunLength") instanceof Number)) {
            jsConfig.put("bracketRunLength", 3);
        }
        if (!(jsConfig.get("bracketLineLimit") instanceof Number)) {
            jsConfig.put("bracketLineLimit", 80);
        }
    }
}
