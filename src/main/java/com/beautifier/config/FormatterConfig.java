package com.beautifier.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter.
 */
public class FormatterConfig {
    public static final String INDENT_SIZE = "indentSize";
    public static final String LINE_LENGTH = "lineLength";

    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_LINE_LENGTH = 80;

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public int getIndentSize() {
        return getGeneralConfig(INDENT_SIZE, DEFAULT_INDENT_SIZE);
    }

    public int getLineLength() {
        return getGeneralConfig(LINE_LENGTH, DEFAULT_LINE_LENGTH);
    }

    /**
     * Returns a copy of this configuration with one general setting replaced.
     * Used to apply command-line overrides on top of a loaded file.
     */
    public FormatterConfig withGeneral(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);
        return new FormatterConfig(general, getPluginConfigsMap());
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return _coerce(pluginConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    private static <T> T _coerce(Object value, T defaultValue) {
        try {
            if (value == null) {
                return defaultValue;
            }

            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {

                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                } else if (defaultValue instanceof List && value instanceof List) {
                    return (T) value;
                }

                return defaultValue;
            }

            return (T) value;
        } catch (Exception e) {
            return defaultValue;
        }
    }
}
