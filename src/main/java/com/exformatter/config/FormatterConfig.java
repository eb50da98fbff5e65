package com.exformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatter settings: a {@code general} section and one section per plugin.
 * Instances are immutable; {@link #withGeneralConfig} returns a modified copy.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = new HashMap<>(generalConfig);
        this.pluginConfigs = new HashMap<>();
        pluginConfigs.forEach((plugin, values) -> this.pluginConfigs.put(plugin, new HashMap<>(values)));
    }

    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public FormatterConfig withGeneralConfig(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);
        return new FormatterConfig(general, pluginConfigs);
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return coerce(pluginConfig.get(key), defaultValue);
    }

    /**
     * Reads a list option, turning every element into a string. A single
     * scalar is read as a one-element list.
     */
    public List<String> getPluginConfigList(String plugin, String key) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        Object value = pluginConfig == null ? null : pluginConfig.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <T> T coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof List && value instanceof List) {
            return (T) value;
        } else if (defaultValue instanceof Integer && value instanceof Number number) {
            return (T) Integer.valueOf(number.intValue());
        } else if (defaultValue instanceof Integer && value instanceof String text) {
            try {
                return (T) Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
