package com.svformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter: a {@code general} section shared by all plugins and one
 * section per plugin.
 */
public class FormatterConfig {
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

    /** Spaces per indentation level, {@code general.indentSize}. */
    public int getIndentSize() {
        return getGeneralConfig("indentSize", 4);
    }

    /** Column budget before lists wrap, {@code general.lineLength}. */
    public int getLineLength() {
        return getGeneralConfig("lineLength", 80);
    }

    /**
     * Glob patterns of files to skip. Empty when the key is missing or not a list.
     */
    public List<String> getIgnoreFiles() {
        Object value = generalConfig.get("ignoreFiles");
        List<String> patterns = new ArrayList<>();
        if (value instanceof List) {
            for (Object pattern : (List<?>) value) {
                patterns.add(String.valueOf(pattern));
            }
        }
        return patterns;
    }

    /**
     * Reads a {@code general} key, converted to the type of {@code defaultValue}.
     * Missing or unconvertible values yield {@code defaultValue}.
     */
    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _convert(generalConfig.get(key), defaultValue);
    }

    /**
     * Same as {@link #getGeneralConfig(String, Object)} for a key of the {@code plugins.<plugin>} section.
     */
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return _convert(pluginConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    private static <T> T _convert(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
