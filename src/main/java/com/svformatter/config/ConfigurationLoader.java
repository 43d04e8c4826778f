package com.svformatter.config;

import com.svformatter.util.LoggerUtil;
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
 * Loads the YAML configuration, falling back to the bundled defaults for anything missing,
 * mistyped or out of range.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String PLUGIN_SYSTEMVERILOG = "systemverilog";
    public static final String ERROR_NODES = "errorNodes";
    private static final Set<String> ERROR_NODE_POLICIES = Set.of("abort", "verbatim");

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
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded: indentSize=" + formatterConfig.getIndentSize()
                    + ", lineLength=" + formatterConfig.getLineLength());

            return formatterConfig;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration, parsed once.
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
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed YAML document, with validation.
     */
    @SuppressWarnings("unchecked")
    static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
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

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "indentSize", 1, 8);
        _validateIntRange(generalConfig, "lineLength", 40, 200);

        Map<String, Object> svConfig = pluginConfigs.get(PLUGIN_SYSTEMVERILOG);
        if (svConfig != null && svConfig.containsKey(ERROR_NODES)) {
            Object policy = svConfig.get(ERROR_NODES);
            if (!(policy instanceof String)
                    || !ERROR_NODE_POLICIES.contains(((String) policy).trim().toLowerCase(Locale.ROOT))) {
                logger.warning("Configuration value '" + ERROR_NODES + "' must be one of "
                        + ERROR_NODE_POLICIES + " but was '" + policy + "'. Using default value.");
                svConfig.remove(ERROR_NODES);
            }
        }
    }

    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        Object value = config.get(key);
        if (!(value instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        int intValue = ((Number) value).intValue();
        if (intValue < min || intValue > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
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
        if (!(generalConfig.get("indentSize") instanceof Number)) {
            generalConfig.put("indentSize", 4);
        }
        if (!(generalConfig.get("lineLength") instanceof Number)) {
            generalConfig.put("lineLength", 80);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> svConfig = pluginConfigs.computeIfAbsent(PLUGIN_SYSTEMVERILOG, k -> new HashMap<>());
        if (!(svConfig.get(ERROR_NODES) instanceof String)) {
            svConfig.put(ERROR_NODES, "abort");
        }
    }

    /**
     * Writes the configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put("plugins", new TreeMap<>(config.getPluginConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
