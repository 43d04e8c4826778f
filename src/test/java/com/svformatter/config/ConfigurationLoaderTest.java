package com.svformatter.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void defaults_comeFromBundledResource() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getIndentSize()).isEqualTo(4);
        assertThat(config.getLineLength()).isEqualTo(80);
        assertThat(config.getIgnoreFiles()).isEmpty();
        assertThat(errorNodes(config)).isEqualTo("abort");
    }

    @Test
    void missingFile_fallsBackToDefaults() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertThat(config.getLineLength()).isEqualTo(80);
    }

    @Test
    void projectFile_overridesDefaults() throws IOException {
        Path file = tempDir.resolve(".svformat.yml");
        Files.writeString(file, String.join("\n",
                "general:",
                "  indentSize: 2",
                "  lineLength: 100",
                "  ignoreFiles:",
                "    - generated/**",
                "plugins:",
                "  systemverilog:",
                "    errorNodes: verbatim",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getIndentSize()).isEqualTo(2);
        assertThat(config.getLineLength()).isEqualTo(100);
        assertThat(config.getIgnoreFiles()).containsExactly("generated/**");
        assertThat(errorNodes(config)).isEqualTo("verbatim");
    }

    @Test
    void outOfRangeAndMistypedValues_areReplacedByDefaults() {
        Map<String, Object> general = new HashMap<>();
        general.put("indentSize", 0);
        general.put("lineLength", "wide");
        Map<String, Object> systemVerilog = new HashMap<>();
        systemVerilog.put("errorNodes", "ignore");
        Map<String, Object> document = new HashMap<>();
        document.put("general", general);
        document.put("plugins", Map.of("systemverilog", systemVerilog));

        FormatterConfig config = ConfigurationLoader._createConfigFromMap(document);

        assertThat(config.getIndentSize()).isEqualTo(4);
        assertThat(config.getLineLength()).isEqualTo(80);
        assertThat(errorNodes(config)).isEqualTo("abort");
    }

    @Test
    void invalidSections_areIgnored() {
        Map<String, Object> document = new HashMap<>();
        document.put("general", List.of("not", "a", "map"));
        document.put("plugins", "none");

        FormatterConfig config = ConfigurationLoader._createConfigFromMap(document);

        assertThat(config.getIndentSize()).isEqualTo(4);
        assertThat(errorNodes(config)).isEqualTo("abort");
    }

    @Test
    void malformedYaml_fallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getLineLength()).isEqualTo(80);
    }

    @Test
    void savedConfig_loadsBackUnchanged() throws IOException {
        Path file = tempDir.resolve("nested/dir/.svformat.yml");
        Map<String, Object> general = new HashMap<>();
        general.put("indentSize", 3);
        general.put("lineLength", 120);
        general.put("ignoreFiles", List.of("vendor/**"));
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put("systemverilog", new HashMap<>(Map.of("errorNodes", "verbatim")));

        ConfigurationLoader.saveConfig(new FormatterConfig(general, plugins), file);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);

        assertThat(Files.readString(file)).contains("general:").contains("plugins:");
        assertThat(loaded.getIndentSize()).isEqualTo(3);
        assertThat(loaded.getLineLength()).isEqualTo(120);
        assertThat(loaded.getIgnoreFiles()).containsExactly("vendor/**");
        assertThat(errorNodes(loaded)).isEqualTo("verbatim");
    }

    private static String errorNodes(FormatterConfig config) {
        return config.getPluginConfig(ConfigurationLoader.PLUGIN_SYSTEMVERILOG, ConfigurationLoader.ERROR_NODES, "");
    }
}
