package com.svformatter.plugins.systemverilog.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.svformatter.api.error.LanguageConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-maintained assignment of grammar symbol names to {@link Kind}s, written against one
 * grammar version.
 *
 * <pre>
 * grammar: systemverilog-subset
 * grammarVersion: 1
 * named:
 *   EXPRESSION: [expression]
 * anonymous:
 *   SEMICOLON: [";"]
 * </pre>
 */
public final class KindMapping {
    private final String grammar;
    private final int grammarVersion;
    private final Map<Kind, List<String>> named;
    private final Map<Kind, List<String>> anonymous;

    public KindMapping(String grammar, int grammarVersion,
                       Map<Kind, List<String>> named, Map<Kind, List<String>> anonymous) {
        this.grammar = grammar;
        this.grammarVersion = grammarVersion;
        this.named = Collections.unmodifiableMap(_copy(named));
        this.anonymous = Collections.unmodifiableMap(_copy(anonymous));
    }

    private static Map<Kind, List<String>> _copy(Map<Kind, List<String>> section) {
        Map<Kind, List<String>> copy = new EnumMap<>(Kind.class);
        copy.putAll(section);
        return copy;
    }

    public static KindMapping load(String resource) {
        try (InputStream stream = KindMapping.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new LanguageConfigurationException("Kind mapping resource not found: " + resource);
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(stream, Map.class);
            return fromMap(document);
        } catch (IOException e) {
            throw new LanguageConfigurationException("Failed to read kind mapping: " + resource, e);
        }
    }

    static KindMapping fromMap(Map<String, Object> document) {
        if (!(document.get("grammar") instanceof String)) {
            throw new LanguageConfigurationException("Kind mapping is missing the 'grammar' name");
        }
        if (!(document.get("grammarVersion") instanceof Number)) {
            throw new LanguageConfigurationException("Kind mapping is missing the 'grammarVersion' number");
        }
        return new KindMapping((String) document.get("grammar"),
                ((Number) document.get("grammarVersion")).intValue(),
                _readSection(document, "named"),
                _readSection(document, "anonymous"));
    }

    @SuppressWarnings("unchecked")
    private static Map<Kind, List<String>> _readSection(Map<String, Object> document, String section) {
        Map<Kind, List<String>> result = new EnumMap<>(Kind.class);
        Object value = document.get(section);
        if (value == null) {
            return result;
        }
        if (!(value instanceof Map)) {
            throw new LanguageConfigurationException("Kind mapping section '" + section + "' must be a map");
        }

        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            Kind kind;
            try {
                kind = Kind.valueOf(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new LanguageConfigurationException("Unknown kind '" + entry.getKey()
                        + "' in kind mapping section '" + section + "'", e);
            }
            if (!(entry.getValue() instanceof List)) {
                throw new LanguageConfigurationException("Kind " + kind + " in section '" + section
                        + "' must list symbol names");
            }
            List<String> names = new ArrayList<>();
            for (Object name : (List<Object>) entry.getValue()) {
                names.add(String.valueOf(name));
            }
            result.put(kind, Collections.unmodifiableList(names));
        }
        return result;
    }

    public String getGrammar() {
        return grammar;
    }

    public int getGrammarVersion() {
        return grammarVersion;
    }

    public Map<Kind, List<String>> getNamed() {
        return named;
    }

    public Map<Kind, List<String>> getAnonymous() {
        return anonymous;
    }
}
