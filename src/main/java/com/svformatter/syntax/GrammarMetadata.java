package com.svformatter.syntax;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.svformatter.api.error.LanguageConfigurationException;
import com.svformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Node-kind metadata of a grammar: every symbol's id, name and named flag.
 *
 * <p>Loaded from a versioned YAML artifact that ships with the parser. The symbol classifier
 * table is generated from this metadata, so both must be regenerated together whenever the
 * grammar changes.
 */
public final class GrammarMetadata {
    public static final int NO_SYMBOL = -1;

    private static final Logger logger = LoggerUtil.getLogger(GrammarMetadata.class);

    private final String name;
    private final int version;
    private final List<Symbol> symbols;
    private final Map<Integer, Symbol> byId = new HashMap<>();
    private final Map<String, Integer> namedIds = new HashMap<>();
    private final Map<String, Integer> anonymousIds = new HashMap<>();
    private final int maxSymbolId;

    public GrammarMetadata(String name, int version, List<Symbol> symbols) {
        this.name = name;
        this.version = version;
        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));

        int max = NO_SYMBOL;
        for (Symbol symbol : symbols) {
            if (symbol.getId() < 0) {
                throw new LanguageConfigurationException("Negative symbol id for '" + symbol.getName() + "'");
            }
            if (byId.putIfAbsent(symbol.getId(), symbol) != null) {
                throw new LanguageConfigurationException("Duplicate symbol id " + symbol.getId()
                        + " in grammar " + name);
            }
            Map<String, Integer> ids = symbol.isNamed() ? namedIds : anonymousIds;
            if (ids.putIfAbsent(symbol.getName(), symbol.getId()) != null) {
                throw new LanguageConfigurationException("Duplicate symbol name '" + symbol.getName()
                        + "' in grammar " + name);
            }
            max = Math.max(max, symbol.getId());
        }
        this.maxSymbolId = max;
    }

    /**
     * Loads grammar metadata from a classpath resource.
     */
    public static GrammarMetadata load(String resource) {
        try (InputStream stream = GrammarMetadata.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new LanguageConfigurationException("Grammar metadata resource not found: " + resource);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> document = mapper.readValue(stream, Map.class);

            GrammarMetadata grammar = fromMap(document);
            logger.fine("Loaded grammar " + grammar.getName() + " v" + grammar.getVersion()
                    + " with " + grammar.getSymbols().size() + " symbols");
            return grammar;
        } catch (IOException e) {
            throw new LanguageConfigurationException("Failed to read grammar metadata: " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    static GrammarMetadata fromMap(Map<String, Object> document) {
        if (!(document.get("grammar") instanceof String)) {
            throw new LanguageConfigurationException("Grammar metadata is missing the 'grammar' name");
        }
        if (!(document.get("version") instanceof Number)) {
            throw new LanguageConfigurationException("Grammar metadata is missing the 'version' number");
        }
        if (!(document.get("symbols") instanceof List)) {
            throw new LanguageConfigurationException("Grammar metadata is missing the 'symbols' list");
        }

        List<Symbol> symbols = new ArrayList<>();
        for (Object entry : (List<Object>) document.get("symbols")) {
            if (!(entry instanceof Map)) {
                throw new LanguageConfigurationException("Invalid symbol entry: " + entry);
            }
            Map<String, Object> symbol = (Map<String, Object>) entry;
            if (!(symbol.get("id") instanceof Number) || symbol.get("name") == null) {
                throw new LanguageConfigurationException("Symbol entry needs 'id' and 'name': " + symbol);
            }
            boolean named = !(symbol.get("named") instanceof Boolean) || (Boolean) symbol.get("named");
            symbols.add(new Symbol(((Number) symbol.get("id")).intValue(), symbol.get("name").toString(), named));
        }

        return new GrammarMetadata((String) document.get("grammar"),
                ((Number) document.get("version")).intValue(), symbols);
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public List<Symbol> getSymbols() {
        return symbols;
    }

    public int getMaxSymbolId() {
        return maxSymbolId;
    }

    /**
     * Looks up a symbol id, failing when the grammar does not define it.
     */
    public int symbolId(String symbolName, boolean named) {
        int id = findSymbolId(symbolName, named);
        if (id == NO_SYMBOL) {
            throw new LanguageConfigurationException("Grammar " + name + " has no "
                    + (named ? "named" : "anonymous") + " symbol '" + symbolName + "'");
        }
        return id;
    }

    /**
     * Looks up a symbol id, returning {@link #NO_SYMBOL} when the grammar does not define it.
     */
    public int findSymbolId(String symbolName, boolean named) {
        Integer id = (named ? namedIds : anonymousIds).get(symbolName);
        return id == null ? NO_SYMBOL : id;
    }

    public Symbol getSymbol(int id) {
        return byId.get(id);
    }

    /**
     * One grammar symbol.
     */
    public static final class Symbol {
        private final int id;
        private final String name;
        private final boolean named;

        public Symbol(int id, String name, boolean named) {
            this.id = id;
            this.name = name;
            this.named = named;
        }

        public int getId() { return id; }
        public String getName() { return name; }
        public boolean isNamed() { return named; }

        @Override
        public String toString() {
            return (named ? name : "\"" + name + "\"") + "#" + id;
        }
    }
}
