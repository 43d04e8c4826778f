package com.svformatter.plugins.systemverilog.render;

import com.svformatter.api.error.LanguageConfigurationException;
import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.util.LoggerUtil;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Joins grammar metadata with a kind mapping into a {@link SymbolClassifier} table.
 *
 * <p>The mapping must be written for the exact grammar and version being loaded, and every
 * symbol it names must exist in that grammar; otherwise configuration fails before any file
 * is formatted. Symbols the mapping does not mention stay {@link Kind#UNKNOWN}.
 */
public final class KindTableGenerator {
    private static final Logger logger = LoggerUtil.getLogger(KindTableGenerator.class);

    private KindTableGenerator() {
    }

    public static SymbolClassifier generate(GrammarMetadata grammar, KindMapping mapping) {
        if (!grammar.getName().equals(mapping.getGrammar())) {
            throw new LanguageConfigurationException("Kind mapping targets grammar '" + mapping.getGrammar()
                    + "' but the parser provides '" + grammar.getName() + "'");
        }
        if (grammar.getVersion() != mapping.getGrammarVersion()) {
            throw new LanguageConfigurationException("Kind mapping was written for " + grammar.getName()
                    + " v" + mapping.getGrammarVersion() + " but the parser provides v" + grammar.getVersion());
        }

        Kind[] table = new Kind[grammar.getMaxSymbolId() + 1];
        Arrays.fill(table, Kind.UNKNOWN);

        int mapped = _fill(table, grammar, mapping.getNamed(), true);
        mapped += _fill(table, grammar, mapping.getAnonymous(), false);

        logger.fine("Generated kind table for " + grammar.getName() + " v" + grammar.getVersion()
                + ": " + mapped + " of " + grammar.getSymbols().size() + " symbols mapped");
        return new SymbolClassifier(table, grammar.getName(), grammar.getVersion());
    }

    private static int _fill(Kind[] table, GrammarMetadata grammar, Map<Kind, List<String>> section, boolean named) {
        int mapped = 0;
        for (Map.Entry<Kind, List<String>> entry : section.entrySet()) {
            for (String name : entry.getValue()) {
                int id = grammar.findSymbolId(name, named);
                if (id == GrammarMetadata.NO_SYMBOL) {
                    throw new LanguageConfigurationException("Kind mapping names " + (named ? "named" : "anonymous")
                            + " symbol '" + name + "' which grammar " + grammar.getName() + " v"
                            + grammar.getVersion() + " does not define");
                }
                if (table[id] != Kind.UNKNOWN) {
                    throw new LanguageConfigurationException("Symbol '" + name + "' is mapped to both "
                            + table[id] + " and " + entry.getKey());
                }
                table[id] = entry.getKey();
                mapped++;
            }
        }
        return mapped;
    }
}
