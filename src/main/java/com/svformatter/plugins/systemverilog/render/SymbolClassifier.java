package com.svformatter.plugins.systemverilog.render;

import com.svformatter.syntax.SyntaxNode;

/**
 * Maps raw grammar symbol ids to {@link Kind}s.
 *
 * <p>The table is produced by {@link KindTableGenerator} for one grammar version and never
 * changes afterwards, so a classifier can be shared between threads.
 */
public final class SymbolClassifier {
    private final Kind[] table;
    private final String grammarName;
    private final int grammarVersion;

    SymbolClassifier(Kind[] table, String grammarName, int grammarVersion) {
        this.table = table.clone();
        this.grammarName = grammarName;
        this.grammarVersion = grammarVersion;
    }

    /**
     * Returns the kind of a symbol id; ids outside the table are {@link Kind#UNKNOWN}.
     */
    public Kind kindOf(int symbol) {
        if (symbol < 0 || symbol >= table.length) {
            return Kind.UNKNOWN;
        }
        return table[symbol];
    }

    public Kind kindOf(SyntaxNode node) {
        return kindOf(node.getSymbol());
    }

    public String getGrammarName() {
        return grammarName;
    }

    public int getGrammarVersion() {
        return grammarVersion;
    }

    public int size() {
        return table.length;
    }
}
