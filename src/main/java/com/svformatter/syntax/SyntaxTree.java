package com.svformatter.syntax;

/**
 * Immutable parse result: the root node together with the source it was parsed from.
 */
public class SyntaxTree {
    private final SyntaxNode root;
    private final String source;
    private final GrammarMetadata grammar;

    public SyntaxTree(SyntaxNode root, String source, GrammarMetadata grammar) {
        this.root = root;
        this.source = source;
        this.grammar = grammar;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public String getSource() {
        return source;
    }

    public GrammarMetadata getGrammar() {
        return grammar;
    }

    public boolean hasErrors() {
        return root.hasError();
    }
}
