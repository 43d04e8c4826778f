package com.svformatter.syntax;

/**
 * Produces a concrete syntax tree from source text for one grammar.
 *
 * <p>Implementations are error tolerant: malformed input still yields a tree, with the
 * unparseable regions wrapped in error-recovery nodes.
 */
public interface SourceParser {

    SyntaxTree parse(String source);

    GrammarMetadata getGrammar();
}
