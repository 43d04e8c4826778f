package com.svformatter.syntax;

import java.util.List;

/**
 * Read-only node of a concrete syntax tree.
 *
 * <p>Children are in source order and include anonymous tokens such as punctuation and
 * keywords. Text is extracted from the original source by offset range, so a node's text is
 * always exactly what the author wrote.
 */
public interface SyntaxNode {

    /**
     * Raw grammar symbol id. Negative when the token has no symbol in the grammar.
     */
    int getSymbol();

    /**
     * Grammar name of the symbol, or the token text for anonymous tokens.
     */
    String getType();

    boolean isNamed();

    /**
     * Name of the field this node fills in its parent, or {@code null}.
     */
    String getFieldName();

    Point getStartPoint();

    Point getEndPoint();

    int getStartOffset();

    int getEndOffset();

    List<SyntaxNode> getChildren();

    List<SyntaxNode> getNamedChildren();

    int getChildCount();

    SyntaxNode getChild(int index);

    SyntaxNode getParent();

    SyntaxNode getPreviousSibling();

    SyntaxNode getNextSibling();

    String getText();

    /**
     * True for nodes produced by the parser's error recovery.
     */
    boolean isError();

    /**
     * True when this node or any descendant is an error-recovery node.
     */
    boolean hasError();
}
