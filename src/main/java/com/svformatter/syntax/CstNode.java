package com.svformatter.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concrete syntax tree node backed by the source string.
 *
 * <p>Nodes are assembled bottom-up: children are created first and adopted by their parent's
 * factory call, after which the node is never changed again.
 */
public final class CstNode implements SyntaxNode {
    public static final String ERROR_TYPE = "ERROR";

    private final int symbol;
    private final String type;
    private final boolean named;
    private final String source;
    private final int startOffset;
    private final int endOffset;
    private final Point startPoint;
    private final Point endPoint;
    private final List<SyntaxNode> children;
    private final List<SyntaxNode> namedChildren;
    private final boolean containsError;

    private CstNode parent;
    private int indexInParent = -1;
    private String fieldName;

    private CstNode(int symbol, String type, boolean named, String source,
                    int startOffset, int endOffset, Point startPoint, Point endPoint,
                    List<CstNode> children) {
        this.symbol = symbol;
        this.type = type;
        this.named = named;
        this.source = source;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startPoint = startPoint;
        this.endPoint = endPoint;

        List<SyntaxNode> all = new ArrayList<>(children.size());
        List<SyntaxNode> onlyNamed = new ArrayList<>();
        boolean error = named && ERROR_TYPE.equals(type);
        for (int i = 0; i < children.size(); i++) {
            CstNode child = children.get(i);
            if (child.parent != null) {
                throw new IllegalStateException("Node " + child.type + " already has a parent");
            }
            child.parent = this;
            child.indexInParent = i;
            all.add(child);
            if (child.named) {
                onlyNamed.add(child);
            }
            error |= child.containsError;
        }
        this.children = Collections.unmodifiableList(all);
        this.namedChildren = Collections.unmodifiableList(onlyNamed);
        this.containsError = error;
    }

    /**
     * Creates a token node covering {@code [startOffset, endOffset)} of the source.
     */
    public static CstNode leaf(int symbol, String type, boolean named, String source,
                               int startOffset, int endOffset, Point startPoint, Point endPoint) {
        return new CstNode(symbol, type, named, source, startOffset, endOffset,
                startPoint, endPoint, List.of());
    }

    /**
     * Creates an inner node spanning its first to its last child.
     */
    public static CstNode branch(int symbol, String type, boolean named, List<CstNode> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Inner node " + type + " needs at least one child");
        }
        CstNode first = children.get(0);
        CstNode last = children.get(children.size() - 1);
        return new CstNode(symbol, type, named, first.source, first.startOffset, last.endOffset,
                first.startPoint, last.endPoint, children);
    }

    /**
     * Creates an inner node with an explicit span, used for the root which covers the whole
     * source even when it has no children.
     */
    public static CstNode span(int symbol, String type, boolean named, String source,
                               int startOffset, int endOffset, Point startPoint, Point endPoint,
                               List<CstNode> children) {
        return new CstNode(symbol, type, named, source, startOffset, endOffset,
                startPoint, endPoint, children);
    }

    /**
     * Names the field this node will fill in its parent. Only valid before adoption.
     */
    public CstNode withField(String name) {
        if (parent != null) {
            throw new IllegalStateException("Field must be set before the node is adopted");
        }
        this.fieldName = name;
        return this;
    }

    @Override
    public int getSymbol() {
        return symbol;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public String getFieldName() {
        return fieldName;
    }

    @Override
    public Point getStartPoint() {
        return startPoint;
    }

    @Override
    public Point getEndPoint() {
        return endPoint;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    @Override
    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    @Override
    public List<SyntaxNode> getNamedChildren() {
        return namedChildren;
    }

    @Override
    public int getChildCount() {
        return children.size();
    }

    @Override
    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    @Override
    public SyntaxNode getParent() {
        return parent;
    }

    @Override
    public SyntaxNode getPreviousSibling() {
        if (parent == null || indexInParent == 0) {
            return null;
        }
        return parent.children.get(indexInParent - 1);
    }

    @Override
    public SyntaxNode getNextSibling() {
        if (parent == null || indexInParent == parent.children.size() - 1) {
            return null;
        }
        return parent.children.get(indexInParent + 1);
    }

    @Override
    public String getText() {
        return source.substring(startOffset, endOffset);
    }

    @Override
    public boolean isError() {
        return named && ERROR_TYPE.equals(type);
    }

    @Override
    public boolean hasError() {
        return containsError;
    }

    @Override
    public String toString() {
        return type + startPoint + "-" + endPoint;
    }
}
