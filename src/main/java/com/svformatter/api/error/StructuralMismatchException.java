package com.svformatter.api.error;

/**
 * A construct rule met a node whose shape it does not recognize.
 *
 * <p>Carries the offending node's grammar type, its semantic kind and its zero-based
 * start position so the caller can point at the source.
 */
public class StructuralMismatchException extends FormatException {
    private final String nodeType;
    private final String kind;
    private final int row;
    private final int column;
    private final boolean errorRecovery;

    public StructuralMismatchException(String detail, String nodeType, String kind,
                                       int row, int column, boolean errorRecovery) {
        super("Unexpected syntax tree: " + detail + " (" + nodeType + " [" + kind + "] at "
                + (row + 1) + ":" + (column + 1) + ")");
        this.nodeType = nodeType;
        this.kind = kind;
        this.row = row;
        this.column = column;
        this.errorRecovery = errorRecovery;
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getKind() {
        return kind;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * True when the offending node was produced by the parser's error recovery.
     */
    public boolean isErrorRecovery() {
        return errorRecovery;
    }
}
