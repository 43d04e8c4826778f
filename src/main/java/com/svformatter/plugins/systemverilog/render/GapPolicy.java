package com.svformatter.plugins.systemverilog.render;

import com.svformatter.syntax.SyntaxNode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Preserves author-inserted vertical space between sibling items, collapsed to at most one blank line.
 */
public final class GapPolicy {
    public static final Set<Kind> FUNCTION_BODY_ITEMS = EnumSet.of(Kind.STATEMENT, Kind.COMMENT);
    public static final Set<Kind> CLASS_BODY_ITEMS = EnumSet.of(Kind.CLASS_ITEM, Kind.COMMENT);
    public static final Set<Kind> SOURCE_FILE_ITEMS = EnumSet.of(
            Kind.FUNCTION_DECLARATION, Kind.CLASS_DECLARATION, Kind.COMMENT, Kind.ERROR);

    private final SymbolClassifier classifier;

    public GapPolicy(SymbolClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Number of fully blank source lines between {@code node} and its immediately preceding
     * sibling, or 0 when that sibling is missing or not one of {@code siblingKinds}.
     */
    public int gapBefore(SyntaxNode node, Set<Kind> siblingKinds) {
        SyntaxNode previous = node.getPreviousSibling();
        if (previous == null || !siblingKinds.contains(classifier.kindOf(previous))) {
            return 0;
        }
        int rowGap = node.getStartPoint().getRow() - previous.getEndPoint().getRow();
        return rowGap <= 0 ? 0 : rowGap - 1;
    }

    public void apply(SyntaxNode node, Set<Kind> siblingKinds, RenderBuffer buffer) {
        if (gapBefore(node, siblingKinds) > 0) {
            buffer.requestBlankLine();
        }
    }
}
