package com.svformatter.plugins.systemverilog.render;

import com.svformatter.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Lays out a parenthesized, comma-separated list either on one line or one element per line.
 *
 * <p>Each element is rendered into its own throwaway buffer first; the single-line candidate
 * is committed when it fits the width budget from the current column, otherwise the list is
 * broken with one indented element per line and the closing parenthesis on its own line.
 */
public final class WrapPlanner {
    private final int width;

    /**
     * @param width maximum line length in columns
     */
    public WrapPlanner(int width) {
        this.width = width;
    }

    /**
     * Writes {@code elements} separated by {@code ", "} on the current line when they fit together with
     * {@code trailing}; otherwise one element per line, one level deeper, with the closing
     * parenthesis on its own line.
     */
    public void layout(List<SyntaxNode> elements, String trailing, RenderBuffer buffer,
                       Function<SyntaxNode, String> fragmentRenderer) {
        List<String> fragments = new ArrayList<>(elements.size());
        for (SyntaxNode element : elements) {
            fragments.add(fragmentRenderer.apply(element));
        }

        String candidate = "(" + String.join(", ", fragments) + ")" + trailing;
        if (fragments.isEmpty() || fits(buffer.currentColumn(), candidate)) {
            buffer.appendText(candidate);
            return;
        }

        buffer.appendText("(\n");
        buffer.pushIndent();
        for (int i = 0; i < fragments.size(); i++) {
            buffer.appendText(fragments.get(i));
            if (i < fragments.size() - 1) {
                buffer.appendChar(',');
            }
            buffer.appendChar('\n');
        }
        buffer.popIndent();
        buffer.appendText(")" + trailing);
    }

    /**
     * True when {@code text} starting at {@code column} ends at or before the width budget.
     */
    public boolean fits(int column, String text) {
        return column + text.length() <= width;
    }
}
