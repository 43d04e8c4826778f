package com.svformatter.plugins.systemverilog.render;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Output accumulator of one render pass.
 *
 * <p>Indentation is written lazily: a line receives its indent when its first non-newline
 * character arrives, so empty lines never carry trailing spaces. A requested blank line is
 * likewise held back until more content follows in the same indentation scope.
 */
public final class RenderBuffer {
    private final StringBuilder content = new StringBuilder();
    private final int indentSize;
    private final Deque<Boolean> scopeHasContent = new ArrayDeque<>();

    private int column;
    private int indentLevel;
    private boolean pendingBlankLine;
    private boolean atLineStart = true;
    private int depth;

    /**
     * @param indentSize spaces per indentation level
     */
    public RenderBuffer(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("Indent size must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
        scopeHasContent.push(false);
    }

    /**
     * Appends a token on the current line, indenting first if the line is still empty.
     * {@code text} must not contain line breaks.
     */
    public void appendText(String text) {
        for (int i = 0; i < text.length(); i++) {
            appendChar(text.charAt(i));
        }
    }

    /**
     * Single-character form of {@link #appendText(String)}; {@code '\n'} ends the line.
     */
    public void appendChar(char c) {
        if (c == '\n') {
            content.append('\n');
            column = 0;
            atLineStart = true;
            return;
        }
        if (atLineStart) {
            if (pendingBlankLine) {
                content.append('\n');
                pendingBlankLine = false;
            }
            int width = indentLevel * indentSize;
            for (int i = 0; i < width; i++) {
                content.append(' ');
            }
            column = width;
            atLineStart = false;
            markContent();
        }
        content.append(c);
        column++;
    }

    /**
     * Appends multi-line text as it is: only its first line is indented.
     */
    public void appendRaw(String text) {
        if (text.isEmpty()) {
            return;
        }
        appendChar(text.charAt(0));
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            content.append(c);
            if (c == '\n') {
                column = 0;
            } else {
                column++;
            }
        }
        atLineStart = text.charAt(text.length() - 1) == '\n';
    }

    /**
     * Opens a nested scope one indentation level deeper.
     */
    public void pushIndent() {
        indentLevel++;
        scopeHasContent.push(false);
    }

    /**
     * Closes the innermost indentation scope; a blank line still pending there is dropped.
     */
    public void popIndent() {
        if (indentLevel == 0) {
            throw new IllegalStateException("popIndent without matching pushIndent");
        }
        indentLevel--;
        scopeHasContent.pop();
        pendingBlankLine = false;
    }

    /**
     * Asks for one blank line before the next content. Ignored while the current scope is still empty.
     */
    public void requestBlankLine() {
        if (Boolean.TRUE.equals(scopeHasContent.peek())) {
            pendingBlankLine = true;
        }
    }

    /**
     * Zero-based column the next appended character would land on, indentation included.
     */
    public int currentColumn() {
        return column;
    }

    /** Current nesting level, 0 at top level. */
    public int getIndentLevel() {
        return indentLevel;
    }

    /** Whether a requested blank line has not been written yet. */
    public boolean hasPendingBlankLine() {
        return pendingBlankLine;
    }

    private void markContent() {
        if (!scopeHasContent.peek()) {
            scopeHasContent.pop();
            scopeHasContent.push(true);
        }
    }

    /**
     * Marks entry into one more nested node and returns the new nesting depth.
     */
    int enterNode() {
        return ++depth;
    }

    void exitNode() {
        depth--;
    }

    @Override
    public String toString() {
        return content.toString();
    }
}
