package com.svformatter.syntax.sv;

import com.svformatter.syntax.Point;

public class Token {
    private final TokenType type;
    private final String text;
    private final int startOffset;
    private final int endOffset;
    private final Point start;
    private final Point end;

    public Token(TokenType type, String text, int startOffset, int endOffset, Point start, Point end) {
        this.type = type;
        this.text = text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public Point getStart() {
        return start;
    }

    public Point getEnd() {
        return end;
    }

    /**
     * True for a keyword or operator token with exactly this text.
     */
    public boolean is(String value) {
        return (type == TokenType.KEYWORD || type == TokenType.OPERATOR) && text.equals(value);
    }

    @Override
    public String toString() {
        return "Token [type=" + type + ", text=" + text + ", start=" + start + "]";
    }
}
