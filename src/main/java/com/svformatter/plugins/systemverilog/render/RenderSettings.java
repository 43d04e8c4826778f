package com.svformatter.plugins.systemverilog.render;

/**
 * Layout parameters of a render pass.
 */
public final class RenderSettings {
    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_LINE_LENGTH = 80;

    public static final RenderSettings DEFAULTS =
            new RenderSettings(DEFAULT_INDENT_SIZE, DEFAULT_LINE_LENGTH, ErrorNodePolicy.ABORT);

    private final int indentSize;
    private final int lineLength;
    private final ErrorNodePolicy errorNodePolicy;

    public RenderSettings(int indentSize, int lineLength, ErrorNodePolicy errorNodePolicy) {
        this.indentSize = indentSize;
        this.lineLength = lineLength;
        this.errorNodePolicy = errorNodePolicy;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public int getLineLength() {
        return lineLength;
    }

    public ErrorNodePolicy getErrorNodePolicy() {
        return errorNodePolicy;
    }

    public RenderSettings withErrorNodePolicy(ErrorNodePolicy policy) {
        return new RenderSettings(indentSize, lineLength, policy);
    }

    @Override
    public String toString() {
        return "RenderSettings[indentSize=" + indentSize + ", lineLength=" + lineLength
                + ", errorNodes=" + errorNodePolicy + "]";
    }
}
