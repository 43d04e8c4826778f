package com.svformatter.plugins.systemverilog.render;

import com.svformatter.api.error.IoFailureException;
import com.svformatter.api.error.LanguageConfigurationException;
import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.syntax.SyntaxTree;

import java.io.IOException;
import java.io.Writer;

/**
 * Entry point of a render pass: one fresh {@link RenderBuffer} per call, written to the sink
 * once and only after the whole tree rendered. A structural mismatch therefore leaves the sink
 * untouched.
 */
public final class TreeFormatter {
    private final NodeRenderer renderer;
    private final TreeDumper dumper = new TreeDumper();

    public TreeFormatter(SymbolClassifier classifier, RenderSettings settings) {
        this.renderer = new NodeRenderer(classifier, settings);
    }

    public String format(SyntaxTree tree) {
        checkGrammar(tree);
        RenderBuffer buffer = new RenderBuffer(renderer.getSettings().getIndentSize());
        renderer.render(tree.getRoot(), buffer);
        return buffer.toString();
    }

    public void format(SyntaxTree tree, Writer sink) {
        write(format(tree), sink);
    }

    public String dump(SyntaxTree tree) {
        return dumper.dump(tree);
    }

    public void dump(SyntaxTree tree, Writer sink) {
        write(dump(tree), sink);
    }

    public RenderSettings getSettings() {
        return renderer.getSettings();
    }

    private void checkGrammar(SyntaxTree tree) {
        GrammarMetadata grammar = tree.getGrammar();
        SymbolClassifier classifier = renderer.getClassifier();
        if (grammar != null && (!grammar.getName().equals(classifier.getGrammarName())
                || grammar.getVersion() != classifier.getGrammarVersion())) {
            throw new LanguageConfigurationException("Tree was parsed with " + grammar.getName() + " v"
                    + grammar.getVersion() + " but the kind table was generated for "
                    + classifier.getGrammarName() + " v" + classifier.getGrammarVersion());
        }
    }

    private static void write(String text, Writer sink) {
        try {
            sink.write(text);
            sink.flush();
        } catch (IOException e) {
            throw new IoFailureException("Could not write output", e);
        }
    }
}
