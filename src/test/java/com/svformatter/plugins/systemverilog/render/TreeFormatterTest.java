package com.svformatter.plugins.systemverilog.render;

import com.svformatter.api.error.IoFailureException;
import com.svformatter.api.error.LanguageConfigurationException;
import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.syntax.SyntaxTree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeFormatterTest {
    private final TreeFormatter formatter = new TreeFormatter(SyntaxFixtures.CLASSIFIER, RenderSettings.DEFAULTS);

    @Test
    void format_writesRenderedTextToSink() {
        SyntaxFixtures f = new SyntaxFixtures("");
        StringWriter sink = new StringWriter();

        formatter.format(f.tree(), sink);

        assertThat(sink.toString()).isEmpty();
    }

    @Test
    void rejectingSink_raisesIoFailure() {
        SyntaxFixtures f = new SyntaxFixtures("");

        assertThatThrownBy(() -> formatter.dump(f.tree(), new FailingWriter()))
                .isInstanceOf(IoFailureException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void treeFromAnotherGrammar_isRejected() {
        SyntaxFixtures f = new SyntaxFixtures("");
        GrammarMetadata other = new GrammarMetadata("systemverilog-subset", 99,
                List.of(new GrammarMetadata.Symbol(0, "end", false)));
        SyntaxTree tree = new SyntaxTree(f.tree().getRoot(), "", other);

        assertThatThrownBy(() -> formatter.format(tree))
                .isInstanceOf(LanguageConfigurationException.class)
                .hasMessageContaining("v99");
    }

    private static final class FailingWriter extends Writer {
        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
