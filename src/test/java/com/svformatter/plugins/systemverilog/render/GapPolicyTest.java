package com.svformatter.plugins.systemverilog.render;

import com.svformatter.syntax.CstNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GapPolicyTest {
    private GapPolicy gapPolicy;

    @BeforeEach
    void setUp() {
        gapPolicy = new GapPolicy(SyntaxFixtures.CLASSIFIER);
    }

    @Test
    void gap_countsBlankLinesBetweenQualifyingSiblings() {
        SyntaxFixtures f = new SyntaxFixtures("// a\n\n\n// b\n// c");
        CstNode first = f.named("comment", "// a");
        CstNode second = f.named("comment", "// b");
        CstNode third = f.named("comment", "// c");
        f.tree(first, second, third);

        assertThat(gapPolicy.gapBefore(first, GapPolicy.SOURCE_FILE_ITEMS)).isZero();
        assertThat(gapPolicy.gapBefore(second, GapPolicy.SOURCE_FILE_ITEMS)).isEqualTo(2);
        assertThat(gapPolicy.gapBefore(third, GapPolicy.SOURCE_FILE_ITEMS)).isZero();
    }

    @Test
    void gap_ignoresSiblingsOutsideTheSet() {
        SyntaxFixtures f = new SyntaxFixtures("f;\n\n// a");
        CstNode semicolon = f.anonymous(";");
        CstNode comment = f.named("comment", "// a");
        f.tree(semicolon, comment);

        assertThat(gapPolicy.gapBefore(comment, GapPolicy.FUNCTION_BODY_ITEMS)).isZero();
    }

    @Test
    void apply_requestsAtMostOneBlankLine() {
        SyntaxFixtures f = new SyntaxFixtures("// a\n\n\n\n// b");
        CstNode first = f.named("comment", "// a");
        CstNode second = f.named("comment", "// b");
        f.tree(first, second);

        RenderBuffer buffer = new RenderBuffer(4);
        buffer.appendText("// a\n");
        gapPolicy.apply(second, GapPolicy.SOURCE_FILE_ITEMS, buffer);
        buffer.appendText("// b\n");

        assertThat(buffer.toString()).isEqualTo("// a\n\n// b\n");
    }

    @Test
    void sameLineSibling_hasNoGap() {
        SyntaxFixtures f = new SyntaxFixtures("// a /* b */");
        CstNode first = f.named("comment", "// a");
        CstNode second = f.named("comment", "/* b */");
        f.tree(first, second);

        assertThat(gapPolicy.gapBefore(second, GapPolicy.CLASS_BODY_ITEMS)).isZero();
    }
}
