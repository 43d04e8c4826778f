package com.svformatter.plugins.systemverilog.render;

import com.svformatter.api.error.StructuralMismatchException;
import com.svformatter.syntax.CstNode;
import com.svformatter.syntax.SyntaxTree;

import java.io.StringWriter;
import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRendererTest {
    private final NodeRenderer renderer = new NodeRenderer(SyntaxFixtures.CLASSIFIER, RenderSettings.DEFAULTS);

    @Test
    void binaryExpression_spacesTheOperator() {
        SyntaxFixtures f = new SyntaxFixtures("a+b");
        CstNode expression = f.node("expression",
                f.node("expression", f.named("simple_identifier", "a")),
                f.anonymous("+"),
                f.node("expression", f.named("simple_identifier", "b")));

        assertThat(renderer.renderFragment(expression)).isEqualTo("a + b");
    }

    @Test
    void expressionWithTwoChildren_isStructuralMismatchAndWritesNothing() {
        SyntaxFixtures f = new SyntaxFixtures("function f;\nreturn a b;\nendfunction");
        CstNode function = f.node("function_declaration",
                f.anonymous("function"),
                f.node("function_body_declaration",
                        f.node("function_identifier", f.named("simple_identifier", "f")),
                        f.anonymous(";"),
                        f.node("function_statement_or_null",
                                f.node("statement",
                                        f.node("statement_item",
                                                f.node("jump_statement",
                                                        f.anonymous("return"),
                                                        f.node("expression",
                                                                f.named("simple_identifier", "a"),
                                                                f.named("simple_identifier", "b")),
                                                        f.anonymous(";"))))),
                        f.anonymous("endfunction")));
        SyntaxTree tree = f.tree(function);
        TreeFormatter formatter = new TreeFormatter(SyntaxFixtures.CLASSIFIER, RenderSettings.DEFAULTS);
        StringWriter sink = new StringWriter();

        assertThatThrownBy(() -> formatter.format(tree, sink))
                .isInstanceOfSatisfying(StructuralMismatchException.class, e -> {
                    assertThat(e.getNodeType()).isEqualTo("expression");
                    assertThat(e.getKind()).isEqualTo("EXPRESSION");
                    assertThat(e.getRow()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo(7);
                    assertThat(e.isErrorRecovery()).isFalse();
                });
        assertThat(sink.toString()).isEmpty();
    }

    @Test
    void longOperatorChain_rendersWithoutRecursingPerOperand() {
        int terms = 20_000;
        SyntaxFixtures f = new SyntaxFixtures("b" + "+b".repeat(terms - 1));
        CstNode chain = f.node("expression", f.named("simple_identifier", "b"));
        for (int i = 1; i < terms; i++) {
            CstNode operator = f.anonymous("+");
            chain = f.node("expression", chain, operator, f.node("expression", f.named("simple_identifier", "b")));
        }

        String rendered = renderer.renderFragment(chain);

        assertThat(rendered).startsWith("b + b + b").endsWith("b + b");
        assertThat(rendered).hasSize(terms + 3 * (terms - 1));
    }

    @Test
    void excessiveNesting_isStructuralMismatch() {
        int depth = NodeRenderer.MAX_RENDER_DEPTH;
        SyntaxFixtures f = new SyntaxFixtures("(".repeat(depth) + "x" + ")".repeat(depth));
        CstNode[] opens = new CstNode[depth];
        for (int i = 0; i < depth; i++) {
            opens[i] = f.anonymous("(");
        }
        CstNode inner = f.node("expression", f.named("simple_identifier", "x"));
        for (int i = depth - 1; i >= 0; i--) {
            CstNode close = f.anonymous(")");
            inner = f.node("expression", f.node("parenthesized_expression", opens[i], inner, close));
        }
        CstNode outermost = inner;

        assertThatThrownBy(() -> renderer.renderFragment(outermost))
                .isInstanceOf(StructuralMismatchException.class)
                .hasMessageContaining("nested deeper than " + NodeRenderer.MAX_RENDER_DEPTH);
    }

    @Test
    void unknownKind_rendersNamedChildrenOnly() {
        SyntaxFixtures f = new SyntaxFixtures("@ a # 1");
        CstNode mystery = f.unknown("mystery",
                f.anonymous("@"),
                f.named("simple_identifier", "a"),
                f.anonymous("#"),
                f.named("primary_literal", "1"));

        assertThat(SyntaxFixtures.CLASSIFIER.kindOf(mystery)).isEqualTo(Kind.UNKNOWN);
        assertThat(renderer.renderFragment(mystery)).isEqualTo("a1");
    }

    @Test
    void unmappedGrammarSymbol_usesTheSameFallback() {
        SyntaxFixtures f = new SyntaxFixtures("foo(x, 1)");
        CstNode call = f.node("tf_call",
                f.named("simple_identifier", "foo"),
                f.node("list_of_arguments_parent",
                        f.anonymous("("),
                        f.node("expression", f.named("simple_identifier", "x")),
                        f.anonymous(","),
                        f.node("expression", f.named("primary_literal", "1")),
                        f.anonymous(")")));

        assertThat(SyntaxFixtures.CLASSIFIER.kindOf(call)).isEqualTo(Kind.UNKNOWN);
        assertThat(renderer.renderFragment(call)).isEqualTo("foo(x, 1)");
    }

    @Test
    void jumpStatement_dropsParenthesesAroundWholeValueOnly() {
        SyntaxFixtures f = new SyntaxFixtures("return((a)+b);");
        CstNode jump = f.node("jump_statement",
                f.anonymous("return"),
                f.node("expression",
                        f.node("parenthesized_expression",
                                f.anonymous("("),
                                f.node("expression",
                                        f.node("expression",
                                                f.node("parenthesized_expression",
                                                        f.anonymous("("),
                                                        f.node("expression", f.named("simple_identifier", "a")),
                                                        f.anonymous(")"))),
                                        f.anonymous("+"),
                                        f.node("expression", f.named("simple_identifier", "b"))),
                                f.anonymous(")"))),
                f.anonymous(";"));

        assertThat(renderer.renderFragment(jump)).isEqualTo("return (a) + b");
    }

    @Test
    void operatorAssignment_needsThreeChildren() {
        SyntaxFixtures f = new SyntaxFixtures("x += 1");
        CstNode complete = f.node("operator_assignment",
                f.node("variable_lvalue", f.named("simple_identifier", "x")),
                f.named("assignment_operator", "+="),
                f.node("expression", f.named("primary_literal", "1")));
        assertThat(renderer.renderFragment(complete)).isEqualTo("x += 1");

        SyntaxFixtures g = new SyntaxFixtures("x +=");
        CstNode truncated = g.node("operator_assignment",
                g.node("variable_lvalue", g.named("simple_identifier", "x")),
                g.named("assignment_operator", "+="));
        assertThatThrownBy(() -> renderer.renderFragment(truncated))
                .isInstanceOf(StructuralMismatchException.class)
                .hasMessageContaining("operator_assignment");
    }

    @Test
    void errorNode_followsConfiguredPolicy() {
        SyntaxFixtures f = new SyntaxFixtures("if  (x)");
        CstNode error = f.node("ERROR", f.anonymous("if"), f.anonymous("("), f.named("simple_identifier", "x"),
                f.anonymous(")"));

        assertThatThrownBy(() -> renderer.renderFragment(error))
                .isInstanceOfSatisfying(StructuralMismatchException.class,
                        e -> assertThat(e.isErrorRecovery()).isTrue());

        NodeRenderer verbatim = new NodeRenderer(SyntaxFixtures.CLASSIFIER,
                RenderSettings.DEFAULTS.withErrorNodePolicy(ErrorNodePolicy.VERBATIM));
        assertThat(verbatim.renderFragment(error)).isEqualTo("if  (x)");
    }

    @Test
    void comment_keepsInteriorLinesUntouched() {
        SyntaxFixtures f = new SyntaxFixtures("/* a\n     b */");
        CstNode comment = f.named("comment", "/* a\n     b */");
        RenderBuffer buffer = new RenderBuffer(4);
        buffer.pushIndent();

        renderer.render(comment, buffer);

        assertThat(buffer.toString()).isEqualTo("    /* a\n     b */");
    }

    @Test
    void everyStructuralKind_hasARule() {
        Set<Kind> handledByParentOrFallback = EnumSet.of(Kind.UNKNOWN, Kind.FUNCTION_BODY, Kind.FUNCTION_IDENTIFIER,
                Kind.PORT_LIST, Kind.STATEMENT, Kind.CLASS_ITEM, Kind.FUNCTION_KEYWORD, Kind.ENDFUNCTION_KEYWORD,
                Kind.CLASS_KEYWORD, Kind.ENDCLASS_KEYWORD, Kind.EXTENDS_KEYWORD, Kind.SEMICOLON, Kind.COLON);

        assertThat(renderer.registeredKinds())
                .containsAll(EnumSet.complementOf(EnumSet.copyOf(handledByParentOrFallback)));
    }
}
