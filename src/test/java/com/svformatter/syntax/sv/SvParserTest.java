package com.svformatter.syntax.sv;

import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.syntax.SyntaxNode;
import com.svformatter.syntax.SyntaxTree;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SvParserTest {
    private SvParser parser;

    @BeforeEach
    void setUp() {
        parser = new SvParser(GrammarMetadata.load("/systemverilog/node-types.yml"));
    }

    @Test
    void function_producesTreeSitterShapedNodes() {
        SyntaxTree tree = parser.parse("function automatic int f(input int a);\n  return a;\nendfunction\n");

        SyntaxNode function = tree.getRoot().getChild(0);
        assertThat(function.getType()).isEqualTo("function_declaration");
        assertThat(types(function.getChildren())).containsExactly("function", "function_body_declaration");

        SyntaxNode body = function.getChild(1);
        assertThat(types(body.getChildren())).containsExactly(
                "lifetime", "function_data_type_or_implicit1", "function_identifier", "tf_port_list", ";",
                "function_statement_or_null", "endfunction");
        assertThat(body.getChild(2).getFieldName()).isEqualTo("name");
        assertThat(tree.hasErrors()).isFalse();
    }

    @Test
    void symbols_resolveThroughGrammarMetadata() {
        GrammarMetadata grammar = parser.getGrammar();
        SyntaxTree tree = parser.parse("function f;\nendfunction\n");

        SyntaxNode function = tree.getRoot().getChild(0);
        assertThat(function.getSymbol()).isEqualTo(grammar.symbolId("function_declaration", true));
        assertThat(function.getChild(0).getSymbol()).isEqualTo(grammar.symbolId("function", false));
        assertThat(function.getChild(0).isNamed()).isFalse();
    }

    @Test
    void binaryExpression_respectsPrecedenceAndFields() {
        SyntaxNode expression = returnValue("function f;\n  return a + b * 2;\nendfunction\n");

        assertThat(expression.getChildCount()).isEqualTo(3);
        assertThat(expression.getChild(0).getFieldName()).isEqualTo("left");
        assertThat(expression.getChild(1).getText()).isEqualTo("+");
        assertThat(expression.getChild(1).getFieldName()).isEqualTo("operator");
        assertThat(expression.getChild(2).getText()).isEqualTo("b * 2");
        assertThat(expression.getChild(2).getChildCount()).isEqualTo(3);
    }

    @Test
    void leftAssociativeOperators_nestToTheLeft() {
        SyntaxNode expression = returnValue("function f;\n  return a - b - c;\nendfunction\n");

        assertThat(expression.getChild(0).getText()).isEqualTo("a - b");
        assertThat(expression.getChild(2).getText()).isEqualTo("c");
    }

    @Test
    void conditionalAndUnary_haveOwnNodes() {
        SyntaxNode expression = returnValue("function f;\n  return !a ? -b : c;\nendfunction\n");

        SyntaxNode conditional = expression.getChild(0);
        assertThat(conditional.getType()).isEqualTo("conditional_expression");
        assertThat(conditional.getNamedChildren()).hasSize(3);
        assertThat(conditional.getChild(0).getChild(0).getType()).isEqualTo("unary_expression");
    }

    @Test
    void nonblockingAssignment_isDistinguishedFromComparison() {
        SyntaxTree tree = parser.parse("function f;\n  q <= a <= b;\nendfunction\n");

        SyntaxNode statementItem = tree.getRoot().getChild(0).getChild(1).getChild(2).getChild(0).getChild(0);
        SyntaxNode assignment = statementItem.getChild(0);
        assertThat(assignment.getType()).isEqualTo("nonblocking_assignment");
        assertThat(assignment.getChild(1).isNamed()).isFalse();
        assertThat(assignment.getChild(2).getChildCount()).isEqualTo(3);
    }

    @Test
    void class_withMembersAndEndLabel() {
        SyntaxTree tree = parser.parse("virtual class c extends base;\n  local int x;\n"
                + "  static function void f();\n  endfunction\nendclass : c\n");

        SyntaxNode declaration = tree.getRoot().getChild(0);
        assertThat(types(declaration.getChildren())).containsExactly(
                "virtual", "class", "class_identifier", "extends", "class_type", ";",
                "class_item", "class_item", "endclass", ":", "class_identifier");
        assertThat(declaration.getChild(6).getChild(0).getType()).isEqualTo("class_property");
        assertThat(declaration.getChild(7).getChild(0).getType()).isEqualTo("class_method");
        assertThat(tree.hasErrors()).isFalse();
    }

    @Test
    void unsupportedStatement_becomesErrorNodeAndParsingContinues() {
        SyntaxTree tree = parser.parse("function f;\n  if (a) b = 1;\n  c = 2;\nendfunction\n");

        SyntaxNode body = tree.getRoot().getChild(0).getChild(1);
        assertThat(tree.hasErrors()).isTrue();
        assertThat(body.getChild(2).isError()).isTrue();
        assertThat(body.getChild(2).getText()).isEqualTo("if (a) b = 1;");
        assertThat(body.getChild(3).getType()).isEqualTo("function_statement_or_null");
    }

    @Test
    void unsupportedTopLevelItem_isSkippedUpToNextDeclaration() {
        SyntaxTree tree = parser.parse("module m; endmodule\nfunction f;\nendfunction\n");

        SyntaxNode root = tree.getRoot();
        assertThat(root.getChildCount()).isEqualTo(2);
        assertThat(root.getChild(0).isError()).isTrue();
        assertThat(root.getChild(0).getText()).isEqualTo("module m; endmodule");
        assertThat(root.getChild(1).getType()).isEqualTo("function_declaration");
    }

    @Test
    void missingEndfunction_keepsAllTokens() {
        String source = "function f;\n  a = 1;\nclass c;\nendclass\n";
        SyntaxTree tree = parser.parse(source);

        SyntaxNode root = tree.getRoot();
        assertThat(root.getChild(0).isError()).isTrue();
        assertThat(root.getChild(0).getText()).isEqualTo("function f;\n  a = 1;");
        assertThat(root.getChild(1).getType()).isEqualTo("class_declaration");
    }

    @Test
    void commentInsideStatement_isKeptInErrorNode() {
        SyntaxTree tree = parser.parse("function f;\n  a = /* one */ 1;\nendfunction\n");

        SyntaxNode error = tree.getRoot().getChild(0).getChild(1).getChild(2);
        assertThat(error.isError()).isTrue();
        assertThat(types(error.getChildren())).contains("comment");
    }

    @Test
    void deepNesting_isRejectedWithoutStackOverflow() {
        StringBuilder expression = new StringBuilder();
        for (int i = 0; i < SvParser.MAX_NESTING_DEPTH + 10; i++) {
            expression.append('(');
        }
        expression.append('a');
        for (int i = 0; i < SvParser.MAX_NESTING_DEPTH + 10; i++) {
            expression.append(')');
        }

        SyntaxTree tree = parser.parse("function f;\n  return " + expression + ";\nendfunction\n");

        assertThat(tree.hasErrors()).isTrue();
    }

    @Test
    void nestingBelowTheLimit_parses() {
        int levels = SvParser.MAX_NESTING_DEPTH - 8;
        String expression = "(".repeat(levels) + "a + b * c" + ")".repeat(levels);

        SyntaxTree tree = parser.parse("function f;\n  return " + expression + ";\nendfunction\n");

        assertThat(tree.hasErrors()).isFalse();
    }

    @Test
    void longOperatorChain_parsesLeftDeepWithoutRecursion() {
        int terms = 5_000;
        StringBuilder chain = new StringBuilder("b");
        for (int i = 1; i < terms; i++) {
            chain.append(" + b");
        }

        SyntaxTree tree = parser.parse("function f;\n  a = " + chain + ";\nendfunction\n");

        assertThat(tree.hasErrors()).isFalse();
        // statement > statement_item > operator_assignment > expression
        SyntaxNode node = tree.getRoot().getChild(0).getChild(1).getChild(2)
                .getChild(0).getChild(0).getChild(0).getChild(2);
        int depth = 0;
        while (node.getChildCount() == 3) {
            assertThat(node.getChild(2).getChildCount()).isEqualTo(1);
            node = node.getChild(0);
            depth++;
        }
        assertThat(depth).isEqualTo(terms - 1);
    }

    @Test
    void emptySource_hasRootWithoutChildren() {
        SyntaxTree tree = parser.parse("");

        assertThat(tree.getRoot().getType()).isEqualTo("source_file");
        assertThat(tree.getRoot().getChildCount()).isZero();
    }

    private SyntaxNode returnValue(String source) {
        SyntaxTree tree = parser.parse(source);
        SyntaxNode body = tree.getRoot().getChild(0).getChild(1);
        // function_statement_or_null > statement > statement_item > jump_statement
        SyntaxNode jump = body.getChild(2).getChild(0).getChild(0).getChild(0);
        return jump.getChild(1);
    }

    private static List<String> types(List<SyntaxNode> nodes) {
        return nodes.stream().map(SyntaxNode::getType).collect(Collectors.toList());
    }
}
