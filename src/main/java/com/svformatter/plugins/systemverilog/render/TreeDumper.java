package com.svformatter.plugins.systemverilog.render;

import com.svformatter.syntax.SyntaxNode;
import com.svformatter.syntax.SyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Diagnostic rendering of a syntax tree.
 *
 * <p>The output is the s-expression of the named nodes, a blank line, then one line per node
 * (named or not), indented four spaces per depth level:
 *
 * <pre>
 * function_declaration
 *     anonymous: function
 *     function_body_declaration
 *         function_identifier(name)
 *             simple_identifier: f
 * </pre>
 *
 * Both walks use an explicit work list, so deep trees cannot overflow the stack.
 */
public final class TreeDumper {
    private static final String INDENT = "    ";
    private static final Object CLOSE = new Object();

    public String dump(SyntaxTree tree) {
        StringBuilder out = new StringBuilder();
        appendSexp(tree.getRoot(), out);
        out.append("\n\n");
        appendWalk(tree.getRoot(), out);
        return out.toString();
    }

    /**
     * Appends the tree-sitter style s-expression of the named nodes under {@code root}.
     */
    void appendSexp(SyntaxNode root, StringBuilder out) {
        Deque<Object> work = new ArrayDeque<>();
        work.push(root);
        boolean first = true;
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item == CLOSE) {
                out.append(')');
                continue;
            }
            SyntaxNode node = (SyntaxNode) item;
            if (!first) {
                out.append(' ');
            }
            first = false;
            if (node.getFieldName() != null) {
                out.append(node.getFieldName()).append(": ");
            }
            out.append('(').append(node.getType());

            work.push(CLOSE);
            List<SyntaxNode> named = node.getNamedChildren();
            for (int i = named.size() - 1; i >= 0; i--) {
                work.push(named.get(i));
            }
        }
    }

    void appendWalk(SyntaxNode root, StringBuilder out) {
        Deque<SyntaxNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);

        while (!nodes.isEmpty()) {
            SyntaxNode node = nodes.pop();
            int depth = depths.pop();

            for (int i = 0; i < depth; i++) {
                out.append(INDENT);
            }
            out.append(node.isNamed() ? node.getType() : "anonymous");
            if (node.getFieldName() != null) {
                out.append('(').append(node.getFieldName()).append(')');
            }
            if (node.getChildCount() == 0) {
                out.append(": ").append(node.getText());
            }
            out.append('\n');

            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                depths.push(depth + 1);
            }
        }
    }
}
