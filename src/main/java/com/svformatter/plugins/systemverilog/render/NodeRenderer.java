package com.svformatter.plugins.systemverilog.render;

import com.svformatter.api.error.StructuralMismatchException;
import com.svformatter.syntax.SyntaxNode;
import com.svformatter.util.LoggerUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders a syntax tree into a {@link RenderBuffer}, one construct rule per {@link Kind}.
 *
 * <p>A kind without a registered rule, including {@link Kind#UNKNOWN}, falls back to rendering
 * its named children in order, so every tree renders. A rule that finds children it does not
 * expect throws {@link StructuralMismatchException} instead of guessing.
 *
 * <p>Instances hold no per-call state and may be shared between threads.
 */
public final class NodeRenderer {
    private static final Logger logger = LoggerUtil.getLogger(NodeRenderer.class);

    /**
     * Deepest subtree a render pass descends into. Left-deep operator chains are walked in a
     * loop and do not count.
     */
    static final int MAX_RENDER_DEPTH = 512;

    @FunctionalInterface
    interface ConstructRule {
        void render(SyntaxNode node, RenderBuffer buffer);
    }

    private final SymbolClassifier classifier;
    private final RenderSettings settings;
    private final GapPolicy gapPolicy;
    private final WrapPlanner wrapPlanner;
    private final Map<Kind, ConstructRule> rules = new EnumMap<>(Kind.class);

    public NodeRenderer(SymbolClassifier classifier, RenderSettings settings) {
        this.classifier = classifier;
        this.settings = settings;
        this.gapPolicy = new GapPolicy(classifier);
        this.wrapPlanner = new WrapPlanner(settings.getLineLength());
        registerRules();
    }

    private void registerRules() {
        for (Kind kind : new Kind[]{Kind.IDENTIFIER, Kind.LITERAL, Kind.TYPE_KEYWORD, Kind.OPERATOR,
                Kind.QUALIFIER, Kind.KEYWORD, Kind.PUNCTUATION, Kind.VARIABLE_LVALUE, Kind.COMMENT}) {
            rules.put(kind, this::renderVerbatim);
        }

        rules.put(Kind.SOURCE_FILE, this::renderSourceFile);
        rules.put(Kind.ERROR, this::renderErrorNode);

        rules.put(Kind.EXPRESSION, this::renderExpression);
        rules.put(Kind.PARENTHESIZED_EXPRESSION, this::renderParenthesized);
        rules.put(Kind.UNARY_EXPRESSION, this::renderUnary);
        rules.put(Kind.CONDITIONAL_EXPRESSION, this::renderConditional);
        rules.put(Kind.BIT_SELECT, this::renderBitSelect);
        rules.put(Kind.PACKED_DIMENSION, this::renderPackedDimension);
        rules.put(Kind.ARGUMENT_LIST, this::renderArgumentList);

        rules.put(Kind.JUMP_STATEMENT, this::renderJumpStatement);
        rules.put(Kind.OPERATOR_ASSIGNMENT, this::renderOperatorAssignment);

        rules.put(Kind.DATA_TYPE, this::renderSpaceJoined);
        rules.put(Kind.RETURN_TYPE, this::renderSpaceJoined);
        rules.put(Kind.PORT_ITEM, this::renderSpaceJoined);
        rules.put(Kind.DATA_DECLARATION, this::renderDataDeclaration);
        rules.put(Kind.VARIABLE_DECL_LIST, (node, buffer) -> renderJoined(node.getNamedChildren(), ", ", buffer));
        rules.put(Kind.VARIABLE_DECL_ASSIGNMENT, this::renderVariableDeclAssignment);

        rules.put(Kind.FUNCTION_DECLARATION, this::renderFunctionDeclaration);
        rules.put(Kind.CLASS_DECLARATION, this::renderClassDeclaration);
        rules.put(Kind.CLASS_METHOD, this::renderClassMethod);
        rules.put(Kind.CLASS_PROPERTY, this::renderClassProperty);
    }

    /**
     * Renders {@code node} and its subtree into {@code buffer}.
     */
    public void render(SyntaxNode node, RenderBuffer buffer) {
        Kind kind = classifier.kindOf(node);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("render " + node.getType() + " [" + kind + "] at " + node.getStartPoint());
        }
        int depth = buffer.enterNode();
        try {
            if (depth > MAX_RENDER_DEPTH) {
                throw mismatch(node, "nested deeper than " + MAX_RENDER_DEPTH + " levels");
            }
            rules.getOrDefault(kind, this::renderNamedChildren).render(node, buffer);
        } finally {
            buffer.exitNode();
        }
    }

    /**
     * Renders {@code node} into a fresh buffer and returns the text, leaving no trace elsewhere.
     */
    public String renderFragment(SyntaxNode node) {
        RenderBuffer fragment = new RenderBuffer(settings.getIndentSize());
        render(node, fragment);
        return fragment.toString();
    }

    public SymbolClassifier getClassifier() {
        return classifier;
    }

    public RenderSettings getSettings() {
        return settings;
    }

    // ------------------------------------------------------------------ generic

    private void renderNamedChildren(SyntaxNode node, RenderBuffer buffer) {
        for (SyntaxNode child : node.getNamedChildren()) {
            render(child, buffer);
        }
    }

    private void renderVerbatim(SyntaxNode node, RenderBuffer buffer) {
        buffer.appendRaw(node.getText());
    }

    private void renderSpaceJoined(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                buffer.appendChar(' ');
            }
            SyntaxNode child = children.get(i);
            if (child.isNamed()) {
                render(child, buffer);
            } else {
                buffer.appendText(child.getText());
            }
        }
    }

    private void renderJoined(List<SyntaxNode> nodes, String separator, RenderBuffer buffer) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                buffer.appendText(separator);
            }
            render(nodes.get(i), buffer);
        }
    }

    private void renderErrorNode(SyntaxNode node, RenderBuffer buffer) {
        if (settings.getErrorNodePolicy() == ErrorNodePolicy.ABORT) {
            throw new StructuralMismatchException("source contains a syntax error", node.getType(),
                    Kind.ERROR.name(), node.getStartPoint().getRow(), node.getStartPoint().getColumn(), true);
        }
        buffer.appendRaw(node.getText());
    }

    // -------------------------------------------------------------- expressions

    private void renderExpression(SyntaxNode node, RenderBuffer buffer) {
        // left operands are walked in a loop so a long chain does not recurse
        Deque<SyntaxNode> binaries = new ArrayDeque<>();
        SyntaxNode current = node;
        while (classifier.kindOf(current) == Kind.EXPRESSION && current.getChildCount() == 3) {
            binaries.push(current);
            current = current.getChild(0);
        }
        if (classifier.kindOf(current) != Kind.EXPRESSION) {
            render(current, buffer);
        } else if (current.getChildCount() == 1) {
            render(current.getChild(0), buffer);
        } else {
            throw mismatch(current, "expression with " + current.getChildCount() + " children");
        }

        while (!binaries.isEmpty()) {
            SyntaxNode binary = binaries.pop();
            buffer.appendChar(' ');
            buffer.appendText(binary.getChild(1).getText());
            buffer.appendChar(' ');
            render(binary.getChild(2), buffer);
        }
    }

    private void renderParenthesized(SyntaxNode node, RenderBuffer buffer) {
        SyntaxNode inner = onlyNamedChild(node);
        buffer.appendChar('(');
        render(inner, buffer);
        buffer.appendChar(')');
    }

    private void renderUnary(SyntaxNode node, RenderBuffer buffer) {
        expectChildCount(node, 2);
        buffer.appendText(node.getChild(0).getText());
        render(node.getChild(1), buffer);
    }

    private void renderConditional(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> operands = node.getNamedChildren();
        if (operands.size() != 3) {
            throw mismatch(node, "conditional expression with " + operands.size() + " operands");
        }
        render(operands.get(0), buffer);
        buffer.appendText(" ? ");
        render(operands.get(1), buffer);
        buffer.appendText(" : ");
        render(operands.get(2), buffer);
    }

    private void renderBitSelect(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> bounds = node.getNamedChildren();
        if (bounds.isEmpty() || bounds.size() > 2) {
            throw mismatch(node, "bit select with " + bounds.size() + " bounds");
        }
        buffer.appendChar('[');
        renderJoined(bounds, ":", buffer);
        buffer.appendChar(']');
    }

    private void renderPackedDimension(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> bounds = node.getNamedChildren();
        if (bounds.size() != 2) {
            throw mismatch(node, "packed dimension with " + bounds.size() + " bounds");
        }
        buffer.appendChar('[');
        renderJoined(bounds, ":", buffer);
        buffer.appendChar(']');
    }

    private void renderArgumentList(SyntaxNode node, RenderBuffer buffer) {
        buffer.appendChar('(');
        renderJoined(node.getNamedChildren(), ", ", buffer);
        buffer.appendChar(')');
    }

    // --------------------------------------------------------------- statements

    private void renderJumpStatement(SyntaxNode node, RenderBuffer buffer) {
        buffer.appendText(node.getChild(0).getText());
        if (node.getChildCount() == 3) {
            buffer.appendChar(' ');
            render(stripEnclosingParentheses(node.getChild(1)), buffer);
        }
    }

    /**
     * {@code return(a + b)} becomes {@code return a + b}; inner parentheses are kept.
     */
    private SyntaxNode stripEnclosingParentheses(SyntaxNode value) {
        SyntaxNode current = value;
        while (classifier.kindOf(current) == Kind.EXPRESSION && current.getChildCount() == 1
                && classifier.kindOf(current.getChild(0)) == Kind.PARENTHESIZED_EXPRESSION
                && current.getChild(0).getNamedChildren().size() == 1) {
            current = current.getChild(0).getNamedChildren().get(0);
        }
        return current;
    }

    private void renderOperatorAssignment(SyntaxNode node, RenderBuffer buffer) {
        expectChildCount(node, 3);
        render(node.getChild(0), buffer);
        buffer.appendChar(' ');
        buffer.appendText(node.getChild(1).getText());
        buffer.appendChar(' ');
        render(node.getChild(2), buffer);
    }

    // ------------------------------------------------------------- declarations

    private void renderDataDeclaration(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> parts = node.getNamedChildren();
        if (parts.size() != 2) {
            throw mismatch(node, "data declaration with " + parts.size() + " named parts");
        }
        render(parts.get(0), buffer);
        buffer.appendChar(' ');
        render(parts.get(1), buffer);
    }

    private void renderVariableDeclAssignment(SyntaxNode node, RenderBuffer buffer) {
        List<SyntaxNode> parts = node.getNamedChildren();
        if (parts.isEmpty() || parts.size() > 2) {
            throw mismatch(node, "variable declaration with " + parts.size() + " named parts");
        }
        render(parts.get(0), buffer);
        if (parts.size() == 2) {
            buffer.appendText(" = ");
            render(parts.get(1), buffer);
        }
    }

    private void renderFunctionDeclaration(SyntaxNode node, RenderBuffer buffer) {
        expectChildCount(node, 2);
        SyntaxNode keyword = node.getChild(0);
        SyntaxNode body = node.getChild(1);
        if (classifier.kindOf(keyword) != Kind.FUNCTION_KEYWORD) {
            throw mismatch(keyword, "function declaration must start with 'function'");
        }
        if (classifier.kindOf(body) != Kind.FUNCTION_BODY) {
            throw mismatch(body, "function declaration without a body");
        }

        buffer.appendText("function ");

        boolean portList = false;
        boolean indented = false;
        boolean ended = false;
        for (SyntaxNode child : body.getChildren()) {
            Kind kind = classifier.kindOf(child);
            if (ended) {
                renderEndLabel(child, kind, buffer);
                continue;
            }
            switch (kind) {
                case QUALIFIER:
                    buffer.appendText(child.getText());
                    buffer.appendChar(' ');
                    break;
                case RETURN_TYPE:
                    render(child, buffer);
                    buffer.appendChar(' ');
                    break;
                case FUNCTION_IDENTIFIER:
                    buffer.appendText(terminals(child, " "));
                    break;
                case PORT_LIST:
                    wrapPlanner.layout(child.getNamedChildren(), ";", buffer, this::renderFragment);
                    buffer.appendChar('\n');
                    portList = true;
                    break;
                case SEMICOLON:
                    // the port list already closed the header
                    if (!portList) {
                        buffer.appendText(";\n");
                    }
                    break;
                case STATEMENT:
                case COMMENT:
                case ERROR:
                    if (!indented) {
                        buffer.pushIndent();
                        indented = true;
                    }
                    gapPolicy.apply(child, GapPolicy.FUNCTION_BODY_ITEMS, buffer);
                    render(child, buffer);
                    if (kind == Kind.STATEMENT) {
                        buffer.appendChar(';');
                    }
                    buffer.appendChar('\n');
                    break;
                case ENDFUNCTION_KEYWORD:
                    if (indented) {
                        buffer.popIndent();
                    }
                    buffer.appendText("endfunction");
                    ended = true;
                    break;
                default:
                    throw mismatch(child, "unexpected " + kind + " in function body");
            }
        }
        if (!ended) {
            throw mismatch(node, "function without 'endfunction'");
        }

        buffer.appendChar('\n');
        buffer.requestBlankLine();
    }

    private void renderClassDeclaration(SyntaxNode node, RenderBuffer buffer) {
        boolean opened = false;
        boolean ended = false;
        for (SyntaxNode child : node.getChildren()) {
            Kind kind = classifier.kindOf(child);
            if (ended) {
                renderEndLabel(child, kind, buffer);
                continue;
            }
            if (opened) {
                switch (kind) {
                    case CLASS_ITEM:
                        gapPolicy.apply(child, GapPolicy.CLASS_BODY_ITEMS, buffer);
                        render(child, buffer);
                        break;
                    case COMMENT:
                    case ERROR:
                        gapPolicy.apply(child, GapPolicy.CLASS_BODY_ITEMS, buffer);
                        render(child, buffer);
                        buffer.appendChar('\n');
                        break;
                    case ENDCLASS_KEYWORD:
                        buffer.popIndent();
                        buffer.appendText("endclass");
                        ended = true;
                        break;
                    default:
                        throw mismatch(child, "unexpected " + kind + " in class body");
                }
                continue;
            }
            switch (kind) {
                case KEYWORD:
                    // 'virtual'
                    buffer.appendText(child.getText());
                    buffer.appendChar(' ');
                    break;
                case CLASS_KEYWORD:
                    buffer.appendText("class ");
                    break;
                case IDENTIFIER:
                    buffer.appendText(child.getText());
                    break;
                case EXTENDS_KEYWORD:
                    buffer.appendText(" extends ");
                    break;
                case SEMICOLON:
                    buffer.appendText(";\n");
                    buffer.pushIndent();
                    opened = true;
                    break;
                default:
                    // base class type
                    render(child, buffer);
                    break;
            }
        }
        if (!ended) {
            throw mismatch(node, "class without 'endclass'");
        }

        buffer.appendChar('\n');
        buffer.requestBlankLine();
    }

    private void renderEndLabel(SyntaxNode child, Kind kind, RenderBuffer buffer) {
        if (kind == Kind.COLON) {
            buffer.appendText(" : ");
        } else if (kind == Kind.IDENTIFIER || kind == Kind.FUNCTION_IDENTIFIER) {
            buffer.appendText(terminals(child, " "));
        } else {
            throw mismatch(child, "unexpected " + kind + " after end keyword");
        }
    }

    private void renderClassMethod(SyntaxNode node, RenderBuffer buffer) {
        for (SyntaxNode child : node.getChildren()) {
            Kind kind = classifier.kindOf(child);
            if (kind == Kind.QUALIFIER) {
                buffer.appendText(child.getText());
                buffer.appendChar(' ');
            } else if (kind == Kind.FUNCTION_DECLARATION) {
                render(child, buffer);
            } else {
                throw mismatch(child, "unexpected " + kind + " in class method");
            }
        }
    }

    private void renderClassProperty(SyntaxNode node, RenderBuffer buffer) {
        for (SyntaxNode child : node.getChildren()) {
            Kind kind = classifier.kindOf(child);
            if (kind == Kind.QUALIFIER) {
                buffer.appendText(child.getText());
                buffer.appendChar(' ');
            } else if (kind == Kind.DATA_DECLARATION) {
                render(child, buffer);
            } else {
                throw mismatch(child, "unexpected " + kind + " in class property");
            }
        }
        buffer.appendText(";\n");
    }

    private void renderSourceFile(SyntaxNode node, RenderBuffer buffer) {
        for (SyntaxNode child : node.getChildren()) {
            gapPolicy.apply(child, GapPolicy.SOURCE_FILE_ITEMS, buffer);
            render(child, buffer);
            Kind kind = classifier.kindOf(child);
            if (kind == Kind.COMMENT || kind == Kind.ERROR) {
                buffer.appendChar('\n');
            }
        }
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Source text of every leaf under {@code node}, in order, joined by {@code separator}.
     */
    static String terminals(SyntaxNode node, String separator) {
        List<String> texts = new ArrayList<>();
        collectTerminals(node, texts);
        return String.join(separator, texts);
    }

    private static void collectTerminals(SyntaxNode node, List<String> texts) {
        if (node.getChildCount() == 0) {
            texts.add(node.getText());
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            collectTerminals(child, texts);
        }
    }

    private SyntaxNode onlyNamedChild(SyntaxNode node) {
        List<SyntaxNode> named = node.getNamedChildren();
        if (named.size() != 1) {
            throw mismatch(node, "expected one named child but found " + named.size());
        }
        return named.get(0);
    }

    private void expectChildCount(SyntaxNode node, int expected) {
        if (node.getChildCount() != expected) {
            throw mismatch(node, "expected " + expected + " children but found " + node.getChildCount());
        }
    }

    private StructuralMismatchException mismatch(SyntaxNode node, String detail) {
        return new StructuralMismatchException(detail, node.getType(), classifier.kindOf(node).name(),
                node.getStartPoint().getRow(), node.getStartPoint().getColumn(), false);
    }

    Set<Kind> registeredKinds() {
        return rules.keySet();
    }
}
