package com.svformatter.syntax.sv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.svformatter.syntax.CstNode;
import com.svformatter.syntax.GrammarMetadata;
import com.svformatter.syntax.Point;
import com.svformatter.syntax.SourceParser;
import com.svformatter.syntax.SyntaxTree;
import com.svformatter.util.LoggerUtil;

/**
 * Error-tolerant recursive-descent parser for the SystemVerilog subset the formatter renders.
 *
 * <p>Node types follow the tree-sitter-verilog grammar so that symbol ids resolve through the
 * same grammar metadata the classifier table is generated from. An item the parser cannot
 * handle (at source-file, function-body or class-body level) becomes an {@code ERROR} node
 * spanning the skipped tokens; nothing of the input is dropped.
 *
 * <p>The parser itself is stateless and may be shared; every call works on its own session.
 */
public class SvParser implements SourceParser {
    private static final Logger logger = LoggerUtil.getLogger(SvParser.class);

    // each level costs at most four parser frames and two tree levels
    static final int MAX_NESTING_DEPTH = 128;

    private static final Set<String> INTEGER_ATOM_TYPES = words("byte", "shortint", "int", "longint", "integer", "time");
    private static final Set<String> INTEGER_VECTOR_TYPES = words("bit", "logic", "reg");
    private static final Set<String> NON_INTEGER_TYPES = words("shortreal", "real", "realtime");
    private static final Set<String> SIMPLE_TYPES = words("string", "chandle", "event");
    private static final Set<String> SIGNING = words("signed", "unsigned");
    private static final Set<String> LIFETIMES = words("automatic", "static");
    private static final Set<String> PORT_DIRECTIONS = words("input", "output", "inout", "ref");
    private static final Set<String> CLASS_QUALIFIERS = words(
            "static", "protected", "local", "virtual", "pure", "extern", "rand", "randc", "const");
    private static final Set<String> JUMP_KEYWORDS = words("return", "break", "continue");
    private static final Set<String> ASSIGNMENT_OPERATORS = words(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "<<<=", ">>>=");
    private static final Set<String> UNARY_OPERATORS = words(
            "+", "-", "!", "~", "&", "~&", "|", "~|", "^", "~^", "^~");

    // lowest precedence first
    private static final List<Set<String>> BINARY_OPERATORS = List.of(
            words("||"),
            words("&&"),
            words("|"),
            words("^", "^~", "~^"),
            words("&"),
            words("==", "!=", "===", "!==", "==?", "!=?"),
            words("<", "<=", ">", ">="),
            words("<<", ">>", "<<<", ">>>"),
            words("+", "-"),
            words("*", "/", "%"),
            words("**"));

    private final GrammarMetadata grammar;

    public SvParser(GrammarMetadata grammar) {
        this.grammar = grammar;
    }

    @Override
    public SyntaxTree parse(String source) {
        List<Token> tokens = new SvLexer(source).tokenize();
        Session session = new Session(source, tokens);
        CstNode root = session.sourceFile();
        if (root.hasError()) {
            logger.fine("Parsed with " + session.recoveries + " error-recovery node(s)");
        }
        return new SyntaxTree(root, source, grammar);
    }

    @Override
    public GrammarMetadata getGrammar() {
        return grammar;
    }

    private static Set<String> words(String... words) {
        return new HashSet<>(Arrays.asList(words));
    }

    private static final class ParseError extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ParseError(String message, Token at) {
            super(message + " at " + (at.getStart().getRow() + 1) + ":" + (at.getStart().getColumn() + 1)
                    + (at.getType() == TokenType.EOF ? " (end of input)" : " near '" + at.getText() + "'"),
                    null, false, false);
        }
    }

    /**
     * State of one parse call.
     */
    private final class Session {
        private final String source;
        private final List<Token> tokens;
        private int pos;
        private int depth;
        private int recoveries;

        Session(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        CstNode sourceFile() {
            List<CstNode> items = new ArrayList<>();
            while (!atEof()) {
                items.add(sourceItem());
            }
            Token eof = peek();
            return CstNode.span(grammar.symbolId("source_file", true), "source_file", true, source,
                    0, source.length(), Point.ORIGIN, eof.getEnd(), items);
        }

        // ---------------------------------------------------------------- items

        private CstNode sourceItem() {
            if (peek().getType() == TokenType.COMMENT) {
                return leaf("comment", advance());
            }
            int mark = pos;
            try {
                if (check("function")) {
                    return functionDeclaration();
                }
                if (check("class") || (check("virtual") && peek(1).is("class"))) {
                    return classDeclaration();
                }
                throw error("expected a function or class declaration");
            } catch (ParseError e) {
                pos = mark;
                List<Token> skipped = new ArrayList<>();
                skipped.add(advance());
                while (!atEof() && !check("function") && !check("class") && !check("virtual")) {
                    skipped.add(advance());
                }
                return errorNode(skipped, e);
            }
        }

        private CstNode functionBodyItem() {
            if (peek().getType() == TokenType.COMMENT) {
                return leaf("comment", advance());
            }
            int mark = pos;
            try {
                if (startsDataType()) {
                    return node("block_item_declaration", dataDeclaration());
                }
                return functionStatement();
            } catch (ParseError e) {
                pos = mark;
                List<Token> skipped = new ArrayList<>();
                Token last = advance();
                skipped.add(last);
                while (!last.is(";") && !atEof() && !check("endfunction") && !check("function")
                        && !check("class") && !check("endclass")) {
                    last = advance();
                    skipped.add(last);
                }
                return errorNode(skipped, e);
            }
        }

        private CstNode classItem() {
            if (peek().getType() == TokenType.COMMENT) {
                return leaf("comment", advance());
            }
            int mark = pos;
            try {
                List<CstNode> qualifiers = new ArrayList<>();
                while (peek().getType() == TokenType.KEYWORD && CLASS_QUALIFIERS.contains(peek().getText())) {
                    qualifiers.add(leaf("class_item_qualifier", advance()));
                }
                if (check("function")) {
                    qualifiers.add(functionDeclaration());
                    return node("class_item", node("class_method", qualifiers));
                }
                if (startsDataType()) {
                    qualifiers.add(dataDeclaration());
                    return node("class_item", node("class_property", qualifiers));
                }
                throw error("expected a class method or property");
            } catch (ParseError e) {
                pos = mark;
                return errorNode(skipClassItem(), e);
            }
        }

        private List<Token> skipClassItem() {
            List<Token> skipped = new ArrayList<>();
            boolean method = false;
            while (true) {
                Token token = peek();
                if (token.getType() == TokenType.EOF || token.is("endclass") || token.is("class")) {
                    break;
                }
                if (token.is("function")) {
                    if (method) {
                        break;
                    }
                    method = true;
                }
                skipped.add(advance());
                if (method ? token.is("endfunction") : token.is(";")) {
                    break;
                }
            }
            if (skipped.isEmpty()) {
                skipped.add(advance());
            }
            return skipped;
        }

        // --------------------------------------------------------- declarations

        private CstNode functionDeclaration() {
            CstNode keyword = anonymous(expect("function"));
            List<CstNode> body = new ArrayList<>();

            if (peek().getType() == TokenType.KEYWORD && LIFETIMES.contains(peek().getText())) {
                body.add(leaf("lifetime", advance()));
            }
            CstNode returnType = returnType();
            if (returnType != null) {
                body.add(returnType);
            }
            Token name = check("new") ? advance() : expectIdentifier();
            body.add(node("function_identifier", leaf("simple_identifier", name)).withField("name"));
            if (check("(")) {
                body.add(portList());
            }
            body.add(anonymous(expect(";")));

            while (!check("endfunction")) {
                if (atEof() || check("function") || check("class") || check("endclass")) {
                    throw error("missing 'endfunction'");
                }
                body.add(functionBodyItem());
            }
            body.add(anonymous(advance()));
            if (check(":")) {
                body.add(anonymous(advance()));
                body.add(node("function_identifier", leaf("simple_identifier", expectIdentifier())));
            }

            return node("function_declaration", keyword, node("function_body_declaration", body));
        }

        private CstNode returnType() {
            if (check("void")) {
                return node("function_data_type_or_implicit1", node("data_type_or_void", anonymous(advance())));
            }
            if (startsDataType()) {
                return node("function_data_type_or_implicit1", node("data_type_or_void", dataType()));
            }
            if (check("[") || SIGNING.contains(peek().getText()) && peek().getType() == TokenType.KEYWORD) {
                List<CstNode> implicit = new ArrayList<>();
                if (peek().getType() == TokenType.KEYWORD && SIGNING.contains(peek().getText())) {
                    implicit.add(leaf("signing", advance()));
                }
                while (check("[")) {
                    implicit.add(packedDimension());
                }
                return node("function_data_type_or_implicit1", implicit);
            }
            return null;
        }

        private CstNode portList() {
            List<CstNode> children = new ArrayList<>();
            children.add(anonymous(expect("(")));
            if (!check(")")) {
                children.add(portItem());
                while (check(",")) {
                    children.add(anonymous(advance()));
                    children.add(portItem());
                }
            }
            children.add(anonymous(expect(")")));
            return node("tf_port_list", children);
        }

        private CstNode portItem() {
            List<CstNode> children = new ArrayList<>();
            if (peek().getType() == TokenType.KEYWORD && PORT_DIRECTIONS.contains(peek().getText())) {
                children.add(leaf("tf_port_direction", advance()));
            }
            if (startsDataType()) {
                children.add(dataType());
            }
            children.add(leaf("simple_identifier", expectIdentifier()));
            if (check("=")) {
                children.add(anonymous(advance()));
                children.add(expression());
            }
            return node("tf_port_item1", children);
        }

        private CstNode classDeclaration() {
            List<CstNode> children = new ArrayList<>();
            if (check("virtual")) {
                children.add(anonymous(advance()));
            }
            children.add(anonymous(expect("class")));
            children.add(node("class_identifier", leaf("simple_identifier", expectIdentifier())).withField("name"));
            if (check("extends")) {
                children.add(anonymous(advance()));
                children.add(node("class_type", leaf("simple_identifier", expectIdentifier())));
            }
            children.add(anonymous(expect(";")));

            while (!check("endclass")) {
                if (atEof() || check("class")) {
                    throw error("missing 'endclass'");
                }
                children.add(classItem());
            }
            children.add(anonymous(advance()));
            if (check(":")) {
                children.add(anonymous(advance()));
                children.add(node("class_identifier", leaf("simple_identifier", expectIdentifier())));
            }
            return node("class_declaration", children);
        }

        private CstNode dataDeclaration() {
            CstNode type = dataType();
            List<CstNode> variables = new ArrayList<>();
            variables.add(variableDeclAssignment());
            while (check(",")) {
                variables.add(anonymous(advance()));
                variables.add(variableDeclAssignment());
            }
            return node("data_declaration", type, node("list_of_variable_decl_assignments", variables),
                    anonymous(expect(";")));
        }

        private CstNode variableDeclAssignment() {
            List<CstNode> children = new ArrayList<>();
            children.add(leaf("simple_identifier", expectIdentifier()));
            if (check("=")) {
                children.add(anonymous(advance()));
                children.add(expression());
            }
            return node("variable_decl_assignment", children);
        }

        private boolean startsDataType() {
            Token token = peek();
            if (token.getType() == TokenType.KEYWORD) {
                String word = token.getText();
                return INTEGER_ATOM_TYPES.contains(word) || INTEGER_VECTOR_TYPES.contains(word)
                        || NON_INTEGER_TYPES.contains(word) || SIMPLE_TYPES.contains(word);
            }
            // a user-defined type is an identifier directly followed by the declared name
            return token.getType() == TokenType.IDENTIFIER && peek(1).getType() == TokenType.IDENTIFIER;
        }

        private CstNode dataType() {
            List<CstNode> children = new ArrayList<>();
            String word = peek().getText();
            if (peek().getType() == TokenType.IDENTIFIER) {
                children.add(node("class_type", leaf("simple_identifier", advance())));
            } else if (INTEGER_ATOM_TYPES.contains(word)) {
                children.add(leaf("integer_atom_type", advance()));
                signing(children);
            } else if (INTEGER_VECTOR_TYPES.contains(word)) {
                children.add(leaf("integer_vector_type", advance()));
                signing(children);
                while (check("[")) {
                    children.add(packedDimension());
                }
            } else if (NON_INTEGER_TYPES.contains(word)) {
                children.add(leaf("non_integer_type", advance()));
            } else if (SIMPLE_TYPES.contains(word)) {
                children.add(leaf("simple_type", advance()));
            } else {
                throw error("expected a data type");
            }
            return node("data_type", children);
        }

        private void signing(List<CstNode> children) {
            if (peek().getType() == TokenType.KEYWORD && SIGNING.contains(peek().getText())) {
                children.add(leaf("signing", advance()));
            }
        }

        private CstNode packedDimension() {
            CstNode open = anonymous(expect("["));
            CstNode msb = expression();
            CstNode colon = anonymous(expect(":"));
            CstNode lsb = expression();
            return node("packed_dimension", open, msb, colon, lsb, anonymous(expect("]")));
        }

        // ----------------------------------------------------------- statements

        private CstNode functionStatement() {
            if (check(";")) {
                return node("function_statement_or_null", anonymous(advance()));
            }
            return node("function_statement_or_null", node("statement", statementItem()));
        }

        private CstNode statementItem() {
            Token token = peek();
            if (token.getType() == TokenType.KEYWORD && JUMP_KEYWORDS.contains(token.getText())) {
                List<CstNode> children = new ArrayList<>();
                children.add(anonymous(advance()));
                if (token.is("return") && !check(";")) {
                    children.add(expression());
                }
                children.add(anonymous(expect(";")));
                return node("statement_item", node("jump_statement", children));
            }
            if (token.getType() == TokenType.SYSTEM_IDENTIFIER) {
                CstNode call = systemCall();
                return node("statement_item", call, anonymous(expect(";")));
            }
            if (token.getType() == TokenType.IDENTIFIER && peek(1).is("(")) {
                CstNode call = node("tf_call", leaf("simple_identifier", advance()), arguments());
                return node("statement_item", call, anonymous(expect(";")));
            }
            if (token.getType() == TokenType.IDENTIFIER) {
                return node("statement_item", assignment(), anonymous(expect(";")));
            }
            throw error("expected a statement");
        }

        private CstNode assignment() {
            List<CstNode> target = new ArrayList<>();
            target.add(leaf("simple_identifier", advance()));
            while (check("[")) {
                target.add(bitSelect());
            }
            CstNode lvalue = node("variable_lvalue", target);

            if (check("<=")) {
                CstNode operator = anonymous(advance());
                return node("nonblocking_assignment", lvalue, operator, expression());
            }
            if (peek().getType() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(peek().getText())) {
                CstNode operator = leaf("assignment_operator", advance());
                return node("operator_assignment", lvalue, operator, expression());
            }
            throw error("expected an assignment operator");
        }

        // ---------------------------------------------------------- expressions

        private CstNode expression() {
            enter();
            try {
                CstNode condition = binary(0);
                if (!check("?")) {
                    return condition;
                }
                CstNode question = anonymous(advance());
                CstNode whenTrue = expression();
                CstNode colon = anonymous(expect(":"));
                CstNode whenFalse = expression();
                return node("expression",
                        node("conditional_expression", condition, question, whenTrue, colon, whenFalse));
            } finally {
                depth--;
            }
        }

        /**
         * Precedence climbing: operators at {@code minLevel} or tighter extend {@code left} in a
         * loop, so long left-associative chains cost no stack.
         */
        private CstNode binary(int minLevel) {
            CstNode left = unary();
            int level;
            while ((level = binaryLevel(peek())) >= minLevel) {
                CstNode operator = anonymous(advance());
                CstNode right;
                enter();
                try {
                    right = binary(level + 1);
                } finally {
                    depth--;
                }
                left = node("expression", left.withField("left"), operator.withField("operator"),
                        right.withField("right"));
            }
            return left;
        }

        private int binaryLevel(Token token) {
            if (token.getType() != TokenType.OPERATOR) {
                return -1;
            }
            for (int level = 0; level < BINARY_OPERATORS.size(); level++) {
                if (BINARY_OPERATORS.get(level).contains(token.getText())) {
                    return level;
                }
            }
            return -1;
        }

        private CstNode unary() {
            Token token = peek();
            if (token.getType() == TokenType.OPERATOR && UNARY_OPERATORS.contains(token.getText())) {
                enter();
                try {
                    CstNode operator = leaf("unary_operator", advance());
                    return node("expression", node("unary_expression", operator, unary()));
                } finally {
                    depth--;
                }
            }
            return primary();
        }

        private CstNode primary() {
            Token token = peek();
            switch (token.getType()) {
                case NUMBER:
                case STRING:
                    return node("expression", leaf("primary_literal", advance()));
                case IDENTIFIER:
                    return node("expression", reference());
                case SYSTEM_IDENTIFIER:
                    return node("expression", systemCall());
                default:
                    if (token.is("(")) {
                        CstNode open = anonymous(advance());
                        CstNode inner = expression();
                        return node("expression",
                                node("parenthesized_expression", open, inner, anonymous(expect(")"))));
                    }
                    throw error("expected an expression");
            }
        }

        private CstNode reference() {
            CstNode identifier = leaf("simple_identifier", advance());
            if (check("(")) {
                return node("tf_call", identifier, arguments());
            }
            if (!check("[")) {
                return identifier;
            }
            List<CstNode> children = new ArrayList<>();
            children.add(identifier);
            while (check("[")) {
                children.add(bitSelect());
            }
            return node("indexed_reference", children);
        }

        private CstNode bitSelect() {
            List<CstNode> children = new ArrayList<>();
            children.add(anonymous(expect("[")));
            children.add(expression());
            if (check(":")) {
                children.add(anonymous(advance()));
                children.add(expression());
            }
            children.add(anonymous(expect("]")));
            return node("bit_select", children);
        }

        private CstNode systemCall() {
            CstNode identifier = leaf("system_tf_identifier", advance());
            if (check("(")) {
                return node("system_tf_call", identifier, arguments());
            }
            return node("system_tf_call", identifier);
        }

        private CstNode arguments() {
            List<CstNode> children = new ArrayList<>();
            children.add(anonymous(expect("(")));
            if (!check(")")) {
                children.add(expression());
                while (check(",")) {
                    children.add(anonymous(advance()));
                    children.add(expression());
                }
            }
            children.add(anonymous(expect(")")));
            return node("list_of_arguments_parent", children);
        }

        private void enter() {
            if (++depth > MAX_NESTING_DEPTH) {
                depth--;
                throw error("expression nested deeper than " + MAX_NESTING_DEPTH + " levels");
            }
        }

        // -------------------------------------------------------------- helpers

        private Token peek() {
            return tokens.get(pos);
        }

        private Token peek(int ahead) {
            return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
        }

        private boolean check(String value) {
            return peek().is(value);
        }

        private boolean atEof() {
            return peek().getType() == TokenType.EOF;
        }

        private Token advance() {
            Token token = peek();
            if (token.getType() != TokenType.EOF) {
                pos++;
            }
            return token;
        }

        private Token expect(String value) {
            if (!check(value)) {
                throw error("expected '" + value + "'");
            }
            return advance();
        }

        private Token expectIdentifier() {
            if (peek().getType() != TokenType.IDENTIFIER) {
                throw error("expected an identifier");
            }
            return advance();
        }

        private ParseError error(String message) {
            return new ParseError(message, peek());
        }

        private CstNode node(String type, CstNode... children) {
            return node(type, Arrays.asList(children));
        }

        private CstNode node(String type, List<CstNode> children) {
            return CstNode.branch(grammar.symbolId(type, true), type, true, children);
        }

        private CstNode leaf(String type, Token token) {
            return CstNode.leaf(grammar.symbolId(type, true), type, true, source,
                    token.getStartOffset(), token.getEndOffset(), token.getStart(), token.getEnd());
        }

        private CstNode anonymous(Token token) {
            return CstNode.leaf(grammar.findSymbolId(token.getText(), false), token.getText(), false, source,
                    token.getStartOffset(), token.getEndOffset(), token.getStart(), token.getEnd());
        }

        private CstNode terminal(Token token) {
            switch (token.getType()) {
                case IDENTIFIER:
                    return leaf("simple_identifier", token);
                case SYSTEM_IDENTIFIER:
                    return leaf("system_tf_identifier", token);
                case NUMBER:
                case STRING:
                    return leaf("primary_literal", token);
                case COMMENT:
                    return leaf("comment", token);
                default:
                    return anonymous(token);
            }
        }

        private CstNode errorNode(List<Token> skipped, ParseError cause) {
            recoveries++;
            logger.fine("Recovered from parse error: " + cause.getMessage());
            List<CstNode> children = new ArrayList<>(skipped.size());
            for (Token token : skipped) {
                children.add(terminal(token));
            }
            return node(CstNode.ERROR_TYPE, children);
        }
    }
}
