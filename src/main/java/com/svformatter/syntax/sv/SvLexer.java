package com.svformatter.syntax.sv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.svformatter.syntax.Point;

/**
 * SystemVerilog lexer for the subset the formatter understands.
 *
 * <p>Comments are kept as tokens so the parser can attach them to the tree. Anything the lexer
 * cannot classify becomes an {@link TokenType#UNKNOWN} token rather than an exception; the
 * parser turns it into an error-recovery node.
 *
 * <p>To support a new operator add it to {@link #OPERATORS}; matching is longest first.
 */
public class SvLexer {

    static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            // constructs the parser handles
            "function", "endfunction", "class", "endclass", "extends", "virtual",
            "return", "break", "continue", "void", "automatic", "static",
            "input", "output", "inout", "ref",
            "local", "protected", "rand", "randc", "const", "pure", "extern",
            "byte", "shortint", "int", "longint", "integer", "time",
            "bit", "logic", "reg", "signed", "unsigned",
            "shortreal", "real", "realtime", "string", "chandle", "event",
            // reserved but not parsed; they surface as error-recovery nodes
            "module", "endmodule", "task", "endtask", "begin", "end", "if", "else",
            "for", "foreach", "while", "do", "repeat", "forever", "case", "endcase",
            "default", "fork", "join", "assign", "always", "initial", "package",
            "endpackage", "interface", "endinterface", "typedef", "enum", "struct",
            "union", "import", "export", "new", "null", "this", "super"));

    static final String[] OPERATORS = sortedLongestFirst(
            "<<<=", ">>>=",
            "===", "!==", "==?", "!=?", "<<<", ">>>", "<<=", ">>=",
            "**", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "^~", "~^", "~&", "~|", "++", "--", "::",
            "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^",
            "?", ":", ";", ",", "(", ")", "[", "]", "{", "}", ".", "#", "@", "'");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_$]*");
    private static final Pattern ESCAPED_IDENTIFIER = Pattern.compile("\\\\\\S+");
    private static final Pattern SYSTEM_IDENTIFIER = Pattern.compile("\\$[a-zA-Z0-9_$]+");
    private static final Pattern STRING = Pattern.compile("\"(?:[^\"\\\\\\n]|\\\\.)*\"");
    private static final Pattern[] NUMBERS = {
            // sized based: 8'hFF, 4'sb1010
            Pattern.compile("\\d[\\d_]*'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ?_]+"),
            // unsized based: 'hFF
            Pattern.compile("'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ?_]+"),
            // unbased unsized: '0, '1, 'x, 'z
            Pattern.compile("'[01xXzZ](?![0-9a-zA-Z_])"),
            // time literal: 10ns, 1.5us
            Pattern.compile("\\d[\\d_]*(?:\\.\\d[\\d_]*)?(?:fs|ps|ns|us|ms|s)(?![0-9a-zA-Z_$])"),
            // real: 1.5, 2.0e-3, 1e6
            Pattern.compile("\\d[\\d_]*\\.\\d[\\d_]*(?:[eE][+-]?\\d+)?"),
            Pattern.compile("\\d[\\d_]*[eE][+-]?\\d+"),
            Pattern.compile("\\d[\\d_]*")
    };

    private final String source;
    private int offset;
    private int row;
    private int column;

    public SvLexer(String source) {
        this.source = source;
    }

    /**
     * Splits the whole source into tokens. The last token is always {@link TokenType#EOF}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        offset = 0;
        row = 0;
        column = 0;

        while (offset < source.length()) {
            Matcher whitespace = match(WHITESPACE);
            if (whitespace != null) {
                advance(whitespace.end() - offset);
                continue;
            }
            tokens.add(readToken());
        }

        Point end = new Point(row, column);
        tokens.add(new Token(TokenType.EOF, "", offset, offset, end, end));
        return tokens;
    }

    private Token readToken() {
        char c = source.charAt(offset);

        if (source.startsWith("//", offset)) {
            int lineEnd = source.indexOf('\n', offset);
            int end = lineEnd < 0 ? source.length() : lineEnd;
            // a CRLF line ending is not part of the comment
            if (end > offset && source.charAt(end - 1) == '\r') {
                end--;
            }
            return emit(TokenType.COMMENT, end - offset);
        }
        if (source.startsWith("/*", offset)) {
            int close = source.indexOf("*/", offset + 2);
            if (close < 0) {
                return emit(TokenType.UNKNOWN, source.length() - offset);
            }
            return emit(TokenType.COMMENT, close + 2 - offset);
        }
        if (c == '"') {
            Matcher string = match(STRING);
            if (string == null) {
                int lineEnd = source.indexOf('\n', offset);
                return emit(TokenType.UNKNOWN, (lineEnd < 0 ? source.length() : lineEnd) - offset);
            }
            return emit(TokenType.STRING, string.end() - offset);
        }
        if (Character.isDigit(c) || c == '\'') {
            for (Pattern number : NUMBERS) {
                Matcher matcher = match(number);
                if (matcher != null) {
                    return emit(TokenType.NUMBER, matcher.end() - offset);
                }
            }
        }
        if (c == '$') {
            Matcher system = match(SYSTEM_IDENTIFIER);
            if (system != null) {
                return emit(TokenType.SYSTEM_IDENTIFIER, system.end() - offset);
            }
        }
        if (c == '\\') {
            Matcher escaped = match(ESCAPED_IDENTIFIER);
            if (escaped != null) {
                return emit(TokenType.IDENTIFIER, escaped.end() - offset);
            }
        }
        Matcher identifier = match(IDENTIFIER);
        if (identifier != null) {
            String word = source.substring(offset, identifier.end());
            return emit(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, word.length());
        }
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, offset)) {
                return emit(TokenType.OPERATOR, operator.length());
            }
        }

        return emit(TokenType.UNKNOWN, Character.charCount(source.codePointAt(offset)));
    }

    private Matcher match(Pattern pattern) {
        Matcher matcher = pattern.matcher(source);
        matcher.region(offset, source.length());
        return matcher.lookingAt() ? matcher : null;
    }

    private Token emit(TokenType type, int length) {
        int startOffset = offset;
        Point start = new Point(row, column);
        advance(length);
        return new Token(type, source.substring(startOffset, offset), startOffset, offset,
                start, new Point(row, column));
    }

    private void advance(int length) {
        int end = offset + length;
        for (; offset < end; offset++) {
            if (source.charAt(offset) == '\n') {
                row++;
                column = 0;
            } else {
                column++;
            }
        }
    }

    private static String[] sortedLongestFirst(String... operators) {
        String[] sorted = operators.clone();
        Arrays.sort(sorted, Comparator.comparingInt(String::length).reversed());
        return sorted;
    }
}
