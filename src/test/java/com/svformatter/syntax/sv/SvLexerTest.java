package com.svformatter.syntax.sv;

import com.svformatter.syntax.Point;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SvLexerTest {

    @Test
    void tokenize_classifiesWordsAndOperators() {
        List<Token> tokens = new SvLexer("function int f(a); a <<<= $clog2(8); endfunction").tokenize();

        assertThat(texts(tokens)).containsExactly(
                "function", "int", "f", "(", "a", ")", ";", "a", "<<<=", "$clog2", "(", "8", ")", ";",
                "endfunction", "");
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.KEYWORD);
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(8).getType()).isEqualTo(TokenType.OPERATOR);
        assertThat(tokens.get(9).getType()).isEqualTo(TokenType.SYSTEM_IDENTIFIER);
        assertThat(tokens.get(11).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void tokenize_tracksRowsAndColumns() {
        List<Token> tokens = new SvLexer("a\n  bb = 1;").tokenize();

        assertThat(tokens.get(1).getText()).isEqualTo("bb");
        assertThat(tokens.get(1).getStart()).isEqualTo(new Point(1, 2));
        assertThat(tokens.get(1).getEnd()).isEqualTo(new Point(1, 4));
        assertThat(tokens.get(1).getStartOffset()).isEqualTo(4);
    }

    @Test
    void lineComment_excludesCarriageReturn() {
        List<Token> tokens = new SvLexer("// note\r\nx").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(0).getText()).isEqualTo("// note");
        assertThat(tokens.get(1).getText()).isEqualTo("x");
    }

    @Test
    void blockComment_spansLines() {
        List<Token> tokens = new SvLexer("/* one\n   two */ x").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(0).getEnd()).isEqualTo(new Point(1, 9));
        assertThat(tokens.get(1).getStart()).isEqualTo(new Point(1, 10));
    }

    @Test
    void unterminatedInput_becomesUnknownToken() {
        assertThat(new SvLexer("/* open").tokenize().get(0).getType()).isEqualTo(TokenType.UNKNOWN);
        assertThat(new SvLexer("\"open\nx").tokenize().get(0).getType()).isEqualTo(TokenType.UNKNOWN);
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "1_000", "8'hFF", "4'sb10x0", "'hDEAD", "'0", "'z", "10ns", "1.5", "2.0e-3", "1e6"})
    void numbers_areSingleTokens(String literal) {
        List<Token> tokens = new SvLexer(literal + ";").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(0).getText()).isEqualTo(literal);
        assertThat(tokens.get(1).getText()).isEqualTo(";");
    }

    @Test
    void strings_keepEscapes() {
        List<Token> tokens = new SvLexer("\"say \\\"hi\\\"\"").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).getText()).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void escapedIdentifier_runsToWhitespace() {
        List<Token> tokens = new SvLexer("\\bus[0] = 1").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(0).getText()).isEqualTo("\\bus[0]");
    }

    @Test
    void operators_preferLongestMatch() {
        assertThat(texts(new SvLexer("a===b !=? c ~^ d").tokenize()))
                .containsExactly("a", "===", "b", "!=?", "c", "~^", "d", "");
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::getText).collect(Collectors.toList());
    }
}
