package com.rmatrix.rule.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleTokenizer.
 */
class RuleTokenizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(NOT(ArcA OR Fnr))            | ( NOT ( ArcA OR Fnr ) )",
            "(A AND B) OR C                | ( A AND B ) OR C",
            "NOT_ArcA AND Fnr              | NOT_ArcA AND Fnr",
            "(NOT_ArcA AND Fnr)            | ( NOT_ArcA AND Fnr )",
            "NOT A                         | NOT A",
            "NOT(A)                        | NOT ( A )",
            "(Growth>0 AND A)              | ( Growth_gt_0 AND A )",
            "(x<0)                         | ( x_lt_0 )",
            "'  A   AND   B  '             | A AND B"
    })
    @DisplayName("Should reformat rules into single-space-delimited tokens")
    void shouldReformat(String raw, String expected) {
        assertEquals(expected, new RuleTokenizer(raw).reformat());
    }

    @Test
    @DisplayName("Should merge quoted operands into one identifier")
    void shouldMergeQuotedOperands() {
        assertEquals("( heat_shock AND B )", new RuleTokenizer("(\"heat shock\" AND B)").reformat());
        assertEquals("( Fnr_protein OR NOT glucose_ext_lt_0 )",
                new RuleTokenizer("(\"Fnr protein\" OR NOT \"glucose ext\"<0)").reformat());
    }

    @Test
    @DisplayName("Should treat tabs and newlines as whitespace")
    void shouldStripAllWhitespace() {
        assertEquals("A AND B", new RuleTokenizer("A\tAND\nB").reformat());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "(NOT(ArcA OR Fnr))",
            "(A AND B) OR C",
            "NOT_ArcA AND NOT(Fnr)",
            "(\"heat shock\" AND oxygen>0)",
            "((A OR B) AND (C OR NOT D))"
    })
    @DisplayName("Reformatting a reformatted rule should change nothing")
    void reformatShouldBeIdempotent(String raw) {
        String once = new RuleTokenizer(raw).reformat();
        assertEquals(once, new RuleTokenizer(once).reformat());
    }

    @Test
    @DisplayName("Should classify tokens by type and position")
    void shouldClassifyTokens() {
        List<Token> tokens = new RuleTokenizer("(NOT_ArcA AND NOT(B))").tokenize();

        List<TokenType> types = tokens.stream().map(Token::type).toList();
        assertEquals(List.of(TokenType.LPAREN, TokenType.OPERAND, TokenType.AND, TokenType.NOT,
                TokenType.LPAREN, TokenType.OPERAND, TokenType.RPAREN, TokenType.RPAREN), types);

        assertEquals("NOT_ArcA", tokens.get(1).text());
        assertEquals(1, tokens.get(1).position());
        assertEquals(7, tokens.get(7).position());
        assertTrue(tokens.get(3).type().isOperator());
        assertFalse(tokens.get(1).type().isOperator());
    }

    @Test
    @DisplayName("Should produce no tokens for empty input")
    void shouldHandleEmptyInput() {
        assertEquals("", new RuleTokenizer("").reformat());
        assertEquals("", new RuleTokenizer(null).reformat());
        assertTrue(new RuleTokenizer("   ").tokenize().isEmpty());
    }
}
