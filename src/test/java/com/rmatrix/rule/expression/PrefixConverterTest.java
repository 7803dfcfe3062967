package com.rmatrix.rule.expression;

import com.rmatrix.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PrefixConverter.
 */
class PrefixConverterTest {

    private static List<Token> convert(String reformatted) {
        return new PrefixConverter(reformatted, new RuleTokenizer(reformatted).tokenize()).convert();
    }

    private static String prefix(String reformatted) {
        return convert(reformatted).stream().map(Token::text).collect(Collectors.joining(" "));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "( A AND B ) OR C           | OR AND A B C",
            "( A OR B ) AND C           | AND OR A B C",
            "( NOT ( ArcA OR Fnr ) )    | NOT OR ArcA Fnr",
            "A OR B AND C               | OR A AND B C",
            "NOT A AND B                | AND NOT A B",
            "NOT A OR B                 | OR NOT A B",
            "A AND B AND C              | AND AND A B C",
            "A OR B OR C                | OR OR A B C",
            "NOT ( NOT ( A ) )          | NOT NOT A",
            "A                          | A"
    })
    @DisplayName("Should convert infix to prefix respecting NOT > AND > OR")
    void shouldConvertToPrefix(String reformatted, String expected) {
        assertEquals(expected, prefix(reformatted));
    }

    @Test
    @DisplayName("Prefix output should contain no parentheses")
    void shouldDropParentheses() {
        List<Token> prefix = convert("( ( A OR B ) AND ( C OR NOT D ) )");

        assertTrue(prefix.stream().noneMatch(t -> t.is(TokenType.LPAREN) || t.is(TokenType.RPAREN)));
        assertEquals(8, prefix.size());
    }

    @Test
    @DisplayName("Should drain every pending operator at the end")
    void shouldDrainAllOperators() {
        assertEquals("OR AND NOT A B C", prefix("NOT A AND B OR C"));
    }

    @Test
    @DisplayName("Should reject mis-ordered parentheses with equal counts")
    void shouldRejectMisorderedParentheses() {
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> convert(") A ("));
        assertTrue(e.getMessage().contains("Unmatched"));

        assertThrows(MalformedInputException.class, () -> convert("A ) AND ( B"));
    }
}
