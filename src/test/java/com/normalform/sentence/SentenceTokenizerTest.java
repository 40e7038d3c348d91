package com.normalform.sentence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SentenceTokenizer.
 */
class SentenceTokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }

    @Test
    @DisplayName("Should split terms and operators")
    void shouldSplitTermsAndOperators() {
        List<Token> tokens = new SentenceTokenizer("a && b => a && c").tokenize();

        assertEquals(List.of("a", "&&", "b", "=>", "a", "&&", "c"), texts(tokens));
        assertEquals(List.of(TokenType.TERM, TokenType.AND, TokenType.TERM, TokenType.IMPLIES,
                TokenType.TERM, TokenType.AND, TokenType.TERM), types(tokens));
    }

    @Test
    @DisplayName("Should ignore all whitespace, including inside term names")
    void shouldIgnoreWhitespace() {
        List<Token> tokens = new SentenceTokenizer(" fo o\t||\n~ bar ").tokenize();

        assertEquals(List.of("foo", "||", "~", "bar"), texts(tokens));
    }

    @Test
    @DisplayName("Should read multi-character term names up to the next symbol")
    void shouldReadLongTermNames() {
        List<Token> tokens = new SentenceTokenizer("(rain=>wet_grass)&&~sun1").tokenize();

        assertEquals(List.of("(", "rain", "=>", "wet_grass", ")", "&&", "~", "sun1"), texts(tokens));
        assertEquals(TokenType.LPAREN, tokens.get(0).type());
        assertEquals(TokenType.RPAREN, tokens.get(4).type());
        assertEquals(TokenType.NOT, tokens.get(6).type());
    }

    @Test
    @DisplayName("Single characters of a symbol are term characters")
    void shouldTreatLoneSymbolCharactersAsTerms() {
        // '&', '|' and '=' on their own are not symbols
        List<Token> tokens = new SentenceTokenizer("a&b||c=d").tokenize();

        assertEquals(List.of("a&b", "||", "c=d"), texts(tokens));
    }

    @Test
    @DisplayName("Should record positions in the whitespace-free sentence")
    void shouldRecordPositions() {
        List<Token> tokens = new SentenceTokenizer("ab && cd").tokenize();

        assertEquals(0, tokens.get(0).position());
        assertEquals(2, tokens.get(1).position());
        assertEquals(4, tokens.get(2).position());
    }

    @Test
    @DisplayName("Blank or null sentence yields no tokens")
    void shouldReturnNoTokensForBlankInput() {
        assertTrue(new SentenceTokenizer("   ").tokenize().isEmpty());
        assertTrue(new SentenceTokenizer(null).tokenize().isEmpty());
    }
}
