package com.normalform.sentence;

/**
 * Represents a token in a sentence.
 *
 * @param type     Token type
 * @param text     Term name, or the operator symbol as written
 * @param position Position in the whitespace-free sentence
 */
public record Token(TokenType type, String text, int position) {

    public static Token term(String name, int position) {
        return new Token(TokenType.TERM, name, position);
    }

    public boolean isTerm() {
        return type == TokenType.TERM;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
