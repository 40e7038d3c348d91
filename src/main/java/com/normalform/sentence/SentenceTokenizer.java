package com.normalform.sentence;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for propositional sentences.
 * Whitespace is removed first; the remaining text is scanned left to right for
 * the symbols of {@link SymbolTable}, and every run of other characters becomes
 * a term.
 */
public final class SentenceTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public SentenceTokenizer(String sentence) {
        this.input = stripWhitespace(sentence);
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the sentence.
     *
     * @return List of tokens, empty for a blank sentence
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        StringBuilder term = new StringBuilder();
        int termStart = 0;

        while (!isAtEnd()) {
            String symbol = SymbolTable.symbolAt(input, pos);
            if (symbol == null) {
                if (term.length() == 0) {
                    termStart = pos;
                }
                term.append(advance());
                continue;
            }

            flushTerm(tokens, term, termStart);
            tokens.add(new Token(SymbolTable.typeOf(symbol), symbol, pos));
            pos += symbol.length();
        }

        flushTerm(tokens, term, termStart);
        return tokens;
    }

    /**
     * The sentence as it is scanned, with all whitespace removed.
     */
    public String input() {
        return input;
    }

    private void flushTerm(List<Token> tokens, StringBuilder term, int termStart) {
        if (term.length() > 0) {
            tokens.add(Token.term(term.toString(), termStart));
            term.setLength(0);
        }
    }

    private static String stripWhitespace(String sentence) {
        if (sentence == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(sentence.length());
        for (int i = 0; i < sentence.length(); i++) {
            char c = sentence.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
