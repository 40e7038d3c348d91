package com.normalform.sentence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed operator symbols of the sentence language.
 * Everything that is not one of these symbols is part of a term name.
 * <p>
 * No symbol may be a prefix of another, so greedy left-to-right matching is
 * unambiguous. This is checked once when the class is initialised.
 */
public final class SymbolTable {

    public static final String AND = "&&";
    public static final String OR = "||";
    public static final String NOT = "~";
    public static final String LEFT_PAREN = "(";
    public static final String RIGHT_PAREN = ")";
    public static final String IMPLIES = "=>";

    /**
     * Symbols mapped to token types, in declaration order.
     */
    public static final Map<String, TokenType> SYMBOLS;

    static {
        Map<String, TokenType> symbols = new LinkedHashMap<>();
        symbols.put(AND, TokenType.AND);
        symbols.put(OR, TokenType.OR);
        symbols.put(NOT, TokenType.NOT);
        symbols.put(LEFT_PAREN, TokenType.LPAREN);
        symbols.put(RIGHT_PAREN, TokenType.RPAREN);
        symbols.put(IMPLIES, TokenType.IMPLIES);
        checkPrefixFree(new ArrayList<>(symbols.keySet()));
        SYMBOLS = Collections.unmodifiableMap(symbols);
    }

    private SymbolTable() {
    }

    /**
     * Find the symbol that starts at the given position.
     *
     * @param input    Whitespace-free sentence
     * @param position Position to test
     * @return The matching symbol, or null if the character there belongs to a term
     */
    public static String symbolAt(String input, int position) {
        for (String symbol : SYMBOLS.keySet()) {
            if (input.startsWith(symbol, position)) {
                return symbol;
            }
        }
        return null;
    }

    public static TokenType typeOf(String symbol) {
        return SYMBOLS.get(symbol);
    }

    /**
     * Symbol written for an operator or parenthesis type.
     */
    public static String symbolOf(TokenType type) {
        for (Map.Entry<String, TokenType> entry : SYMBOLS.entrySet()) {
            if (entry.getValue() == type) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("No symbol for token type " + type);
    }

    static void checkPrefixFree(List<String> symbols) {
        for (int i = 0; i < symbols.size(); i++) {
            String a = symbols.get(i);
            if (a.isEmpty()) {
                throw new IllegalStateException("Empty operator symbol");
            }
            for (int j = 0; j < symbols.size(); j++) {
                String b = symbols.get(j);
                if (i != j && b.startsWith(a)) {
                    throw new IllegalStateException(
                            "Operator symbol '" + a + "' is a prefix of '" + b + "'");
                }
            }
        }
    }
}
