package com.normalform.sentence;

/**
 * Token types for propositional sentences.
 * <p>
 * Operator precedence (higher binds tighter): IMPLIES=1, OR=2, AND=3, NOT=4.
 * Parentheses carry no precedence.
 */
public enum TokenType {
    // Operand
    TERM(0, 0),

    // Delimiters
    LPAREN(0, 0),
    RPAREN(0, 0),

    // Logical operators
    IMPLIES(1, 2),
    OR(2, 2),
    AND(3, 2),
    NOT(4, 1);

    private final int precedence;
    private final int arity;

    TokenType(int precedence, int arity) {
        this.precedence = precedence;
        this.arity = arity;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Number of operands the operator consumes, 0 for terms and parentheses.
     */
    public int arity() {
        return arity;
    }

    public boolean isOperator() {
        return arity > 0;
    }
}
