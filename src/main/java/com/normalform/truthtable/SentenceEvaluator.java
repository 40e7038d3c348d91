package com.normalform.truthtable;

import com.normalform.exception.EvaluationException;
import com.normalform.sentence.Token;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fills in the sentence column of the truth table.
 * <p>
 * Each row is evaluated over the postfix token sequence with a value stack.
 * Rows are processed from 2^n - 1 down to 0; bit j of the result is the
 * sentence's value at row j.
 */
public final class SentenceEvaluator {

    private SentenceEvaluator() {
    }

    /**
     * Evaluate a postfix sentence on every row.
     *
     * @param postfix Postfix token sequence
     * @param terms   Encoded terms of the sentence
     * @return Sentence mask
     * @throws EvaluationException if the sequence is not a well-formed postfix sentence
     */
    public static BigInteger evaluate(List<Token> postfix, TermTable terms) {
        boolean[] column = new boolean[terms.rowCount()];
        for (int row = terms.rowCount() - 1; row >= 0; row--) {
            column[row] = evaluateRow(postfix, terms, row);
        }
        return Masks.fromRows(column);
    }

    /**
     * Evaluate a postfix sentence on one row of the truth table.
     */
    public static boolean evaluateRow(List<Token> postfix, TermTable terms, int row) {
        Deque<Boolean> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            if (token.isTerm()) {
                if (!terms.contains(token.text())) {
                    throw new EvaluationException("Term '" + token.text() + "' was never encoded");
                }
                stack.push(terms.mask(token.text()).testBit(row));
                continue;
            }
            if (!token.type().isOperator()) {
                throw new EvaluationException("Cannot evaluate operator " + token);
            }

            // the first pop is the right-hand operand
            boolean right = pop(stack, token);
            boolean left = token.type().arity() == 2 && pop(stack, token);
            stack.push(apply(token, left, right));
        }

        if (stack.size() != 1) {
            throw new EvaluationException("Evaluation left " + stack.size()
                    + " values on the stack, expected 1");
        }
        return stack.pop();
    }

    private static boolean apply(Token operator, boolean left, boolean right) {
        return switch (operator.type()) {
            case NOT -> !right;
            case AND -> left && right;
            case OR -> left || right;
            case IMPLIES -> !left || right;
            default -> throw new EvaluationException("Cannot evaluate operator " + operator);
        };
    }

    private static boolean pop(Deque<Boolean> stack, Token operator) {
        if (stack.isEmpty()) {
            throw new EvaluationException("Stack underflow while applying " + operator
                    + " at position " + operator.position());
        }
        return stack.pop();
    }
}
