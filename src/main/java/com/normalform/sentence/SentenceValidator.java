package com.normalform.sentence;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a token sequence forms a well-formed sentence.
 * <p>
 * Rules:
 * <ul>
 *   <li>The sentence is not empty and does not start with a binary operator or ')'</li>
 *   <li>Operators and '(' are followed by a term, '~' or '('</li>
 *   <li>Terms and ')' are followed by a binary operator, ')' or the end</li>
 *   <li>Parentheses balance, and never close more than were opened</li>
 * </ul>
 * Never throws; a malformed sequence simply yields {@code false}.
 */
public final class SentenceValidator {

    /**
     * Tokens that can only follow a complete operand.
     */
    private static final Set<TokenType> AFTER_OPERAND =
            EnumSet.of(TokenType.AND, TokenType.OR, TokenType.IMPLIES, TokenType.RPAREN);

    private SentenceValidator() {
    }

    public static boolean isValid(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return false;
        }
        if (AFTER_OPERAND.contains(tokens.get(0).type())) {
            return false;
        }

        int openMinusClosed = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            boolean last = i + 1 == tokens.size();
            TokenType next = last ? null : tokens.get(i + 1).type();

            if (type == TokenType.LPAREN) {
                openMinusClosed++;
            } else if (type == TokenType.RPAREN) {
                openMinusClosed--;
                if (openMinusClosed < 0) {
                    return false;
                }
            }

            if (type.isOperator() || type == TokenType.LPAREN) {
                if (last || AFTER_OPERAND.contains(next)) {
                    return false;
                }
            } else if (!last && !AFTER_OPERAND.contains(next)) {
                return false;
            }
        }
        return openMinusClosed == 0;
    }
}
