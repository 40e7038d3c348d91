package com.normalform.sentence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rearranges an infix token sequence into postfix order (shunting-yard).
 * <p>
 * Operators already on the stack are popped only while their precedence is
 * strictly greater than the incoming operator, so chains of equal precedence
 * such as {@code a && b && c} stay in source order.
 * Expects a sequence accepted by {@link SentenceValidator}.
 */
public final class PostfixConverter {

    private PostfixConverter() {
    }

    public static List<Token> toPostfix(List<Token> infix) {
        List<Token> output = new ArrayList<>(infix.size());
        Deque<Token> operators = new ArrayDeque<>();

        for (Token token : infix) {
            switch (token.type()) {
                case TERM -> output.add(token);
                case LPAREN -> operators.push(token);
                case RPAREN -> {
                    while (operators.peek().type() != TokenType.LPAREN) {
                        output.add(operators.pop());
                    }
                    operators.pop();
                }
                default -> {
                    while (!operators.isEmpty()
                            && operators.peek().type().isOperator()
                            && operators.peek().type().precedence() > token.type().precedence()) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        return output;
    }
}
