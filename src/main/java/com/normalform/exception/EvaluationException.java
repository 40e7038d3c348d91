package com.normalform.exception;

/**
 * Exception thrown when postfix evaluation meets an operator outside the symbol
 * table or a corrupted value stack.
 * Both mean an earlier stage broke its contract, so this is never recoverable.
 */
public class EvaluationException extends NormalFormException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
