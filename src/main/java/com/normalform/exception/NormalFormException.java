package com.normalform.exception;

/**
 * Base exception for normal form conversion.
 */
public class NormalFormException extends RuntimeException {

    public NormalFormException(String message) {
        super(message);
    }

    public NormalFormException(String message, Throwable cause) {
        super(message, cause);
    }
}
