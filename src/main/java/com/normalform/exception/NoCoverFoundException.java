package com.normalform.exception;

/**
 * Exception thrown when the minimizer exhausts every clause size up to the
 * number of terms without covering the sentence.
 */
public class NoCoverFoundException extends NormalFormException {

    public NoCoverFoundException(String message) {
        super(message);
    }
}
