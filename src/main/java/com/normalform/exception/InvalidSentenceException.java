package com.normalform.exception;

/**
 * Exception thrown when a sentence is not well formed, or has more distinct
 * terms than the configured limit. No partial output is produced.
 */
public class InvalidSentenceException extends NormalFormException {

    private final String sentence;

    public InvalidSentenceException(String sentence, String message) {
        super(message);
        this.sentence = sentence;
    }

    public String getSentence() {
        return sentence;
    }
}
