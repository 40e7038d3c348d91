package com.normalform.config;

/**
 * How the command line prints a conversion.
 */
public enum OutputFormat {
    /**
     * The predicate alone on one line.
     */
    TEXT,

    /**
     * A JSON object with the sentence, form, terms and result.
     */
    JSON
}
