package com.normalform.sentence;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the distinct term names of a sentence.
 * The list index of a name is its term index; names appear in first-seen order.
 */
public final class TermExtractor {

    private TermExtractor() {
    }

    public static List<String> extract(List<Token> tokens) {
        Set<String> names = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (token.isTerm()) {
                names.add(token.text());
            }
        }
        return List.copyOf(names);
    }
}
