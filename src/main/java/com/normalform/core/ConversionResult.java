package com.normalform.core;

import com.normalform.minimizer.NormalForm;
import com.normalform.minimizer.Predicate;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of converting one sentence.
 *
 * @param sentence     Sentence as given
 * @param form         Target normal form
 * @param terms        Distinct term names, in term index order
 * @param sentenceMask Truth-table mask of the sentence
 * @param predicate    Canonically ordered predicate
 * @param text         Rendered predicate
 */
public record ConversionResult(
        String sentence,
        NormalForm form,
        List<String> terms,
        BigInteger sentenceMask,
        Predicate predicate,
        String text
) {
    public ConversionResult {
        terms = List.copyOf(terms);
    }
}
