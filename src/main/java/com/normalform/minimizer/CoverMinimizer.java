package com.normalform.minimizer;

import com.normalform.exception.NoCoverFoundException;
import com.normalform.truthtable.Masks;
import com.normalform.truthtable.TermTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Greedy implicant cover of a sentence mask.
 * <p>
 * Clause sizes are tried from 1 upwards. A DNF candidate is accepted when it is
 * true only on rows where the sentence is true and adds at least one row to the
 * covered mask; a CNF candidate is accepted when it is false only on rows where
 * the sentence is false and removes at least one row. The search stops as soon
 * as the covered mask equals the sentence mask.
 * <p>
 * The result is deterministic but not guaranteed to be the smallest normal form.
 * Clauses are returned in acceptance order; ordering for output is done by
 * {@link com.normalform.format.ClauseOrder}.
 */
public final class CoverMinimizer {

    private static final Logger log = LoggerFactory.getLogger(CoverMinimizer.class);

    private CoverMinimizer() {
    }

    /**
     * @param sentence Sentence mask
     * @param terms    Encoded terms of the sentence
     * @param form     Target normal form
     * @return A constant predicate, or the accepted clauses in acceptance order
     * @throws NoCoverFoundException if no cover exists with clauses of at most n literals
     */
    public static Predicate minimize(BigInteger sentence, TermTable terms, NormalForm form) {
        BigInteger full = terms.fullMask();
        if (sentence.signum() == 0) {
            return Predicate.constant(form, false);
        }
        if (sentence.equals(full)) {
            return Predicate.constant(form, true);
        }

        List<Clause> clauses = new ArrayList<>();
        BigInteger covered = form == NormalForm.DNF ? BigInteger.ZERO : full;
        CandidateIterator candidates = null;
        int size = 0;

        while (!covered.equals(sentence)) {
            if (candidates == null || !candidates.hasNext()) {
                if (size == terms.size()) {
                    throw new NoCoverFoundException("Could not find a " + form
                            + " cover for sentence mask "
                            + Masks.toBinaryString(sentence, terms.rowCount()));
                }
                size++;
                candidates = new CandidateIterator(terms, size, form);
                log.trace("Trying {} clauses of size {}", form, size);
            }

            Candidate candidate = candidates.next();
            BigInteger code = candidate.code();
            if (form == NormalForm.DNF) {
                if (isImplicant(code, sentence) && code.andNot(covered).signum() != 0) {
                    clauses.add(candidate.clause());
                    covered = covered.or(code);
                    log.trace("Accepted {}", candidate.clause());
                }
            } else {
                if (isImplicate(code, sentence) && covered.andNot(code).signum() != 0) {
                    clauses.add(candidate.clause());
                    covered = covered.and(code);
                    log.trace("Accepted {}", candidate.clause());
                }
            }
        }

        log.debug("Found {} cover with {} clauses, largest size {}", form, clauses.size(), size);
        return Predicate.of(form, clauses);
    }

    /**
     * True only where the sentence is true.
     */
    static boolean isImplicant(BigInteger code, BigInteger sentence) {
        return code.andNot(sentence).signum() == 0;
    }

    /**
     * False only where the sentence is false.
     */
    static boolean isImplicate(BigInteger code, BigInteger sentence) {
        return sentence.andNot(code).signum() == 0;
    }
}
