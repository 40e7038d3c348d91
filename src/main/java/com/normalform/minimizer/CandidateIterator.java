package com.normalform.minimizer;

import com.normalform.truthtable.TermTable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily yields every candidate clause of one size, in a fixed order.
 * <p>
 * The generation order is: combinations of term indices in lexicographic order,
 * and for each combination the negation patterns 0 .. 2^k - 1, where bit d of the
 * pattern negates the d-th term of the combination. Candidates are consumed in
 * the <em>reverse</em> of that order: the last combination first, and within a
 * combination the pattern with every term negated first.
 * <p>
 * This order decides which of several valid covers the minimizer finds, so it
 * must not change. A fresh iterator over the same arguments replays the same sequence.
 */
public final class CandidateIterator implements Iterator<Candidate> {

    private final TermTable terms;
    private final NormalForm form;
    private final int size;
    private final int[] combination;
    private int pattern;
    private boolean exhausted;

    /**
     * @param terms Encoded terms
     * @param size  Clause size k, between 1 and the number of terms
     * @param form  DNF to combine literal masks with AND, CNF with OR
     */
    public CandidateIterator(TermTable terms, int size, NormalForm form) {
        if (size < 1 || size > terms.size()) {
            throw new IllegalArgumentException("Clause size must be between 1 and "
                    + terms.size() + ", got " + size);
        }
        this.terms = terms;
        this.form = form;
        this.size = size;

        // last combination in lexicographic order: [n-k, ..., n-1]
        this.combination = new int[size];
        for (int d = 0; d < size; d++) {
            combination[d] = terms.size() - size + d;
        }
        this.pattern = (1 << size) - 1;
        this.exhausted = false;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public Candidate next() {
        if (exhausted) {
            throw new NoSuchElementException();
        }
        Candidate candidate = build();
        advance();
        return candidate;
    }

    private Candidate build() {
        List<Literal> literals = new ArrayList<>(size);
        BigInteger code = form == NormalForm.DNF ? terms.fullMask() : BigInteger.ZERO;

        for (int d = 0; d < size; d++) {
            int index = combination[d];
            boolean negated = ((pattern >> d) & 1) == 1;
            literals.add(new Literal(terms.name(index), negated));

            BigInteger mask = terms.literalMask(index, negated);
            code = form == NormalForm.DNF ? code.and(mask) : code.or(mask);
        }
        return new Candidate(new Clause(literals), code);
    }

    private void advance() {
        if (pattern > 0) {
            pattern--;
            return;
        }
        if (previousCombination()) {
            pattern = (1 << size) - 1;
        } else {
            exhausted = true;
        }
    }

    /**
     * Step the combination back to its lexicographic predecessor.
     *
     * @return false if the combination was already the first one
     */
    private boolean previousCombination() {
        int n = terms.size();
        for (int i = size - 1; i >= 0; i--) {
            int lowest = i == 0 ? 0 : combination[i - 1] + 1;
            if (combination[i] > lowest) {
                combination[i]--;
                for (int j = i + 1; j < size; j++) {
                    combination[j] = n - size + j;
                }
                return true;
            }
        }
        return false;
    }
}
