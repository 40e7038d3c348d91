package com.normalform.format;

import com.normalform.minimizer.Clause;
import com.normalform.minimizer.Literal;
import com.normalform.minimizer.Predicate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical order of a predicate's clauses.
 * <p>
 * Literals inside a clause are ordered by term name, ignoring negation. Clauses
 * are then compared by:
 * <ol>
 *   <li>Length (fewer literals first)</li>
 *   <li>Term name of the first literal</li>
 *   <li>Clause key: literal by literal, a negated literal before a positive one,
 *       then by term name; a clause that runs out first wins</li>
 * </ol>
 * The result does not depend on the order clauses were found in.
 */
public final class ClauseOrder implements Comparator<Clause> {

    public static final ClauseOrder INSTANCE = new ClauseOrder();

    private static final Comparator<Literal> LITERAL_KEY =
            Comparator.comparing((Literal literal) -> !literal.negated())
                    .thenComparing(Literal::name);

    private ClauseOrder() {
    }

    /**
     * Order literals within each clause, then order the clauses.
     */
    public static Predicate canonicalize(Predicate predicate) {
        if (predicate.isConstant()) {
            return predicate;
        }
        List<Clause> clauses = new ArrayList<>(predicate.clauses().size());
        for (Clause clause : predicate.clauses()) {
            clauses.add(clause.sortedByName());
        }
        clauses.sort(INSTANCE);
        return predicate.withClauses(clauses);
    }

    @Override
    public int compare(Clause a, Clause b) {
        // 1. Length
        int lengthCmp = Integer.compare(a.size(), b.size());
        if (lengthCmp != 0) {
            return lengthCmp;
        }

        // 2. First literal's term name
        int firstCmp = a.first().name().compareTo(b.first().name());
        if (firstCmp != 0) {
            return firstCmp;
        }

        // 3. Clause key
        return compareKeys(a.literals(), b.literals());
    }

    private static int compareKeys(List<Literal> a, List<Literal> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int cmp = LITERAL_KEY.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
