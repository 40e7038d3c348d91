package com.normalform.minimizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of literals over distinct terms.
 * A conjunction in DNF, a disjunction in CNF.
 *
 * @param literals Literals of the clause, never empty
 */
public record Clause(List<Literal> literals) {

    private static final Comparator<Literal> BY_NAME = Comparator.comparing(Literal::name);

    public Clause {
        Objects.requireNonNull(literals, "literals cannot be null");
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("A clause needs at least one literal");
        }
        literals = List.copyOf(literals);
    }

    public static Clause of(Literal... literals) {
        return new Clause(List.of(literals));
    }

    public int size() {
        return literals.size();
    }

    public Literal first() {
        return literals.get(0);
    }

    /**
     * Copy of this clause with literals ordered by term name, ignoring negation.
     */
    public Clause sortedByName() {
        List<Literal> sorted = new ArrayList<>(literals);
        sorted.sort(BY_NAME);
        return new Clause(sorted);
    }

    @Override
    public String toString() {
        return literals.toString();
    }
}
