package com.normalform.minimizer;

import java.util.List;
import java.util.Objects;

/**
 * Result of minimization: either a constant, or an ordered list of clauses in
 * one normal form (a disjunction of clauses for DNF, a conjunction for CNF).
 */
public final class Predicate {

    private final NormalForm form;
    private final Boolean constant;
    private final List<Clause> clauses;

    private Predicate(NormalForm form, Boolean constant, List<Clause> clauses) {
        this.form = Objects.requireNonNull(form, "form cannot be null");
        this.constant = constant;
        this.clauses = clauses;
    }

    /**
     * Predicate that holds on every row, or on none.
     */
    public static Predicate constant(NormalForm form, boolean value) {
        return new Predicate(form, value, List.of());
    }

    public static Predicate of(NormalForm form, List<Clause> clauses) {
        Objects.requireNonNull(clauses, "clauses cannot be null");
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("A non-constant predicate needs at least one clause");
        }
        return new Predicate(form, null, List.copyOf(clauses));
    }

    public NormalForm form() {
        return form;
    }

    public boolean isConstant() {
        return constant != null;
    }

    /**
     * @throws IllegalStateException if the predicate is not constant
     */
    public boolean constantValue() {
        if (constant == null) {
            throw new IllegalStateException("Predicate is not constant");
        }
        return constant;
    }

    /**
     * Clauses in their current order; empty for a constant predicate.
     */
    public List<Clause> clauses() {
        return clauses;
    }

    /**
     * Same form and constant, with the clauses replaced.
     */
    public Predicate withClauses(List<Clause> reordered) {
        if (isConstant()) {
            return this;
        }
        return of(form, reordered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Predicate that = (Predicate) o;
        return form == that.form
                && Objects.equals(constant, that.constant)
                && clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, constant, clauses);
    }

    @Override
    public String toString() {
        if (isConstant()) {
            return "Predicate{" + form + ", " + constant + '}';
        }
        return "Predicate{" + form + ", " + clauses + '}';
    }
}
