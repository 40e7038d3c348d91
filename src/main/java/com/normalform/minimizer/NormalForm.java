package com.normalform.minimizer;

import java.util.Locale;

/**
 * Target normal forms.
 */
public enum NormalForm {
    /**
     * Disjunctive Normal Form: a disjunction of conjunctive clauses.
     * Example: {@code ~a || (b && c)}
     */
    DNF(" && ", " || "),

    /**
     * Conjunctive Normal Form: a conjunction of disjunctive clauses.
     * Example: {@code (~a || ~c) && (~a || b)}
     */
    CNF(" || ", " && ");

    private final String literalSeparator;
    private final String clauseSeparator;

    NormalForm(String literalSeparator, String clauseSeparator) {
        this.literalSeparator = literalSeparator;
        this.clauseSeparator = clauseSeparator;
    }

    /**
     * Separator between the literals of one clause.
     */
    public String literalSeparator() {
        return literalSeparator;
    }

    /**
     * Separator between clauses.
     */
    public String clauseSeparator() {
        return clauseSeparator;
    }

    /**
     * Resolve a mode argument: {@code dnf} in any case selects DNF, anything else
     * (including null) selects CNF.
     */
    public static NormalForm fromMode(String mode) {
        if (mode != null && mode.trim().toLowerCase(Locale.ROOT).equals("dnf")) {
            return DNF;
        }
        return CNF;
    }
}
