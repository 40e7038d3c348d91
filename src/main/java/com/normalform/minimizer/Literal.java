package com.normalform.minimizer;

import com.normalform.sentence.SymbolTable;

import java.util.Objects;

/**
 * A term name with a negation flag.
 *
 * @param name    Term name
 * @param negated Whether the term appears negated
 */
public record Literal(String name, boolean negated) {

    public Literal {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static Literal positive(String name) {
        return new Literal(name, false);
    }

    public static Literal negative(String name) {
        return new Literal(name, true);
    }

    @Override
    public String toString() {
        return negated ? SymbolTable.NOT + name : name;
    }
}
