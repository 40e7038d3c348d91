package com.normalform.minimizer;

import java.math.BigInteger;

/**
 * A candidate clause together with its truth-table mask.
 *
 * @param clause Literals in combination order
 * @param code   Conjunction (DNF) or disjunction (CNF) of the literal masks
 */
public record Candidate(Clause clause, BigInteger code) {
}
