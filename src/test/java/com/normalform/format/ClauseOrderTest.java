package com.normalform.format;

import com.normalform.minimizer.Clause;
import com.normalform.minimizer.Literal;
import com.normalform.minimizer.NormalForm;
import com.normalform.minimizer.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClauseOrder.
 */
class ClauseOrderTest {

    private static Clause clause(String... literals) {
        List<Literal> list = new ArrayList<>();
        for (String literal : literals) {
            list.add(literal.startsWith("~")
                    ? Literal.negative(literal.substring(1))
                    : Literal.positive(literal));
        }
        return new Clause(list);
    }

    @Test
    @DisplayName("Literals are ordered by term name ignoring negation")
    void shouldSortLiteralsByName() {
        Predicate predicate = Predicate.of(NormalForm.CNF, List.of(clause("~c", "b", "~a")));

        assertEquals(List.of(clause("~a", "b", "~c")), ClauseOrder.canonicalize(predicate).clauses());
    }

    @Test
    @DisplayName("Shorter clauses come first")
    void shouldOrderByLength() {
        assertTrue(ClauseOrder.INSTANCE.compare(clause("z"), clause("a", "b")) < 0);
    }

    @Test
    @DisplayName("Equal lengths are ordered by first term name")
    void shouldOrderByFirstName() {
        assertTrue(ClauseOrder.INSTANCE.compare(clause("~a", "z"), clause("b", "c")) < 0);
    }

    @Test
    @DisplayName("Remaining ties put negated literals first, then names")
    void shouldBreakTiesByClauseKey() {
        assertTrue(ClauseOrder.INSTANCE.compare(clause("~a", "~c"), clause("~a", "b")) < 0);
        assertTrue(ClauseOrder.INSTANCE.compare(clause("~a", "b"), clause("a", "b")) < 0);
        assertTrue(ClauseOrder.INSTANCE.compare(clause("a", "b"), clause("a", "c")) < 0);
        assertEquals(0, ClauseOrder.INSTANCE.compare(clause("a", "~b"), clause("a", "~b")));
    }

    @Test
    @DisplayName("Canonical order does not depend on the input order")
    void shouldBeIndependentOfInputOrder() {
        List<Clause> clauses = List.of(
                clause("~a", "b"), clause("c"), clause("~a", "~c"),
                clause("b", "~d", "a"), clause("a", "b"), clause("~b"));
        String expected = PredicateFormatter.format(
                ClauseOrder.canonicalize(Predicate.of(NormalForm.DNF, clauses)));

        Random random = new Random(7);
        for (int i = 0; i < 50; i++) {
            List<Clause> shuffled = new ArrayList<>(clauses);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, PredicateFormatter.format(
                    ClauseOrder.canonicalize(Predicate.of(NormalForm.DNF, shuffled))));
        }
        assertEquals("~b || c || (~a && ~c) || (~a && b) || (a && b) || (a && b && ~d)", expected);
    }

    @Test
    @DisplayName("Constant predicates are left alone")
    void shouldKeepConstants() {
        Predicate constant = Predicate.constant(NormalForm.CNF, true);

        assertSame(constant, ClauseOrder.canonicalize(constant));
    }
}
