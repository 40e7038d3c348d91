package com.normalform.format;

import com.normalform.minimizer.Clause;
import com.normalform.minimizer.Literal;
import com.normalform.minimizer.NormalForm;
import com.normalform.minimizer.Predicate;
import com.normalform.sentence.SymbolTable;

import java.util.StringJoiner;

/**
 * Renders a predicate as a single-line sentence.
 * <p>
 * Clauses with more than one literal are parenthesized:
 * <pre>
 * DNF: ~a || (b &amp;&amp; c)
 * CNF: (~a || ~c) &amp;&amp; (~a || b)
 * </pre>
 * Constant predicates render as {@code true} or {@code false}.
 */
public final class PredicateFormatter {

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    private PredicateFormatter() {
    }

    public static String format(Predicate predicate) {
        if (predicate.isConstant()) {
            return predicate.constantValue() ? TRUE : FALSE;
        }

        NormalForm form = predicate.form();
        StringJoiner sentence = new StringJoiner(form.clauseSeparator());
        for (Clause clause : predicate.clauses()) {
            sentence.add(formatClause(clause, form));
        }
        return sentence.toString();
    }

    static String formatClause(Clause clause, NormalForm form) {
        if (clause.size() == 1) {
            return clause.first().toString();
        }
        StringJoiner joiner = new StringJoiner(form.literalSeparator(),
                SymbolTable.LEFT_PAREN, SymbolTable.RIGHT_PAREN);
        for (Literal literal : clause.literals()) {
            joiner.add(literal.toString());
        }
        return joiner.toString();
    }
}
