package com.normalform.truthtable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes each term as the column it would have in a truth table.
 * <p>
 * For term index i, bit j of the mask equals bit i of j. With terms [a, b, c]:
 * <pre>
 * a: 10101010
 * b: 11001100
 * c: 11110000
 * </pre>
 * Time and space are O(n * 2^n), which is the practical ceiling on the number
 * of distinct terms.
 */
public final class TermEncoder {

    private static final Logger log = LoggerFactory.getLogger(TermEncoder.class);

    private TermEncoder() {
    }

    public static TermTable encode(List<String> termNames) {
        int rows = Masks.rowCount(termNames.size());
        List<BigInteger> masks = new ArrayList<>(termNames.size());

        for (int i = 0; i < termNames.size(); i++) {
            boolean[] column = new boolean[rows];
            for (int row = 0; row < rows; row++) {
                column[row] = ((row >> i) & 1) == 1;
            }
            masks.add(Masks.fromRows(column));
        }

        log.debug("Encoded {} terms over {} rows", termNames.size(), rows);
        return new TermTable(termNames, masks, rows);
    }
}
