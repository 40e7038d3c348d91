package com.normalform.truthtable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TermEncoder.
 */
class TermEncoderTest {

    @Test
    @DisplayName("Should encode terms as truth-table columns")
    void shouldEncodeColumns() {
        TermTable table = TermEncoder.encode(List.of("a", "b", "c"));

        assertEquals(3, table.size());
        assertEquals(8, table.rowCount());
        assertEquals("10101010", Masks.toBinaryString(table.mask("a"), 8));
        assertEquals("11001100", Masks.toBinaryString(table.mask("b"), 8));
        assertEquals("11110000", Masks.toBinaryString(table.mask("c"), 8));
        assertEquals(BigInteger.valueOf(0xFF), table.fullMask());
    }

    @ParameterizedTest
    @DisplayName("Every term is true on exactly half of the rows")
    @ValueSource(ints = {1, 2, 5, 9, 12})
    void shouldHaveHalfDensity(int termCount) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < termCount; i++) {
            names.add("t" + i);
        }
        TermTable table = TermEncoder.encode(names);

        for (int i = 0; i < termCount; i++) {
            assertEquals(1 << (termCount - 1), table.mask(i).bitCount(), "term t" + i);
        }
    }

    @Test
    @DisplayName("Bit j of term i's mask equals bit i of j")
    void shouldMatchRowBits() {
        TermTable table = TermEncoder.encode(List.of("p", "q", "r", "s"));

        for (int i = 0; i < table.size(); i++) {
            for (int row = 0; row < table.rowCount(); row++) {
                assertEquals(((row >> i) & 1) == 1, table.mask(i).testBit(row));
            }
        }
    }

    @Test
    @DisplayName("Negated literal mask is the complement within the table")
    void shouldComplementNegatedLiterals() {
        TermTable table = TermEncoder.encode(List.of("a", "b"));

        assertEquals("0101", Masks.toBinaryString(table.literalMask(0, true), 4));
        assertEquals("1010", Masks.toBinaryString(table.literalMask(0, false), 4));
        assertEquals(table.fullMask(), table.literalMask(1, true).or(table.literalMask(1, false)));
    }

    @Test
    @DisplayName("Unknown term names are rejected")
    void shouldRejectUnknownTerm() {
        TermTable table = TermEncoder.encode(List.of("a"));

        assertFalse(table.contains("b"));
        assertThrows(IllegalArgumentException.class, () -> table.mask("b"));
    }

    @Test
    @DisplayName("Masks round-trip through row values")
    void shouldBuildMaskFromRows() {
        boolean[] rows = new boolean[20];
        rows[0] = true;
        rows[9] = true;
        rows[19] = true;

        BigInteger mask = Masks.fromRows(rows);

        assertEquals(BigInteger.ONE.or(BigInteger.ONE.shiftLeft(9)).or(BigInteger.ONE.shiftLeft(19)), mask);
        assertEquals(BigInteger.valueOf(0b1010), Masks.complement(BigInteger.valueOf(0b0101), 4));
    }
}
