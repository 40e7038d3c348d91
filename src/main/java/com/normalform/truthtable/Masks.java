package com.normalform.truthtable;

import java.math.BigInteger;

/**
 * Helpers for truth-table masks: one bit per row, row 0 is the least significant bit.
 */
public final class Masks {

    /**
     * Largest term count whose row count still fits in an int.
     */
    public static final int MAX_TERMS = 30;

    private Masks() {
    }

    public static int rowCount(int termCount) {
        if (termCount < 0 || termCount > MAX_TERMS) {
            throw new IllegalArgumentException("Term count must be between 0 and " + MAX_TERMS
                    + ", got " + termCount);
        }
        return 1 << termCount;
    }

    /**
     * Mask with every one of {@code rows} bits set.
     */
    public static BigInteger full(int rows) {
        return BigInteger.ONE.shiftLeft(rows).subtract(BigInteger.ONE);
    }

    /**
     * Bitwise complement restricted to {@code rows} bits.
     */
    public static BigInteger complement(BigInteger mask, int rows) {
        return full(rows).andNot(mask);
    }

    /**
     * Build a mask from row values, where {@code values[j]} becomes bit j.
     */
    public static BigInteger fromRows(boolean[] values) {
        byte[] magnitude = new byte[(values.length + 7) / 8];
        for (int row = 0; row < values.length; row++) {
            if (values[row]) {
                // big-endian: the last byte holds rows 0..7
                magnitude[magnitude.length - 1 - row / 8] |= (byte) (1 << (row % 8));
            }
        }
        return new BigInteger(1, magnitude);
    }

    /**
     * Render the low {@code rows} bits, most significant row first.
     */
    public static String toBinaryString(BigInteger mask, int rows) {
        StringBuilder sb = new StringBuilder(rows);
        for (int row = rows - 1; row >= 0; row--) {
            sb.append(mask.testBit(row) ? '1' : '0');
        }
        return sb.toString();
    }
}
