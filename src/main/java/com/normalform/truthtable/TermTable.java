package com.normalform.truthtable;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terms of one sentence with their indices and truth-table masks.
 * Immutable once built by {@link TermEncoder}.
 */
public final class TermTable {

    private final List<String> names;
    private final List<BigInteger> masks;
    private final Map<String, Integer> indices;
    private final int rowCount;
    private final BigInteger fullMask;

    TermTable(List<String> names, List<BigInteger> masks, int rowCount) {
        this.names = List.copyOf(Objects.requireNonNull(names, "names cannot be null"));
        this.masks = List.copyOf(Objects.requireNonNull(masks, "masks cannot be null"));
        if (this.names.size() != this.masks.size()) {
            throw new IllegalArgumentException("Expected one mask per term");
        }
        this.indices = new HashMap<>();
        for (int i = 0; i < this.names.size(); i++) {
            indices.put(this.names.get(i), i);
        }
        this.rowCount = rowCount;
        this.fullMask = Masks.full(rowCount);
    }

    /**
     * Number of distinct terms (n).
     */
    public int size() {
        return names.size();
    }

    /**
     * Number of truth-table rows (2^n).
     */
    public int rowCount() {
        return rowCount;
    }

    public BigInteger fullMask() {
        return fullMask;
    }

    public String name(int index) {
        return names.get(index);
    }

    public BigInteger mask(int index) {
        return masks.get(index);
    }

    public boolean contains(String name) {
        return indices.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the name is not a term of this table
     */
    public BigInteger mask(String name) {
        Integer index = indices.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown term '" + name + "'");
        }
        return masks.get(index);
    }

    /**
     * Mask of a literal: the term mask, or its complement over the table's rows when negated.
     */
    public BigInteger literalMask(int index, boolean negated) {
        BigInteger mask = masks.get(index);
        return negated ? fullMask.andNot(mask) : mask;
    }

    @Override
    public String toString() {
        return "TermTable{" +
                "terms=" + names +
                ", rows=" + rowCount +
                '}';
    }
}
