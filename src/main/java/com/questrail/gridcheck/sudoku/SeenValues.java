package com.questrail.gridcheck.sudoku;

import java.util.BitSet;

/**
 * SeenValues
 * -----------------------------------------------------------------------------
 * One family of "seen-value" sets (all rows, all columns, or all sub-boxes)
 * packed into a single {@link BitSet}.
 *
 * <p>A family holds {@code groups} sets over the values [1, {@code maxValue}].
 * Value {@code v} of group {@code g} occupies bit
 * {@code g * maxValue + (v - 1)}, so the whole family costs
 * {@code groups * maxValue} bits.</p>
 *
 * <p>Instances are mutable and confined to a single validation call.</p>
 */
final class SeenValues
{
    private final int maxValue;
    private final BitSet bits;

    SeenValues(int groups, int maxValue)
    {
        if (groups < 1 || maxValue < 1) {
            throw new IllegalArgumentException("groups=" + groups + ", maxValue=" + maxValue);
        }
        this.maxValue = maxValue;
        this.bits = new BitSet(groups * maxValue);
    }

    boolean contains(int group, int value)
    {
        return bits.get(indexOf(group, value));
    }

    void add(int group, int value)
    {
        bits.set(indexOf(group, value));
    }

    int size()
    {
        return bits.cardinality();
    }

    private int indexOf(int group, int value)
    {
        if (value < 1 || value > maxValue) {
            throw new IndexOutOfBoundsException("value=" + value + ", maxValue=" + maxValue);
        }
        return group * maxValue + (value - 1);
    }
}
