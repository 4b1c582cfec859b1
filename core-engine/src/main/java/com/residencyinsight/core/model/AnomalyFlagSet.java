package com.residencyinsight.core.model;

import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable per-index anomaly flags, aligned with the series a detector ran
 * over.
 *
 * @since 1.0.0
 */
public final class AnomalyFlagSet {

    private final int length;
    private final BitSet flags;

    private AnomalyFlagSet(int length, BitSet flags) {
        this.length = length;
        this.flags = flags;
    }

    /**
     * @param flags one entry per series index (copied)
     * @return new flag set
     */
    public static AnomalyFlagSet of(boolean[] flags) {
        Objects.requireNonNull(flags, "flags must not be null");
        BitSet bits = new BitSet(flags.length);
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                bits.set(i);
            }
        }
        return new AnomalyFlagSet(flags.length, bits);
    }

    /**
     * @param length series length
     * @return flag set with nothing flagged
     */
    public static AnomalyFlagSet none(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, got: " + length);
        }
        return new AnomalyFlagSet(length, new BitSet(length));
    }

    public int length() {
        return length;
    }

    public boolean isFlagged(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + length + ")");
        }
        return flags.get(index);
    }

    public int count() {
        return flags.cardinality();
    }

    /**
     * @return flagged fraction of the series, 0 for an empty series
     */
    public double rate() {
        return length == 0 ? 0.0 : (double) count() / length;
    }

    /**
     * @return ascending indices of flagged samples
     */
    public int[] flaggedIndices() {
        return flags.stream().toArray();
    }

    /**
     * Count indices flagged in both sets.
     *
     * @param other flag set of the same length
     * @return size of the intersection
     * @throws IllegalArgumentException if the lengths differ
     */
    public int intersectionCount(AnomalyFlagSet other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.length != length) {
            throw new IllegalArgumentException(
                    "Flag sets are not aligned: " + length + " vs " + other.length);
        }
        BitSet both = (BitSet) flags.clone();
        both.and(other.flags);
        return both.cardinality();
    }

    /**
     * @return copy of the flags as a primitive array
     */
    public boolean[] toArray() {
        boolean[] out = new boolean[length];
        for (int i = flags.nextSetBit(0); i >= 0; i = flags.nextSetBit(i + 1)) {
            out[i] = true;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyFlagSet that))
            return false;
        return length == that.length && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, flags);
    }

    @Override
    public String toString() {
        return "AnomalyFlagSet{length=" + length + ", flagged=" + count() + '}';
    }
}
