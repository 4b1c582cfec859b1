package com.residencyinsight.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Aroon indicator plus the bullish crossovers found in it.
 *
 * <p>
 * The count covers the whole observed series; it is not normalised per day.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendReversalResult {

    private final AroonPair indicator;
    private final int[] reversalIndices;

    public TrendReversalResult(AroonPair indicator, int[] reversalIndices) {
        this.indicator = Objects.requireNonNull(indicator, "indicator must not be null");
        this.reversalIndices = Objects.requireNonNull(reversalIndices, "reversalIndices must not be null").clone();
    }

    /**
     * Result for a series too short to fill one window.
     *
     * @param window window length
     * @param length series length
     * @return all-undefined indicator with no reversals
     */
    public static TrendReversalResult insufficient(int window, int length) {
        double[] undefined = new double[length];
        Arrays.fill(undefined, Double.NaN);
        return new TrendReversalResult(new AroonPair(window, undefined, undefined), new int[0]);
    }

    public AroonPair getIndicator() {
        return indicator;
    }

    public int getReversalCount() {
        return reversalIndices.length;
    }

    public int[] getReversalIndices() {
        return reversalIndices.clone();
    }

    @Override
    public String toString() {
        return "TrendReversalResult{window=" + indicator.getWindow()
                + ", reversals=" + reversalIndices.length + '}';
    }
}
