package com.residencyinsight.core.model;

import java.util.Objects;

/**
 * Magnitude spectrum of a demeaned series.
 *
 * <p>
 * Two parallel arrays: non-negative bin frequencies in cycles per minute and
 * the magnitude of each bin. Index 0 is the zero-frequency (DC) bin.
 * </p>
 *
 * @since 1.0.0
 */
public final class FrequencySpectrum {

    private final double[] frequencies;
    private final double[] magnitudes;

    /**
     * @param frequencies bin frequencies, cycles per minute (copied)
     * @param magnitudes  bin magnitudes (copied)
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public FrequencySpectrum(double[] frequencies, double[] magnitudes) {
        Objects.requireNonNull(frequencies, "frequencies must not be null");
        Objects.requireNonNull(magnitudes, "magnitudes must not be null");
        if (frequencies.length != magnitudes.length) {
            throw new IllegalArgumentException("frequencies and magnitudes differ in length: "
                    + frequencies.length + " vs " + magnitudes.length);
        }
        this.frequencies = frequencies.clone();
        this.magnitudes = magnitudes.clone();
    }

    public int size() {
        return frequencies.length;
    }

    public double frequencyAt(int bin) {
        return frequencies[bin];
    }

    public double magnitudeAt(int bin) {
        return magnitudes[bin];
    }

    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public double[] getMagnitudes() {
        return magnitudes.clone();
    }

    @Override
    public String toString() {
        return "FrequencySpectrum{bins=" + frequencies.length + '}';
    }
}
