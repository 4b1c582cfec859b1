package com.residencyinsight.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Dominant cycle of a series and the spectrum it was read from.
 *
 * @since 1.0.0
 */
public final class PeriodicityResult {

    private final int dominantBin;
    private final double dominantFrequency;
    private final double periodMinutes;
    private final FrequencySpectrum spectrum;

    /**
     * @param dominantBin       index of the strongest non-DC bin
     * @param dominantFrequency its frequency in cycles per minute
     * @param spectrum          full spectrum including the DC bin
     */
    public PeriodicityResult(int dominantBin, double dominantFrequency, FrequencySpectrum spectrum) {
        if (dominantBin < 1) {
            throw new IllegalArgumentException("dominantBin must be >= 1, got: " + dominantBin);
        }
        if (!(dominantFrequency > 0)) {
            throw new IllegalArgumentException("dominantFrequency must be > 0, got: " + dominantFrequency);
        }
        this.dominantBin = dominantBin;
        this.dominantFrequency = dominantFrequency;
        this.periodMinutes = 1.0 / dominantFrequency;
        this.spectrum = Objects.requireNonNull(spectrum, "spectrum must not be null");
    }

    public int getDominantBin() {
        return dominantBin;
    }

    /**
     * @return dominant frequency, cycles per minute
     */
    public double getDominantFrequency() {
        return dominantFrequency;
    }

    public double getPeriodMinutes() {
        return periodMinutes;
    }

    public double getPeriodHours() {
        return periodMinutes / 60.0;
    }

    /**
     * @return period rounded to the nearest millisecond
     */
    public Duration getPeriod() {
        return Duration.ofMillis(Math.round(periodMinutes * 60_000d));
    }

    public FrequencySpectrum getSpectrum() {
        return spectrum;
    }

    @Override
    public String toString() {
        return "PeriodicityResult{" +
                "dominantBin=" + dominantBin +
                ", periodHours=" + getPeriodHours() +
                '}';
    }
}
