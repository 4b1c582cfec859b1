package com.residencyinsight.core.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Uniformly sampled, immutable series of values for one system.
 *
 * <p>
 * The timestamp of index {@code i} is {@code start + i × step}; timestamps are
 * therefore strictly increasing and gap-free by construction. Values are
 * copied on the way in and on the way out, so an instance can be shared
 * freely between threads.
 * </p>
 *
 * <h3>Undefined values</h3>
 * <p>
 * A series produced by the resampler may carry {@code NaN} at its leading or
 * trailing boundary where no sample existed to interpolate from. Analyzers
 * expect a fully defined series; call {@link #trimUndefined()} first.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    /** Default resampling cadence. */
    public static final Duration DEFAULT_STEP = Duration.ofMinutes(1);

    private final String label;
    private final LocalDateTime start;
    private final Duration step;
    private final double[] values;

    /**
     * @param label  system label; must not be {@code null}
     * @param start  timestamp of index 0; must not be {@code null}
     * @param step   spacing between samples; must be positive
     * @param values sample values (copied)
     * @throws IllegalArgumentException if {@code step} is not positive
     */
    public TimeSeries(String label, LocalDateTime start, Duration step, double[] values) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.step = Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
        this.values = values.clone();
    }

    public String getLabel() {
        return label;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public Duration getStep() {
        return step;
    }

    /**
     * @return timestamp of the last sample, or {@link #getStart()} for an empty
     *         series
     */
    public LocalDateTime getEnd() {
        return values.length == 0 ? start : timestampAt(values.length - 1);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double valueAt(int index) {
        return values[index];
    }

    public LocalDateTime timestampAt(int index) {
        if (index < 0 || index >= values.length) {
            throw new IndexOutOfBoundsException("index " + index + " outside [0, " + values.length + ")");
        }
        return start.plus(step.multipliedBy(index));
    }

    /**
     * @return copy of the values
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * @return step expressed in (possibly fractional) minutes
     */
    public double stepMinutes() {
        return step.toNanos() / 60_000_000_000d;
    }

    /**
     * @return {@code true} if every value is finite
     */
    public boolean isFullyDefined() {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Drop undefined values from both ends of the series.
     *
     * @return this instance if nothing needed trimming, otherwise a shorter
     *         series whose start is shifted accordingly; empty if no value is
     *         defined
     */
    public TimeSeries trimUndefined() {
        int first = 0;
        while (first < values.length && !Double.isFinite(values[first])) {
            first++;
        }
        int last = values.length - 1;
        while (last >= first && !Double.isFinite(values[last])) {
            last--;
        }
        if (first == 0 && last == values.length - 1) {
            return this;
        }
        double[] kept = first > last ? new double[0] : Arrays.copyOfRange(values, first, last + 1);
        return new TimeSeries(label, start.plus(step.multipliedBy(first)), step, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return label.equals(that.label)
                && start.equals(that.start)
                && step.equals(that.step)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(label, start, step) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "label='" + label + '\'' +
                ", start=" + start +
                ", step=" + step +
                ", size=" + values.length +
                '}';
    }
}
