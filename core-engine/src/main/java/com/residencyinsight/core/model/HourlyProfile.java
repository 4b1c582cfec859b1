package com.residencyinsight.core.model;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.StringJoiner;

/**
 * Mean value per hour of day.
 *
 * <p>
 * The key domain is always the 24 hours {@code 0..23}. An hour with no samples
 * has a count of zero and no mean.
 * </p>
 *
 * @since 1.0.0
 */
public final class HourlyProfile {

    public static final int HOURS_PER_DAY = 24;

    private final double[] means;
    private final long[] counts;

    /**
     * @param means  24 hourly means, {@code NaN} where an hour has no samples
     * @param counts 24 hourly sample counts
     */
    public HourlyProfile(double[] means, long[] counts) {
        Objects.requireNonNull(means, "means must not be null");
        Objects.requireNonNull(counts, "counts must not be null");
        if (means.length != HOURS_PER_DAY || counts.length != HOURS_PER_DAY) {
            throw new IllegalArgumentException("Hourly profile needs exactly " + HOURS_PER_DAY + " entries");
        }
        this.means = means.clone();
        this.counts = counts.clone();
    }

    public OptionalDouble meanAt(int hour) {
        checkHour(hour);
        return counts[hour] == 0 ? OptionalDouble.empty() : OptionalDouble.of(means[hour]);
    }

    public long countAt(int hour) {
        checkHour(hour);
        return counts[hour];
    }

    /**
     * @return copy of the 24 means, {@code NaN} for empty hours
     */
    public double[] getMeans() {
        return means.clone();
    }

    private static void checkHour(int hour) {
        if (hour < 0 || hour >= HOURS_PER_DAY) {
            throw new IllegalArgumentException("hour must be in [0, 23], got: " + hour);
        }
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "HourlyProfile{", "}");
        for (int h = 0; h < HOURS_PER_DAY; h++) {
            if (counts[h] > 0) {
                joiner.add(h + "=" + means[h]);
            }
        }
        return joiner.toString();
    }
}
