package com.residencyinsight.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single raw telemetry reading for one system.
 *
 * <p>
 * Timestamps are wall-clock values in the zone the data was recorded in; the
 * engine never converts them. A {@code NaN} value marks a reading that was
 * present in the source but carried no usable number.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample {

    private final LocalDateTime timestamp;
    private final double value;

    /**
     * @param timestamp reading time; must not be {@code null}
     * @param value     reading value, or {@code NaN} if missing
     */
    public Sample(LocalDateTime timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public static Sample of(LocalDateTime timestamp, double value) {
        return new Sample(timestamp, value);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return {@code true} if the value is a finite number
     */
    public boolean isDefined() {
        return Double.isFinite(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Sample{" + timestamp + "=" + value + '}';
    }
}
