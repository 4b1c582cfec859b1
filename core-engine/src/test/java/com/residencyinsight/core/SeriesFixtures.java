package com.residencyinsight.core;

import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Synthetic series shared by the unit tests.
 */
public final class SeriesFixtures {

    public static final LocalDateTime MIDNIGHT = LocalDateTime.of(2024, 3, 4, 0, 0);
    public static final int MINUTES_PER_DAY = 1440;

    private SeriesFixtures() {
    }

    public static TimeSeries minutes(String label, int length, IntToDoubleFunction value) {
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = value.applyAsDouble(i);
        }
        return new TimeSeries(label, MIDNIGHT, Duration.ofMinutes(1), values);
    }

    public static TimeSeries of(double... values) {
        return new TimeSeries("test", MIDNIGHT, Duration.ofMinutes(1), values);
    }

    public static TimeSeries constant(int length, double value) {
        return minutes("constant", length, i -> value);
    }

    /**
     * Two days at one-minute cadence, constant 50 with a single 95 at {@code spikeIndex}.
     */
    public static TimeSeries spike(int spikeIndex) {
        return minutes("spike", 2 * MINUTES_PER_DAY, i -> i == spikeIndex ? 95.0 : 50.0);
    }

    public static double sine(int minute, double periodMinutes) {
        return Math.sin(2 * Math.PI * minute / periodMinutes);
    }

    public static List<Sample> samples(TimeSeries series) {
        List<Sample> samples = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            samples.add(Sample.of(series.timestampAt(i), series.valueAt(i)));
        }
        return samples;
    }
}
