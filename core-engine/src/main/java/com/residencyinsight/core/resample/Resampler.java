package com.residencyinsight.core.resample;

import com.residencyinsight.core.exception.EmptyInputException;
import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Places raw samples on a regular time grid.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Order the samples by timestamp; for duplicate timestamps the sample
 * appearing last wins.</li>
 * <li>Lay a grid from the first to the last timestamp with spacing
 * {@code step}.</li>
 * <li>A grid point that carries a defined sample keeps it. Any other point is
 * interpolated linearly in time between the nearest defined samples on each
 * side.</li>
 * <li>A point with no defined sample on one side stays {@code NaN}; values are
 * never extrapolated.</li>
 * </ol>
 *
 * <p>
 * Samples falling between grid points contribute only as interpolation
 * anchors.
 * </p>
 *
 * @since 1.0.0
 */
public final class Resampler {

    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    private Resampler() {
        // utility class
    }

    /**
     * Resample onto the default one-minute grid.
     *
     * @see #resample(String, List, Duration)
     */
    public static TimeSeries resample(String label, List<Sample> samples) {
        return resample(label, samples, TimeSeries.DEFAULT_STEP);
    }

    /**
     * @param label   system label carried into the series
     * @param samples raw samples in any order
     * @param step    grid spacing; must be positive
     * @return uniformly spaced series spanning the samples' time extent
     * @throws EmptyInputException      if there are no samples or none has a
     *                                  defined value
     * @throws IllegalArgumentException if {@code step} is not positive or the
     *                                  grid would be too large
     */
    public static TimeSeries resample(String label, List<Sample> samples, Duration step) {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(step, "step must not be null");
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
        if (samples == null || samples.isEmpty()) {
            throw new EmptyInputException("No samples available for system '" + label + "'");
        }

        TreeMap<LocalDateTime, Double> ordered = new TreeMap<>();
        for (Sample sample : samples) {
            Double previous = ordered.put(sample.getTimestamp(), sample.getValue());
            if (previous != null) {
                LOG.trace("System [{}]: duplicate timestamp {} - keeping last value", label, sample.getTimestamp());
            }
        }

        LocalDateTime first = ordered.firstKey();
        long stepNanos = step.toNanos();
        long spanNanos = Duration.between(first, ordered.lastKey()).toNanos();
        long gridSize = spanNanos / stepNanos + 1;
        if (gridSize > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Grid of " + gridSize + " points is too large for step " + step);
        }

        // Defined samples as (offset from first, value), ascending by offset
        long[] knownOffsets = new long[ordered.size()];
        double[] knownValues = new double[ordered.size()];
        int known = 0;
        for (Map.Entry<LocalDateTime, Double> e : ordered.entrySet()) {
            if (Double.isFinite(e.getValue())) {
                knownOffsets[known] = Duration.between(first, e.getKey()).toNanos();
                knownValues[known] = e.getValue();
                known++;
            }
        }
        if (known == 0) {
            throw new EmptyInputException("No defined values for system '" + label + "'");
        }

        double[] grid = new double[(int) gridSize];
        int interpolated = 0;
        int j = -1; // last known index with offset <= current grid offset
        for (int i = 0; i < grid.length; i++) {
            long offset = i * stepNanos;
            while (j + 1 < known && knownOffsets[j + 1] <= offset) {
                j++;
            }
            if (j >= 0 && knownOffsets[j] == offset) {
                grid[i] = knownValues[j];
            } else if (j >= 0 && j + 1 < known) {
                double fraction = (double) (offset - knownOffsets[j])
                        / (knownOffsets[j + 1] - knownOffsets[j]);
                grid[i] = knownValues[j] + fraction * (knownValues[j + 1] - knownValues[j]);
                interpolated++;
            } else {
                grid[i] = Double.NaN;
            }
        }

        LOG.debug("System [{}]: resampled {} raw sample(s) onto {} point(s) at {} ({} interpolated)",
                label, samples.size(), grid.length, step, interpolated);
        return new TimeSeries(label, first, step, grid);
    }
}
