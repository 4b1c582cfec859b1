package com.residencyinsight.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of an analytics run, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * cadenceSeconds: 60
 * deviationThreshold: 3.0
 * contamination: 0.01
 * randomSeed: 42
 * isolationTrees: 100
 * isolationSampleSize: 256
 * aroonWindow: 1440
 * rollingWindow: 60
 * parallelism: 5
 * </pre>
 *
 * <p>
 * When {@code aroonWindow} is omitted the window covers one day of samples at
 * the configured cadence. Call {@link #validate()} after construction or
 * deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig {

    private static final long SECONDS_PER_DAY = 86_400L;

    /** Spacing of the resampled grid, in seconds. */
    private long cadenceSeconds = 60;

    /** Z-score above which a sample is anomalous. */
    private double deviationThreshold = 3.0;

    /** Expected fraction of anomalies for the isolation forest. */
    private double contamination = 0.01;

    /** Seed for the isolation forest's random partitioning. */
    private long randomSeed = 42L;

    private int isolationTrees = 100;

    /** Upper bound on the per-tree sub-sample. */
    private int isolationSampleSize = 256;

    /** Aroon window in samples; {@code null} derives one day from the cadence. */
    private Integer aroonWindow;

    /** Window of the trailing rolling mean, in samples. */
    private int rollingWindow = 60;

    /** Worker threads used to run analyzers concurrently. */
    private int parallelism = 5;

    /**
     * @return configuration with every default applied
     */
    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that every value is within its legal range.
     *
     * @throws IllegalStateException listing every invalid value
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (cadenceSeconds <= 0) {
            errors.add("'cadenceSeconds' must be > 0, got: " + cadenceSeconds);
        }
        if (!(deviationThreshold > 0)) {
            errors.add("'deviationThreshold' must be > 0, got: " + deviationThreshold);
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("'contamination' must be in (0, 0.5], got: " + contamination);
        }
        if (isolationTrees < 1) {
            errors.add("'isolationTrees' must be >= 1, got: " + isolationTrees);
        }
        if (isolationSampleSize < 2) {
            errors.add("'isolationSampleSize' must be >= 2, got: " + isolationSampleSize);
        }
        if (aroonWindow != null && aroonWindow < 2) {
            errors.add("'aroonWindow' must be >= 2, got: " + aroonWindow);
        }
        if (aroonWindow == null && cadenceSeconds > 0 && SECONDS_PER_DAY / cadenceSeconds < 2) {
            errors.add("'cadenceSeconds' of " + cadenceSeconds
                    + " leaves fewer than 2 samples per day; set 'aroonWindow' explicitly");
        }
        if (rollingWindow < 1) {
            errors.add("'rollingWindow' must be >= 1, got: " + rollingWindow);
        }
        if (parallelism < 1) {
            errors.add("'parallelism' must be >= 1, got: " + parallelism);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AnalyticsConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public Duration cadence() {
        return Duration.ofSeconds(cadenceSeconds);
    }

    /**
     * @return configured Aroon window, or the number of samples in one day
     */
    public int effectiveAroonWindow() {
        if (aroonWindow != null) {
            return aroonWindow;
        }
        return (int) (SECONDS_PER_DAY / cadenceSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getCadenceSeconds() {
        return cadenceSeconds;
    }

    public void setCadenceSeconds(long cadenceSeconds) {
        this.cadenceSeconds = cadenceSeconds;
    }

    public double getDeviationThreshold() {
        return deviationThreshold;
    }

    public void setDeviationThreshold(double deviationThreshold) {
        this.deviationThreshold = deviationThreshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    public void setIsolationTrees(int isolationTrees) {
        this.isolationTrees = isolationTrees;
    }

    public int getIsolationSampleSize() {
        return isolationSampleSize;
    }

    public void setIsolationSampleSize(int isolationSampleSize) {
        this.isolationSampleSize = isolationSampleSize;
    }

    public Integer getAroonWindow() {
        return aroonWindow;
    }

    public void setAroonWindow(Integer aroonWindow) {
        this.aroonWindow = aroonWindow;
    }

    public int getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(int rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{" +
                "cadenceSeconds=" + cadenceSeconds +
                ", deviationThreshold=" + deviationThreshold +
                ", contamination=" + contamination +
                ", randomSeed=" + randomSeed +
                ", isolationTrees=" + isolationTrees +
                ", isolationSampleSize=" + isolationSampleSize +
                ", aroonWindow=" + aroonWindow +
                ", rollingWindow=" + rollingWindow +
                ", parallelism=" + parallelism +
                '}';
    }
}
