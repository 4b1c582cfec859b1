package com.residencyinsight.core.analysis;

import com.residencyinsight.core.model.TimeSeries;

import java.util.Objects;

/**
 * Contract for every analytics stage.
 *
 * <p>
 * Implementations are <strong>stateless</strong> pure functions of the series
 * they are given: the same analyzer instance may be invoked concurrently from
 * several threads, and no analyzer observes another's output.
 * </p>
 *
 * @param <R> result type
 */
public interface SeriesAnalyzer<R> {

    /**
     * Analyse a fully defined series.
     *
     * @param series resampled series without undefined values
     * @return the analysis result
     * @throws IllegalArgumentException if the series contains undefined values
     */
    R analyze(TimeSeries series);

    /**
     * Return the name used for this analyzer in logs and in report failures.
     *
     * @return analyzer name
     */
    String getName();

    /**
     * Return the series values after checking that all are defined.
     *
     * @param series   series to check
     * @param analyzer name of the calling analyzer, for the error message
     * @return copy of the values
     * @throws IllegalArgumentException if any value is {@code NaN} or infinite
     */
    static double[] definedValues(TimeSeries series, String analyzer) {
        Objects.requireNonNull(series, "series must not be null");
        if (!series.isFullyDefined()) {
            throw new IllegalArgumentException("Analyzer '" + analyzer
                    + "' requires a fully defined series; trim undefined boundaries first");
        }
        return series.getValues();
    }
}
