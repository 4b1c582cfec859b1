/**
 * Immutable domain model for Residency Insight.
 *
 * <p>
 * Inputs:
 * </p>
 * <ul>
 * <li>{@link com.residencyinsight.core.model.Sample}: raw reading</li>
 * <li>{@link com.residencyinsight.core.model.TimeSeries}: uniformly sampled
 * series produced by the resampler</li>
 * </ul>
 * <p>
 * Analyzer outputs ({@code AnomalyResult}, {@code PeriodicityResult},
 * {@code DiurnalResult}, {@code TrendReversalResult}) are merged into a
 * {@link com.residencyinsight.core.model.MetricsReport}. Every derived array
 * is indexed on the same axis as the series it came from.
 * </p>
 *
 * @since 1.0.0
 */
package com.residencyinsight.core.model;
