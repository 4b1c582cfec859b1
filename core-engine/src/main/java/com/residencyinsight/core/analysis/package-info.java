/**
 * Analytics stages run over a resampled series.
 *
 * <p>
 * All stages implement
 * {@link com.residencyinsight.core.analysis.SeriesAnalyzer} and are created
 * via {@link com.residencyinsight.core.analysis.AnalyzerFactory}:
 * </p>
 * <ul>
 * <li>{@link com.residencyinsight.core.analysis.ZScoreDetector}: global
 * z-score outliers</li>
 * <li>{@link com.residencyinsight.core.analysis.IsolationForestDetector}:
 * unsupervised isolation-forest outliers</li>
 * <li>{@link com.residencyinsight.core.analysis.PeriodicityAnalyzer}:
 * dominant cycle from the magnitude spectrum</li>
 * <li>{@link com.residencyinsight.core.analysis.DiurnalProfiler}: hour-of-day
 * means, peak and trough</li>
 * <li>{@link com.residencyinsight.core.analysis.AroonTrendDetector}: Aroon
 * crossovers</li>
 * </ul>
 *
 * <p>
 * Stages share no state and can run concurrently over the same series.
 * </p>
 *
 * @since 1.0.0
 */
package com.residencyinsight.core.analysis;
