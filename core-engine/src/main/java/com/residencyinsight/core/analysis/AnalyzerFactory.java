package com.residencyinsight.core.analysis;

import com.residencyinsight.core.config.AnalyticsConfig;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.DiurnalResult;
import com.residencyinsight.core.model.PeriodicityResult;
import com.residencyinsight.core.model.TrendReversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link SeriesAnalyzer} instances from an {@link AnalyticsConfig}.
 *
 * <p>
 * This is the single place where configuration values are mapped onto analyzer
 * parameters. Analyzers never read configuration themselves.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyzerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerFactory.class);

    /** Names of every analyzer, in report order. */
    public static final List<String> ANALYZER_NAMES = List.of(
            ZScoreDetector.NAME,
            IsolationForestDetector.NAME,
            PeriodicityAnalyzer.NAME,
            DiurnalProfiler.NAME,
            AroonTrendDetector.NAME);

    private AnalyzerFactory() {
        // utility class
    }

    public static SeriesAnalyzer<AnomalyResult> zScore(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        return new ZScoreDetector(config.getDeviationThreshold());
    }

    public static SeriesAnalyzer<AnomalyResult> isolationForest(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        return new IsolationForestDetector(config.getContamination(), config.getIsolationTrees(),
                config.getIsolationSampleSize(), config.getRandomSeed());
    }

    public static SeriesAnalyzer<PeriodicityResult> periodicity(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        return new PeriodicityAnalyzer();
    }

    public static SeriesAnalyzer<DiurnalResult> diurnal(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        return new DiurnalProfiler();
    }

    public static SeriesAnalyzer<TrendReversalResult> trendReversal(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        return new AroonTrendDetector(config.effectiveAroonWindow());
    }

    /**
     * Create an analyzer by name.
     *
     * @param name   one of {@link #ANALYZER_NAMES}, case-insensitive
     * @param config configuration; must not be {@code null}
     * @return the analyzer
     * @throws IllegalArgumentException if the name is unknown
     */
    public static SeriesAnalyzer<?> create(String name, AnalyticsConfig config) {
        Objects.requireNonNull(name, "Analyzer name must not be null");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case ZScoreDetector.NAME -> zScore(config);
            case IsolationForestDetector.NAME -> isolationForest(config);
            case PeriodicityAnalyzer.NAME -> periodicity(config);
            case DiurnalProfiler.NAME -> diurnal(config);
            case AroonTrendDetector.NAME -> trendReversal(config);
            default -> throw new IllegalArgumentException(
                    "Unknown analyzer: '" + name + "'. Supported: " + String.join(", ", ANALYZER_NAMES));
        };
    }

    /**
     * Create every analyzer.
     *
     * @param config configuration; must not be {@code null}
     * @return unmodifiable list, one analyzer per entry of {@link #ANALYZER_NAMES}
     */
    public static List<SeriesAnalyzer<?>> createAll(AnalyticsConfig config) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        LOG.info("Creating {} analyzer(s) from {}", ANALYZER_NAMES.size(), config);
        return ANALYZER_NAMES.stream()
                .<SeriesAnalyzer<?>>map(name -> create(name, config))
                .toList();
    }
}
