package com.residencyinsight.core.pipeline;

import com.residencyinsight.core.analysis.AnalyzerFactory;
import com.residencyinsight.core.analysis.SeriesAnalyzer;
import com.residencyinsight.core.config.AnalyticsConfig;
import com.residencyinsight.core.exception.EmptyInputException;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.DiurnalResult;
import com.residencyinsight.core.model.MetricsReport;
import com.residencyinsight.core.model.PeriodicityResult;
import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;
import com.residencyinsight.core.model.TrendReversalResult;
import com.residencyinsight.core.resample.Resampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the full analytics battery over one system's samples.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>Resample the raw samples onto the configured cadence (optionally via a
 * {@link SeriesCache}).</li>
 * <li>Trim undefined values from the series boundaries.</li>
 * <li>Run the five analyzers concurrently on the executor.</li>
 * <li>Wait for all of them, then merge the outcomes with
 * {@link MetricsAggregator}.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * <p>
 * An {@link EmptyInputException} aborts the run. Any exception thrown by an
 * individual analyzer is logged and recorded in the report; the remaining
 * analyzers are unaffected.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * When no executor is supplied the pipeline creates a fixed pool of
 * {@link AnalyticsConfig#getParallelism()} daemon threads and shuts it down in
 * {@link #close()}. A supplied executor is never shut down by the pipeline.
 * One pipeline instance can serve concurrent {@code run} calls.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsPipeline.class);

    private final AnalyticsConfig config;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final SeriesCache cache;

    private final SeriesAnalyzer<AnomalyResult> zScore;
    private final SeriesAnalyzer<AnomalyResult> isolation;
    private final SeriesAnalyzer<PeriodicityResult> periodicity;
    private final SeriesAnalyzer<DiurnalResult> diurnal;
    private final SeriesAnalyzer<TrendReversalResult> trend;
    private final MetricsAggregator aggregator;

    /**
     * Create a pipeline with its own worker pool and cache.
     *
     * @param config configuration; validated here
     * @throws IllegalStateException if the configuration is invalid
     */
    public AnalyticsPipeline(AnalyticsConfig config) {
        this(config, null, new SeriesCache());
    }

    /**
     * @param config   configuration; validated here
     * @param executor executor for analyzer tasks, or {@code null} to create one
     * @param cache    cache of resampled series; must not be {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public AnalyticsPipeline(AnalyticsConfig config, ExecutorService executor, SeriesCache cache) {
        this.config = Objects.requireNonNull(config, "AnalyticsConfig must not be null");
        config.validate();
        this.cache = Objects.requireNonNull(cache, "SeriesCache must not be null");
        this.ownsExecutor = executor == null;
        this.executor = executor != null
                ? executor
                : Executors.newFixedThreadPool(config.getParallelism(), workerThreadFactory());

        this.zScore = AnalyzerFactory.zScore(config);
        this.isolation = AnalyzerFactory.isolationForest(config);
        this.periodicity = AnalyzerFactory.periodicity(config);
        this.diurnal = AnalyzerFactory.diurnal(config);
        this.trend = AnalyzerFactory.trendReversal(config);
        this.aggregator = new MetricsAggregator(config.getRollingWindow());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Resample and analyse raw samples.
     *
     * @param system  system label
     * @param samples raw samples for that system
     * @return the report
     * @throws EmptyInputException if no usable samples are present
     */
    public MetricsReport run(String system, List<Sample> samples) {
        return analyze(Resampler.resample(system, samples, config.cadence()));
    }

    /**
     * Analyse a system whose resampled series is cached per source.
     *
     * @param source data source identifier
     * @param system system label
     * @param loader supplies raw samples on a cache miss
     * @return the report
     * @throws EmptyInputException if no usable samples are present
     */
    public MetricsReport run(String source, String system, Supplier<List<Sample>> loader) {
        return analyze(cache.getOrResample(source, system, config.cadence(), loader));
    }

    /**
     * Analyse an already resampled series.
     *
     * @param resampled series, possibly with undefined boundaries
     * @return the report
     * @throws EmptyInputException if no value of the series is defined
     */
    public MetricsReport analyze(TimeSeries resampled) {
        Objects.requireNonNull(resampled, "series must not be null");
        TimeSeries series = resampled.trimUndefined();
        if (series.isEmpty()) {
            throw new EmptyInputException("No defined values for system '" + resampled.getLabel() + "'");
        }
        if (series.size() != resampled.size()) {
            LOG.debug("System [{}]: trimmed {} undefined boundary sample(s)",
                    series.getLabel(), resampled.size() - series.size());
        }

        long started = System.nanoTime();
        CompletableFuture<AnalyzerOutcome<AnomalyResult>> zScoreTask = submit(zScore, series);
        CompletableFuture<AnalyzerOutcome<AnomalyResult>> isolationTask = submit(isolation, series);
        CompletableFuture<AnalyzerOutcome<PeriodicityResult>> periodicityTask = submit(periodicity, series);
        CompletableFuture<AnalyzerOutcome<DiurnalResult>> diurnalTask = submit(diurnal, series);
        CompletableFuture<AnalyzerOutcome<TrendReversalResult>> trendTask = submit(trend, series);

        CompletableFuture.allOf(zScoreTask, isolationTask, periodicityTask, diurnalTask, trendTask).join();
        LOG.debug("System [{}]: analyzers finished in {} ms", series.getLabel(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        return aggregator.aggregate(series,
                zScoreTask.join(),
                isolationTask.join(),
                periodicityTask.join(),
                diurnalTask.join(),
                trendTask.join());
    }

    public AnalyticsConfig getConfig() {
        return config;
    }

    public SeriesCache getCache() {
        return cache;
    }

    /**
     * Shut down the worker pool if this pipeline created it.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <R> CompletableFuture<AnalyzerOutcome<R>> submit(SeriesAnalyzer<R> analyzer, TimeSeries series) {
        return CompletableFuture
                .supplyAsync(() -> AnalyzerOutcome.success(analyzer.getName(), analyzer.analyze(series)), executor)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    LOG.warn("System [{}]: analyzer '{}' failed: {}",
                            series.getLabel(), analyzer.getName(), cause.getMessage(), cause);
                    return AnalyzerOutcome.failure(analyzer.getName(), cause);
                });
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "analytics-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
