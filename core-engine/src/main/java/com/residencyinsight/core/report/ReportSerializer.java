package com.residencyinsight.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.residencyinsight.core.model.AnomalyResult;
import com.residencyinsight.core.model.AroonPair;
import com.residencyinsight.core.model.DiurnalResult;
import com.residencyinsight.core.model.FrequencySpectrum;
import com.residencyinsight.core.model.MetricsReport;
import com.residencyinsight.core.model.PeriodicityResult;
import com.residencyinsight.core.model.TimeSeries;
import com.residencyinsight.core.model.TrendReversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a {@link MetricsReport} as JSON for the presentation layer.
 *
 * <p>
 * The document has a flat {@code summary} object with the headline numbers
 * and one section per chart-ready array. Absent analyzer results are written
 * as {@code null}; undefined array entries (leading Aroon values, empty
 * hours) are written as {@code null} as well.
 * </p>
 *
 * <pre>
 * {
 *   "system": "...", "start": "2024-01-01T00:00:00", "step": "PT1M",
 *   "summary": { "zScoreAnomalies": 1, "periodHours": 24.0, ... },
 *   "series": { "values": [...], "rollingMean": [...] },
 *   "anomalies": { "zscore": [...], "isolation_forest": [...] },
 *   "spectrum": { "frequencies": [...], "magnitudes": [...] },
 *   "aroon": { "window": 1440, "up": [...], "down": [...], "reversals": [...] },
 *   "hourlyProfile": [...],
 *   "failures": { }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public class ReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializer.class);

    private final ObjectMapper mapper;

    public ReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
    }

    /**
     * @param report report to render
     * @return JSON text
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(MetricsReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize report for system [{}]: {}", report.getLabel(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize report for system '" + report.getLabel() + "'", e);
        }
    }

    /**
     * Build the JSON tree without writing it.
     *
     * @param report report to render
     * @return JSON object
     */
    public ObjectNode toTree(MetricsReport report) {
        Objects.requireNonNull(report, "report must not be null");
        TimeSeries series = report.getSeries();

        ObjectNode root = mapper.createObjectNode();
        root.put("system", report.getLabel());
        root.set("start", mapper.valueToTree(series.getStart()));
        root.set("step", mapper.valueToTree(series.getStep()));
        root.put("samples", series.size());

        root.set("summary", summary(report));

        ObjectNode seriesNode = root.putObject("series");
        seriesNode.set("values", array(series.getValues()));
        seriesNode.set("rollingMean", array(report.getRollingMean()));

        ObjectNode anomalies = root.putObject("anomalies");
        putIndices(anomalies, report.getZScoreAnomalies());
        putIndices(anomalies, report.getIsolationAnomalies());

        Optional<FrequencySpectrum> spectrum = report.getPeriodicity().map(PeriodicityResult::getSpectrum);
        if (spectrum.isPresent()) {
            ObjectNode spectrumNode = root.putObject("spectrum");
            spectrumNode.set("frequencies", array(spectrum.get().getFrequencies()));
            spectrumNode.set("magnitudes", array(spectrum.get().getMagnitudes()));
        } else {
            root.putNull("spectrum");
        }

        Optional<TrendReversalResult> trend = report.getTrendReversals();
        if (trend.isPresent()) {
            AroonPair aroon = trend.get().getIndicator();
            ObjectNode aroonNode = root.putObject("aroon");
            aroonNode.put("window", aroon.getWindow());
            aroonNode.set("up", array(aroon.getUp()));
            aroonNode.set("down", array(aroon.getDown()));
            ArrayNode reversals = aroonNode.putArray("reversals");
            for (int index : trend.get().getReversalIndices()) {
                reversals.add(index);
            }
        } else {
            root.putNull("aroon");
        }

        Optional<DiurnalResult> diurnal = report.getDiurnal();
        if (diurnal.isPresent()) {
            root.set("hourlyProfile", array(diurnal.get().getProfile().getMeans()));
        } else {
            root.putNull("hourlyProfile");
        }

        ObjectNode failures = root.putObject("failures");
        for (Map.Entry<String, String> e : report.getFailures().entrySet()) {
            failures.put(e.getKey(), e.getValue());
        }
        return root;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ObjectNode summary(MetricsReport report) {
        ObjectNode summary = mapper.createObjectNode();
        putNumber(summary, "meanValue", report.getMeanValue());

        Optional<AnomalyResult> zScore = report.getZScoreAnomalies();
        Optional<AnomalyResult> isolation = report.getIsolationAnomalies();
        summary.put("zScoreAnomalies", zScore.map(AnomalyResult::getCount).orElse(null));
        summary.put("zScoreRate", zScore.map(AnomalyResult::getRate).orElse(null));
        summary.put("isolationAnomalies", isolation.map(AnomalyResult::getCount).orElse(null));
        summary.put("isolationRate", isolation.map(AnomalyResult::getRate).orElse(null));
        if (report.getOverlapCount().isPresent()) {
            summary.put("sharedAnomalies", report.getOverlapCount().getAsInt());
        } else {
            summary.putNull("sharedAnomalies");
        }

        summary.put("periodHours", report.getPeriodicity().map(PeriodicityResult::getPeriodHours).orElse(null));
        summary.put("peakHour", report.getDiurnal().map(DiurnalResult::getPeakHour).orElse(null));
        summary.put("troughHour", report.getDiurnal().map(DiurnalResult::getTroughHour).orElse(null));
        summary.put("trendReversals",
                report.getTrendReversals().map(TrendReversalResult::getReversalCount).orElse(null));
        return summary;
    }

    private static void putIndices(ObjectNode parent, Optional<AnomalyResult> result) {
        if (result.isEmpty()) {
            return;
        }
        ArrayNode indices = parent.putArray(result.get().getDetectorName());
        for (int index : result.get().getFlags().flaggedIndices()) {
            indices.add(index);
        }
    }

    private static void putNumber(ObjectNode node, String field, double value) {
        if (Double.isFinite(value)) {
            node.put(field, value);
        } else {
            node.putNull(field);
        }
    }

    private ArrayNode array(double[] values) {
        ArrayNode node = mapper.createArrayNode();
        for (double v : values) {
            if (Double.isFinite(v)) {
                node.add(v);
            } else {
                node.addNull();
            }
        }
        return node;
    }
}
