package com.residencyinsight.core.pipeline;

import com.residencyinsight.core.model.Sample;
import com.residencyinsight.core.model.TimeSeries;
import com.residencyinsight.core.resample.Resampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Read-through cache of resampled series keyed by source, system and cadence.
 *
 * <p>
 * Series are immutable, so a cached instance can be handed to any number of
 * concurrent pipeline runs. A loader that throws leaves nothing cached.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesCache {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCache.class);

    private final ConcurrentMap<Key, TimeSeries> entries = new ConcurrentHashMap<>();

    /**
     * Return the cached series, loading and resampling it on first use.
     *
     * @param source identifier of the data source (e.g. a file name)
     * @param system system label
     * @param step   resampling cadence
     * @param loader supplies the raw samples on a cache miss
     * @return resampled series
     */
    public TimeSeries getOrResample(String source, String system, Duration step, Supplier<List<Sample>> loader) {
        Objects.requireNonNull(loader, "loader must not be null");
        Key key = new Key(source, system, step);
        return entries.computeIfAbsent(key, k -> {
            LOG.debug("Cache miss for {}, loading samples", k);
            return Resampler.resample(system, loader.get(), step);
        });
    }

    /**
     * Drop every cadence cached for one system of one source.
     *
     * @return number of entries removed
     */
    public int invalidate(String source, String system) {
        int before = entries.size();
        entries.keySet().removeIf(k -> k.source.equals(source) && k.system.equals(system));
        int removed = before - entries.size();
        LOG.debug("Invalidated {} cached series for source '{}', system '{}'", removed, source, system);
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static final class Key {
        private final String source;
        private final String system;
        private final Duration step;

        Key(String source, String system, Duration step) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            this.system = Objects.requireNonNull(system, "system must not be null");
            this.step = Objects.requireNonNull(step, "step must not be null");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Key that))
                return false;
            return source.equals(that.source) && system.equals(that.system) && step.equals(that.step);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, system, step);
        }

        @Override
        public String toString() {
            return source + "/" + system + "@" + step;
        }
    }
}
