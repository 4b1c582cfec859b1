/**
 * Orchestration: resampling, concurrent analyzer fan-out, aggregation and
 * caching of resampled series.
 *
 * <p>
 * Entry point is {@link com.residencyinsight.core.pipeline.AnalyticsPipeline}.
 * </p>
 *
 * @since 1.0.0
 */
package com.residencyinsight.core.pipeline;
