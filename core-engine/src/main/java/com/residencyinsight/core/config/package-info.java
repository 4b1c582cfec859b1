/**
 * Configuration loading and validation for the analytics engine.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.residencyinsight.core.config.ConfigLoader} into an
 * {@link com.residencyinsight.core.config.AnalyticsConfig}, which is then
 * passed explicitly to every analyzer.
 * </p>
 *
 * @since 1.0.0
 */
package com.residencyinsight.core.config;
