/**
 * JSON rendering of {@link com.residencyinsight.core.model.MetricsReport} for
 * dashboards and other presentation layers.
 */
package com.residencyinsight.core.report;
