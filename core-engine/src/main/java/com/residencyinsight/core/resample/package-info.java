/**
 * Conversion of raw, possibly irregular samples into a uniformly spaced
 * {@link com.residencyinsight.core.model.TimeSeries}.
 */
package com.residencyinsight.core.resample;
