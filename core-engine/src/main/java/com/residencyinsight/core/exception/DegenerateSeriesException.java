package com.residencyinsight.core.exception;

/**
 * The series has no variation, so the requested quantity is undefined.
 */
public class DegenerateSeriesException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public DegenerateSeriesException(String message) {
        super(message);
    }
}
