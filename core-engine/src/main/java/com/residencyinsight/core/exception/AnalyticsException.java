package com.residencyinsight.core.exception;

/**
 * Base exception for analytics failures.
 */
public class AnalyticsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
