package com.residencyinsight.core.exception;

/**
 * No usable samples were supplied for the selected system. Fatal for a run.
 */
public class EmptyInputException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
