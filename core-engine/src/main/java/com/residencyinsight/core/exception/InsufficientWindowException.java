package com.residencyinsight.core.exception;

/**
 * The series is shorter than the indicator window it is evaluated over.
 */
public class InsufficientWindowException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    private final int window;
    private final int length;

    public InsufficientWindowException(int window, int length) {
        super("Series of length " + length + " is shorter than window " + window);
        this.window = window;
        this.length = length;
    }

    public int getWindow() {
        return window;
    }

    public int getLength() {
        return length;
    }
}
