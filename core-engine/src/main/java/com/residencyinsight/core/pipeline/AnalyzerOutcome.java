package com.residencyinsight.core.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one analyzer: either a value or the reason it failed.
 *
 * @param <R> analyzer result type
 */
public final class AnalyzerOutcome<R> {

    private final String analyzerName;
    private final R result;
    private final String failure;

    private AnalyzerOutcome(String analyzerName, R result, String failure) {
        this.analyzerName = Objects.requireNonNull(analyzerName, "analyzerName must not be null");
        this.result = result;
        this.failure = failure;
    }

    public static <R> AnalyzerOutcome<R> success(String analyzerName, R result) {
        return new AnalyzerOutcome<>(analyzerName,
                Objects.requireNonNull(result, "result must not be null"), null);
    }

    public static <R> AnalyzerOutcome<R> failure(String analyzerName, Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        String message = cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
        return new AnalyzerOutcome<>(analyzerName, null, message);
    }

    public String getAnalyzerName() {
        return analyzerName;
    }

    public Optional<R> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    @Override
    public String toString() {
        return "AnalyzerOutcome{" + analyzerName + (isSuccess() ? " ok" : " failed: " + failure) + '}';
    }
}
