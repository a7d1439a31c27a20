package com.tracelens.exception;

/**
 * Raised when a statistical analysis has fewer samples than it needs.
 * Callers skip that analysis and keep going.
 */
public class InsufficientDataException extends TelemetryAnalysisException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String analysis, int required, int actual) {
        super(String.format("%s needs at least %d samples, got %d", analysis, required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
