package com.tracelens.exception;

public class TelemetryAnalysisException extends RuntimeException {

    public TelemetryAnalysisException(String message) {
        super(message);
    }

    public TelemetryAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
