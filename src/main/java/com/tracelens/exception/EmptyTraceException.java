package com.tracelens.exception;

/**
 * Raised when a trace holds no usable spans. Fatal for the analysis that needed the trace.
 */
public class EmptyTraceException extends TelemetryAnalysisException {

    private final String traceId;

    public EmptyTraceException(String traceId) {
        super("Trace " + (traceId != null ? traceId : "<unknown>") + " contains no usable spans");
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}
