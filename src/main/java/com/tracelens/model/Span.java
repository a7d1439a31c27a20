package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Normalized span. {@code start} and {@code end} are null when they could not be recovered,
 * and {@code temporal} is true only when both are present and end is not before start.
 */
@Value
@Builder
public class Span {
    int index;
    String spanId;
    String parentSpanId;
    String name;
    Instant start;
    Instant end;
    SpanStatus status;
    Map<String, Object> attributes;
    boolean temporal;

    public double getDurationMs() {
        if (!temporal) {
            return 0.0;
        }
        return Duration.between(start, end).toNanos() / 1_000_000.0;
    }

    public boolean isError() {
        return status == SpanStatus.ERROR;
    }
}
