package com.tracelens.model;

public enum SpanPatternType {
    RECURRING_SLOWDOWN,
    INTERMITTENT,
    HIGH_VARIANCE
}
