package com.tracelens.model;

public enum IssueKind {
    ORPHANED_SPAN,
    NEGATIVE_DURATION,
    CLOCK_SKEW,
    MALFORMED_SPAN,
    CYCLIC_REFERENCE
}
