package com.tracelens.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One difference between a baseline span and its target counterpart.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LatencyDiff.class, name = "latency"),
        @JsonSubTypes.Type(value = ErrorDiff.class, name = "error"),
        @JsonSubTypes.Type(value = StructureDiff.class, name = "structure")
})
public sealed interface SpanDiff permits LatencyDiff, ErrorDiff, StructureDiff {

    String getSpanId();

    String getSpanName();

    double getDiffMs();

    double getDiffPercent();
}
