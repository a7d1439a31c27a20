package com.tracelens.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Raw span as delivered by a trace store. Timestamps are ISO-8601 strings and may be missing or malformed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanRecord {
    @JsonAlias("span_id")
    private String spanId;
    @JsonAlias("parent_span_id")
    private String parentSpanId;
    private String name;
    @JsonAlias("start_time")
    private String startTime;
    @JsonAlias("end_time")
    private String endTime;
    private String status;
    private Map<String, Object> attributes;
}
