package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A slow connection acquire. Pool gauges are copied from the span attributes when the client reports them.
 */
@Value
@Builder
public class ConnectionPoolFinding implements AntiPatternFinding {
    List<String> spanIds;
    List<String> spanNames;
    int count;
    double totalDurationMs;
    double waitDurationMs;
    String poolSize;
    String activeConnections;
    String waitingRequests;
    Impact impact;
    String recommendation;
}
