package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class CriticalPathReport {
    private List<CriticalPathNode> nodes;
    private double criticalPathDurationMs;
    private double totalDurationMs;
    private double totalWorkMs;
    private double parallelismRatio;
    private double parallelismPct;
    private CriticalPathNode bottleneck;
    private Map<String, Double> selfTimes;

    public boolean contains(String spanId) {
        return nodes.stream().anyMatch(n -> n.getSpanId().equals(spanId));
    }
}
