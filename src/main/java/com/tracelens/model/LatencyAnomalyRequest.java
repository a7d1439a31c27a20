package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatencyAnomalyRequest {
    private List<TraceRecord> baselines;
    private TraceRecord target;
}
