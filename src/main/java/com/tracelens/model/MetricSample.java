package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSample {
    private double value;
    private Instant timestamp;

    public static MetricSample of(double value) {
        return new MetricSample(value, null);
    }
}
