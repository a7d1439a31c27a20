package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class Outlier {
    public enum Direction { HIGH, LOW }

    private int index;
    private double value;
    private Instant timestamp;
    private double zScore;
    private Direction direction;
}
