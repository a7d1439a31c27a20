package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ZScoreResult {
    private double currentMean;
    private double historicalMean;
    private double historicalStdDev;
    private double zScore;
    private boolean anomalous;
}
