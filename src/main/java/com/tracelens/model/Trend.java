package com.tracelens.model;

public enum Trend {
    DEGRADING,
    IMPROVING,
    STABLE
}
