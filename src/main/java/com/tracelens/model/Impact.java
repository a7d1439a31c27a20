package com.tracelens.model;

public enum Impact {
    CRITICAL(3),
    HIGH(2),
    MEDIUM(1),
    LOW(0);

    private final int weight;

    Impact(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
