package com.tracelens.model;

public enum AlertLevel {
    HIGH,
    MEDIUM,
    LOW
}
