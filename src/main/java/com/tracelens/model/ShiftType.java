package com.tracelens.model;

public enum ShiftType {
    NEW,
    INCREASED,
    DECREASED,
    DISAPPEARED
}
