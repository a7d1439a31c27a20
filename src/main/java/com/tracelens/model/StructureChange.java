package com.tracelens.model;

public enum StructureChange {
    ADDED,
    REMOVED
}
