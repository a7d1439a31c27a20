package com.tracelens.model;

public enum ErrorChange {
    NEW_ERROR,
    RESOLVED_ERROR
}
