package com.tracelens.model;

public enum MatchStrategy {
    SPAN_ID,
    NAME_AND_ORDINAL
}
