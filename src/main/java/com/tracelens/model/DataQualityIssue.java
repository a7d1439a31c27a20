package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DataQualityIssue {
    private IssueKind kind;
    private String spanId;
    private String message;
}
